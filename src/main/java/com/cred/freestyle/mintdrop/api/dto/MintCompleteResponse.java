package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmedMint;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response of a complete call. The same body is returned when the signature is replayed.
 *
 * @author Mint Drop Team
 */
public class MintCompleteResponse {

    private List<MintedItemDto> mintedItems;
    private String transactionSignature;
    private String collectionId;
    private Integer quantity;
    private boolean replay;

    public MintCompleteResponse() {
    }

    public static MintCompleteResponse fromResult(ConfirmedMint result) {
        MintCompleteResponse response = new MintCompleteResponse();
        response.setMintedItems(result.items().stream()
                .map(MintedItemDto::fromEntity)
                .collect(Collectors.toList()));
        response.setTransactionSignature(result.transaction().getTransactionSignature());
        response.setCollectionId(result.transaction().getCollectionId());
        response.setQuantity(result.transaction().getQuantity());
        response.setReplay(result.replay());
        return response;
    }

    // Getters and setters
    public List<MintedItemDto> getMintedItems() {
        return mintedItems;
    }

    public void setMintedItems(List<MintedItemDto> mintedItems) {
        this.mintedItems = mintedItems;
    }

    public String getTransactionSignature() {
        return transactionSignature;
    }

    public void setTransactionSignature(String transactionSignature) {
        this.transactionSignature = transactionSignature;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public void setCollectionId(String collectionId) {
        this.collectionId = collectionId;
    }

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public boolean isReplay() {
        return replay;
    }

    public void setReplay(boolean replay) {
        this.replay = replay;
    }
}
