package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.Item;
import com.cred.freestyle.mintdrop.infrastructure.messaging.MintEventPublisher;
import com.cred.freestyle.mintdrop.infrastructure.messaging.events.AssetIssuanceRequest;
import com.cred.freestyle.mintdrop.infrastructure.messaging.events.AssetIssuanceRequest.IssuedItem;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmedMint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Hands confirmed items to an external batch minter through Kafka.
 *
 * @author Mint Drop Team
 */
@Service
public class KafkaAssetIssuer implements AssetIssuer {

    private static final Logger logger = LoggerFactory.getLogger(KafkaAssetIssuer.class);

    private final MintEventPublisher eventPublisher;
    private final boolean enabled;

    public KafkaAssetIssuer(
            MintEventPublisher eventPublisher,
            @Value("${mintdrop.asset-issuance.enabled:true}") boolean enabled
    ) {
        this.eventPublisher = eventPublisher;
        this.enabled = enabled;
    }

    @Override
    public void issue(DropCollection collection, ConfirmedMint mint) {
        if (!enabled) {
            logger.debug("Asset issuance disabled, skipping signature {}",
                    mint.transaction().getTransactionSignature());
            return;
        }

        List<IssuedItem> items = mint.items().stream()
                .map(KafkaAssetIssuer::toIssuedItem)
                .collect(Collectors.toList());

        eventPublisher.publishAssetIssuance(new AssetIssuanceRequest(
                collection.getCollectionId(),
                collection.getCollectionAddress(),
                mint.transaction().getBuyerWallet(),
                mint.transaction().getTransactionSignature(),
                items,
                mint.transaction().getCreatedAt()
        ));
    }

    private static IssuedItem toIssuedItem(Item item) {
        return new IssuedItem(item.getItemId(), item.getItemIndex(), item.getName(), item.getImageUri());
    }
}
