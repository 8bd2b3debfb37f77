package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.domain.model.Item;

/**
 * @author Mint Drop Team
 */
public class MintedItemDto {

    private String itemId;
    private String name;
    private String imageUri;
    private Integer itemIndex;

    public MintedItemDto() {
    }

    public static MintedItemDto fromEntity(Item item) {
        MintedItemDto dto = new MintedItemDto();
        dto.setItemId(item.getItemId());
        dto.setName(item.getName());
        dto.setImageUri(item.getImageUri());
        dto.setItemIndex(item.getItemIndex());
        return dto;
    }

    // Getters and setters
    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getImageUri() {
        return imageUri;
    }

    public void setImageUri(String imageUri) {
        this.imageUri = imageUri;
    }

    public Integer getItemIndex() {
        return itemIndex;
    }

    public void setItemIndex(Integer itemIndex) {
        this.itemIndex = itemIndex;
    }
}
