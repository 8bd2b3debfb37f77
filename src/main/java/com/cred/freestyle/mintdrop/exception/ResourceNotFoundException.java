package com.cred.freestyle.mintdrop.exception;

/**
 * Exception thrown when a requested resource is not found.
 * Generic exception for collections, phases, items, etc.
 *
 * @author Mint Drop Team
 */
public class ResourceNotFoundException extends MintDropException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(MintErrorCode.NOT_FOUND, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
