package com.syntaxprime.elephant.exception;

/**
 * A referenced thread or knowledge entry does not exist.
 */
public class NotFoundException extends ElephantException {
    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static NotFoundException thread(String threadId) {
        return new NotFoundException("Conversation thread", threadId);
    }

    public static NotFoundException entry(String entryId) {
        return new NotFoundException("Knowledge entry", entryId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
