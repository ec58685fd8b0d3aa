package com.example.villages.common.exception;

import lombok.Getter;

/**
 * The resource does not exist or is not visible to the caller. The two cases are
 * deliberately indistinguishable to the client.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceId;

    public ResourceNotFoundException(String resourceId) {
        super("Resource not found");
        this.resourceId = resourceId;
    }
}
