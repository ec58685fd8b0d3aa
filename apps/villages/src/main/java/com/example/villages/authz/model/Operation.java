package com.example.villages.authz.model;

/**
 * CRUD verb a handler performs on an entity.
 */
public enum Operation {
    CREATE,
    READ,
    UPDATE,
    DELETE;

    /**
     * Access level required to perform this operation.
     */
    public AccessLevel requiredLevel() {
        return switch (this) {
            case CREATE, UPDATE -> AccessLevel.WRITE;
            case DELETE -> AccessLevel.DELETE;
            case READ -> AccessLevel.READ;
        };
    }
}
