package com.example.villages.authz.exception;

import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import lombok.Getter;
import org.springframework.security.access.AccessDeniedException;

// Raised before a guarded handler runs. Surfaced to the caller as-is, never turned into an allow.
@Getter
public class ResourceAccessDeniedException extends AccessDeniedException {

    private final String userId;
    private final ResourceType resourceType;
    private final Operation operation;
    private final AccessLevel requiredLevel;
    private final AccessLevel actualLevel;

    public ResourceAccessDeniedException(String userId, ResourceType resourceType, Operation operation,
            AccessLevel requiredLevel, AccessLevel actualLevel) {
        super(String.format("Access denied: %s on %s requires %s, user has %s",
                operation, resourceType, requiredLevel, actualLevel));
        this.userId = userId;
        this.resourceType = resourceType;
        this.operation = operation;
        this.requiredLevel = requiredLevel;
        this.actualLevel = actualLevel;
    }

    public ResourceAccessDeniedException(String message, String userId, ResourceType resourceType,
            Operation operation) {
        super(message);
        this.userId = userId;
        this.resourceType = resourceType;
        this.operation = operation;
        this.requiredLevel = operation != null ? operation.requiredLevel() : null;
        this.actualLevel = null;
    }
}
