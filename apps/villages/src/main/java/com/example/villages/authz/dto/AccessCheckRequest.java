package com.example.villages.authz.dto;

import com.example.villages.authz.model.EntityFacts;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AccessCheckRequest(
        @NotNull(message = "resourceType is required")
        ResourceType resourceType,

        @NotNull(message = "operation is required")
        Operation operation,

        @Size(max = 128)
        String resourceOwnerId,

        @Size(max = 128)
        String resourceFamilyId,

        boolean resourcePublic
) {
    public EntityFacts toEntityFacts() {
        return new EntityFacts(null, resourceOwnerId, resourceFamilyId, resourcePublic);
    }
}
