package com.example.villages.authz.dto;

import com.example.villages.authz.model.EntityFacts;
import com.example.villages.authz.model.ResourceType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Resource facts to evaluate the caller's access against.
 */
public record AccessDetailsRequest(
        @NotNull(message = "resourceType is required")
        ResourceType resourceType,

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
