package com.example.villages.authz.model;

import org.springframework.lang.Nullable;

/**
 * Ownership and scope fields of an entity, as fetched by the caller.
 * The uploader, when present, is the owner; otherwise the creator is.
 */
public record EntityFacts(
        @Nullable String uploadedBy,
        @Nullable String createdBy,
        @Nullable String familyId,
        boolean isPublic
) {
    public static EntityFacts none() {
        return new EntityFacts(null, null, null, false);
    }

    public static EntityFacts createdBy(String createdBy, @Nullable String familyId) {
        return new EntityFacts(null, createdBy, familyId, false);
    }

    @Nullable
    public String ownerId() {
        if (uploadedBy != null && !uploadedBy.isBlank()) {
            return uploadedBy;
        }
        return createdBy;
    }
}
