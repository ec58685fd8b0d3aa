package com.example.villages.authz.model;

import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * Fact bundle a single access decision is computed from: the acting user plus the
 * attributes of the resource being touched. Built fresh per call, never persisted.
 *
 * <p>Blank optional identifiers are normalised to {@code null} so that "unset" has one
 * representation for the condition leaves.
 */
public record AccessContext(
        String userId,
        UserRole userRole,
        @Nullable String familyId,
        @Nullable FamilyRole familyRole,
        @Nullable String resourceOwnerId,
        @Nullable String resourceFamilyId,
        boolean resourcePublic
) {
    public AccessContext {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(userRole, "userRole");
        familyId = blankToNull(familyId);
        resourceOwnerId = blankToNull(resourceOwnerId);
        resourceFamilyId = blankToNull(resourceFamilyId);
    }

    /**
     * Create a context for a user with no resource attributes yet (e.g. create operations).
     */
    public static AccessContext forUser(
            String userId,
            UserRole userRole,
            @Nullable String familyId,
            @Nullable FamilyRole familyRole) {
        return new AccessContext(userId, userRole, familyId, familyRole, null, null, false);
    }

    /**
     * Copy of this context describing the given resource.
     */
    public AccessContext withResource(
            @Nullable String ownerId,
            @Nullable String ownerFamilyId,
            boolean isPublic) {
        return new AccessContext(userId, userRole, familyId, familyRole, ownerId, ownerFamilyId, isPublic);
    }

    public boolean hasFamily() {
        return familyId != null;
    }

    public boolean hasResourceOwner() {
        return resourceOwnerId != null;
    }

    public boolean hasResourceFamily() {
        return resourceFamilyId != null;
    }

    @Nullable
    private static String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
