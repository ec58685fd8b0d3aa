package com.example.villages.authz.model;

import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * The authenticated user a decision is made for, as resolved from the user directory.
 */
public record Viewer(
        String userId,
        UserRole role,
        @Nullable String familyId,
        @Nullable FamilyRole familyRole
) {
    public Viewer {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
        if (familyId != null && familyId.isBlank()) {
            familyId = null;
        }
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isMember() {
        return role == UserRole.MEMBER;
    }

    public boolean hasFamily() {
        return familyId != null;
    }
}
