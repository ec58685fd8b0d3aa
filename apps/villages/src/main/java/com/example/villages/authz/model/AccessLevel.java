package com.example.villages.authz.model;

/**
 * Ordinal permission tier. Declaration order is the sufficiency order:
 * NONE &lt; READ &lt; WRITE &lt; DELETE &lt; ADMIN.
 */
public enum AccessLevel {
    NONE,
    READ,
    WRITE,
    DELETE,
    ADMIN;

    /**
     * Check if this level satisfies the required level.
     */
    public boolean isSufficientFor(AccessLevel required) {
        return ordinal() >= required.ordinal();
    }

    /**
     * Check if this level is strictly higher than another.
     */
    public boolean isHigherThan(AccessLevel other) {
        return ordinal() > other.ordinal();
    }

    public static AccessLevel max(AccessLevel a, AccessLevel b) {
        return a.isHigherThan(b) ? a : b;
    }
}
