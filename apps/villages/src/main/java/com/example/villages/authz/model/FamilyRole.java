package com.example.villages.authz.model;

/**
 * Role of a user inside their family.
 */
public enum FamilyRole {
    PRIMARY_CONTACT,
    FAMILY_ADMIN,
    MEMBER;

    /**
     * PRIMARY_CONTACT and FAMILY_ADMIN both administer the family.
     */
    public boolean isFamilyAdmin() {
        return this == PRIMARY_CONTACT || this == FAMILY_ADMIN;
    }
}
