package com.example.villages.authz.model;

/**
 * Global platform role of an authenticated user.
 */
public enum UserRole {
    ADMIN,
    VOLUNTEER,
    MEMBER
}
