package com.example.villages.authz.model;

import com.example.villages.authz.condition.AccessCondition;

import java.util.Objects;

/**
 * A single (condition, level) entry of a rule table.
 */
public record AccessRule(
        AccessCondition condition,
        AccessLevel accessLevel,
        String description
) {
    public AccessRule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(accessLevel, "accessLevel");
        if (description == null) {
            description = "";
        }
    }

    public static AccessRule of(AccessCondition condition, AccessLevel level, String description) {
        return new AccessRule(condition, level, description);
    }
}
