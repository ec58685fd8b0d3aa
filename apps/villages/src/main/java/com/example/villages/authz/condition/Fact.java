package com.example.villages.authz.condition;

import java.util.Arrays;
import java.util.Optional;

/**
 * Leaf facts a condition tree can test. The expression name is the form used in
 * configuration, e.g. {@code isFamilyMember}.
 */
public enum Fact {
    IS_ADMIN("isAdmin"),
    IS_OWNER("isOwner"),
    IS_FAMILY_MEMBER("isFamilyMember"),
    /** Family role only; does not check that the resource belongs to the user's family. */
    IS_FAMILY_ADMIN("isFamilyAdmin"),
    IS_PUBLIC("isPublic"),
    IS_SYSTEM_RESOURCE("isSystemResource");

    private final String expressionName;

    Fact(String expressionName) {
        this.expressionName = expressionName;
    }

    public String expressionName() {
        return expressionName;
    }

    public static Optional<Fact> fromExpressionName(String name) {
        return Arrays.stream(values())
                .filter(f -> f.expressionName.equals(name))
                .findFirst();
    }
}
