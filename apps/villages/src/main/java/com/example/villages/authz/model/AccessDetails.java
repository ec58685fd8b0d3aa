package com.example.villages.authz.model;

import java.util.List;

/**
 * Diagnostic view of a decision: the winning level and every rule that matched,
 * in rule-table order.
 */
public record AccessDetails(
        AccessLevel accessLevel,
        List<AccessRule> matchedRules,
        boolean canRead,
        boolean canWrite,
        boolean canDelete,
        boolean canAdmin
) {
    public AccessDetails {
        matchedRules = matchedRules == null ? List.of() : List.copyOf(matchedRules);
    }

    public static AccessDetails none() {
        return of(AccessLevel.NONE, List.of());
    }

    public static AccessDetails of(AccessLevel level, List<AccessRule> matchedRules) {
        return new AccessDetails(
                level,
                matchedRules,
                level.isSufficientFor(AccessLevel.READ),
                level.isSufficientFor(AccessLevel.WRITE),
                level.isSufficientFor(AccessLevel.DELETE),
                level.isSufficientFor(AccessLevel.ADMIN)
        );
    }

    public List<String> matchedRuleDescriptions() {
        return matchedRules.stream().map(AccessRule::description).toList();
    }
}
