package com.example.villages.config.properties;

import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.ResourceType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Authorization settings.
 *
 * <pre>
 * app:
 *   authz:
 *     audit:
 *       enabled: true
 *     rules:
 *       NOTIFICATION:
 *         - condition:
 *             fact: isAdmin
 *           level: ADMIN
 *           description: Admins manage notifications
 *         - condition:
 *             and:
 *               - fact: isFamilyAdmin
 *               - fact: isFamilyMember
 *           level: READ
 * </pre>
 *
 * <p>Each entry under {@code rules} replaces the built-in table of that resource type
 * when the application starts.
 */
@ConfigurationProperties(prefix = "app.authz")
public record AuthzProperties(
        AuditProperties audit,
        Map<ResourceType, List<RuleDefinition>> rules
) {
    public AuthzProperties {
        if (audit == null) {
            audit = new AuditProperties(true);
        }
        if (rules == null) {
            rules = Map.of();
        }
    }

    public record AuditProperties(
            boolean enabled
    ) {}

    public record RuleDefinition(
            ConditionDefinition condition,
            AccessLevel level,
            String description
    ) {
        public RuleDefinition {
            if (level == null) {
                level = AccessLevel.NONE;
            }
            if (description == null) {
                description = "";
            }
        }
    }

    /**
     * One node of a configured condition. Exactly one of the fields is set:
     * a leaf {@code fact} such as {@code isFamilyMember}, or the {@code and}, {@code or}
     * or {@code none} (true when none of the listed conditions holds) combinators.
     */
    public record ConditionDefinition(
            String fact,
            List<ConditionDefinition> and,
            List<ConditionDefinition> or,
            List<ConditionDefinition> none
    ) {
        public ConditionDefinition {
            and = and == null ? List.of() : List.copyOf(and);
            or = or == null ? List.of() : List.copyOf(or);
            none = none == null ? List.of() : List.copyOf(none);
        }

        public static ConditionDefinition ofFact(String fact) {
            return new ConditionDefinition(fact, null, null, null);
        }
    }
}
