package com.example.villages.authz.config;

import com.example.villages.authz.condition.AccessCondition;
import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.AccessRule;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.authz.rules.DefaultRuleSets;
import com.example.villages.authz.rules.RuleSetRegistry;
import com.example.villages.config.properties.AuthzProperties;
import com.example.villages.config.properties.AuthzProperties.ConditionDefinition;
import com.example.villages.config.properties.AuthzProperties.RuleDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AccessRuleConfig")
class AccessRuleConfigTest {

    private final RuleSetRegistry defaults = DefaultRuleSets.registry();

    @Test
    @DisplayName("should use the built-in tables when nothing is configured")
    void shouldUseDefaultsWithoutOverrides() {
        RuleSetRegistry registry = new AccessRuleConfig()
                .ruleSetRegistry(new AuthzProperties(null, null));

        assertThat(registry.asMap()).isEqualTo(defaults.asMap());
    }

    @Test
    @DisplayName("should replace exactly the configured type's table")
    void shouldReplaceOnlyConfiguredType() {
        Map<ResourceType, List<RuleDefinition>> overrides = Map.of(ResourceType.NOTIFICATION, List.of(
                new RuleDefinition(fact("isAdmin"), AccessLevel.ADMIN, "Admins manage notifications"),
                new RuleDefinition(
                        new ConditionDefinition(null, List.of(fact("isFamilyAdmin"), fact("isFamilyMember")), null, null),
                        AccessLevel.READ,
                        "Family admins read")));

        RuleSetRegistry registry = AccessRuleConfig.buildRegistry(defaults, overrides);

        assertThat(registry.rulesFor(ResourceType.NOTIFICATION)).containsExactly(
                AccessRule.of(AccessCondition.isAdmin(), AccessLevel.ADMIN, "Admins manage notifications"),
                AccessRule.of(
                        AccessCondition.and(AccessCondition.isFamilyAdmin(), AccessCondition.isFamilyMember()),
                        AccessLevel.READ,
                        "Family admins read"));

        for (ResourceType type : ResourceType.values()) {
            if (type != ResourceType.NOTIFICATION) {
                assertThat(registry.rulesFor(type)).isEqualTo(defaults.rulesFor(type));
            }
        }
    }

    @Test
    @DisplayName("should allow disabling a type with an empty table")
    void shouldAllowEmptyTable() {
        RuleSetRegistry registry = AccessRuleConfig.buildRegistry(
                defaults, Map.of(ResourceType.ACTIVITY, List.of()));

        assertThat(registry.isRegistered(ResourceType.ACTIVITY)).isTrue();
        assertThat(registry.rulesFor(ResourceType.ACTIVITY)).isEmpty();
    }

    @Nested
    @DisplayName("Condition mapping")
    class ConditionMapping {

        @Test
        @DisplayName("should map nested or and none nodes onto the condition tree")
        void shouldMapNestedCombinators() {
            ConditionDefinition definition = new ConditionDefinition(null, null, List.of(
                    fact("isOwner"),
                    new ConditionDefinition(null, null, null, List.of(fact(" isSystemResource ")))), null);

            assertThat(AccessRuleConfig.toCondition(definition)).isEqualTo(AccessCondition.or(
                    AccessCondition.isOwner(),
                    AccessCondition.not(AccessCondition.isSystemResource())));
        }

        @Test
        @DisplayName("should negate the disjunction when none lists several conditions")
        void shouldNegateDisjunctionOfNoneList() {
            ConditionDefinition definition = new ConditionDefinition(
                    null, null, null, List.of(fact("isPublic"), fact("isSystemResource")));

            assertThat(AccessRuleConfig.toCondition(definition)).isEqualTo(AccessCondition.not(
                    AccessCondition.or(AccessCondition.isPublic(), AccessCondition.isSystemResource())));
        }

        @Test
        @DisplayName("should reject an unknown fact")
        void shouldRejectUnknownFact() {
            assertThatThrownBy(() -> AccessRuleConfig.toCondition(fact("isSuperUser")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("isSuperUser");
        }

        @Test
        @DisplayName("should reject a node with no field set")
        void shouldRejectEmptyNode() {
            assertThatThrownBy(() -> AccessRuleConfig.toCondition(new ConditionDefinition(null, null, null, null)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("exactly one");
        }

        @Test
        @DisplayName("should reject a node with two fields set")
        void shouldRejectAmbiguousNode() {
            ConditionDefinition definition = new ConditionDefinition(
                    "isAdmin", List.of(fact("isOwner")), null, null);

            assertThatThrownBy(() -> AccessRuleConfig.toCondition(definition))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should fail at startup when a configured rule is malformed")
        void shouldFailOnMalformedRule() {
            Map<ResourceType, List<RuleDefinition>> overrides = Map.of(ResourceType.DOCUMENT, List.of(
                    new RuleDefinition(fact("isAdmin"), AccessLevel.ADMIN, "ok"),
                    new RuleDefinition(null, AccessLevel.READ, "missing condition")));

            assertThatThrownBy(() -> AccessRuleConfig.buildRegistry(defaults, overrides))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("missing condition");
        }
    }

    @Test
    @DisplayName("should default a missing level to NONE")
    void shouldDefaultMissingLevel() {
        RuleDefinition definition = new RuleDefinition(fact("isPublic"), null, null);

        assertThat(definition.level()).isEqualTo(AccessLevel.NONE);
        assertThat(definition.description()).isEmpty();
    }

    private static ConditionDefinition fact(String name) {
        return ConditionDefinition.ofFact(name);
    }
}
