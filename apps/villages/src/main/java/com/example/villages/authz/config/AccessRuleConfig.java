package com.example.villages.authz.config;

import com.example.villages.authz.condition.AccessCondition;
import com.example.villages.authz.condition.Fact;
import com.example.villages.authz.model.AccessRule;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.authz.rules.DefaultRuleSets;
import com.example.villages.authz.rules.RuleSetRegistry;
import com.example.villages.config.properties.AuthzProperties;
import com.example.villages.config.properties.AuthzProperties.ConditionDefinition;
import com.example.villages.config.properties.AuthzProperties.RuleDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

/**
 * Builds the {@link RuleSetRegistry} once at startup: the built-in tables, with any
 * configured tables replacing them type by type.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AuthzProperties.class)
public class AccessRuleConfig {

    @Bean
    public RuleSetRegistry ruleSetRegistry(AuthzProperties properties) {
        RuleSetRegistry registry = buildRegistry(DefaultRuleSets.registry(), properties.rules());

        log.info("Access rule registry initialized with {} resource types", registry.asMap().size());
        registry.asMap().forEach((type, rules) -> {
            log.debug("  - {}: {} rules", type, rules.size());
            rules.forEach(r -> log.debug("      {} -> {} ({})",
                    r.condition().toExpression(), r.accessLevel(), r.description()));
        });
        return registry;
    }

    static RuleSetRegistry buildRegistry(
            RuleSetRegistry defaults,
            Map<ResourceType, List<RuleDefinition>> overrides) {

        if (overrides.isEmpty()) {
            return defaults;
        }

        RuleSetRegistry.Builder builder = defaults.toBuilder();
        overrides.forEach((type, definitions) -> {
            List<AccessRule> rules = definitions.stream()
                    .map(AccessRuleConfig::toRule)
                    .toList();
            log.info("Replacing built-in rules for {} with {} configured rules", type, rules.size());
            builder.register(type, rules);
        });
        return builder.build();
    }

    private static AccessRule toRule(RuleDefinition definition) {
        if (definition.condition() == null) {
            throw new IllegalArgumentException("Rule '" + definition.description() + "' has no condition");
        }
        return AccessRule.of(
                toCondition(definition.condition()),
                definition.level(),
                definition.description());
    }

    /**
     * Maps a bound condition onto the sealed tree. Fails with {@link IllegalArgumentException}
     * unless exactly one field of each node is set and every fact is known.
     */
    static AccessCondition toCondition(ConditionDefinition definition) {
        int branches = (definition.fact() != null ? 1 : 0)
                + (definition.and().isEmpty() ? 0 : 1)
                + (definition.or().isEmpty() ? 0 : 1)
                + (definition.none().isEmpty() ? 0 : 1);
        if (branches != 1) {
            throw new IllegalArgumentException(
                    "A condition must set exactly one of fact, and, or, none: " + definition);
        }

        if (definition.fact() != null) {
            Fact fact = Fact.fromExpressionName(definition.fact().trim())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown condition fact: " + definition.fact()));
            return new AccessCondition.FactCondition(fact);
        }
        if (!definition.and().isEmpty()) {
            return new AccessCondition.AllOf(toConditions(definition.and()));
        }
        if (!definition.or().isEmpty()) {
            return new AccessCondition.AnyOf(toConditions(definition.or()));
        }
        List<AccessCondition> excluded = toConditions(definition.none());
        return new AccessCondition.Not(excluded.size() == 1 ? excluded.get(0) : new AccessCondition.AnyOf(excluded));
    }

    private static List<AccessCondition> toConditions(List<ConditionDefinition> definitions) {
        return definitions.stream()
                .map(AccessRuleConfig::toCondition)
                .toList();
    }
}
