package com.example.villages.authz.engine;

import com.example.villages.authz.condition.ConditionEvaluator;
import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.AccessDetails;
import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.AccessRule;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.authz.rules.RuleSetRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based access decisions.
 *
 * <p>Combining algorithm: highest level wins.
 * - Every rule registered for the resource type is evaluated; there is no short-circuit
 * - The result is the maximum level over all matching rules
 * - No match, or an unregistered type, yields {@link AccessLevel#NONE}
 */
@Slf4j
@Component
public class AccessDecisionEngine {

    private final RuleSetRegistry registry;
    private final ConditionEvaluator evaluator;

    public AccessDecisionEngine(RuleSetRegistry registry, ConditionEvaluator evaluator) {
        this.registry = registry;
        this.evaluator = evaluator;
    }

    /**
     * Highest access level the context satisfies for the resource type.
     */
    public AccessLevel getUserAccessLevel(AccessContext context, ResourceType resourceType) {
        AccessLevel highest = AccessLevel.NONE;
        for (AccessRule rule : registry.rulesFor(resourceType)) {
            if (evaluator.evaluate(context, rule.condition())) {
                highest = AccessLevel.max(highest, rule.accessLevel());
            }
        }
        return highest;
    }

    /**
     * Check if the context reaches the required level. Unregistered types never do.
     */
    public boolean hasAccess(AccessContext context, ResourceType resourceType, AccessLevel requiredLevel) {
        if (!registry.isRegistered(resourceType)) {
            log.debug("No rules registered for {}, denying user {}", resourceType, context.userId());
            return false;
        }

        AccessLevel level = getUserAccessLevel(context, resourceType);
        boolean allowed = level.isSufficientFor(requiredLevel);

        log.debug("Access {} for user {} on {}: have={}, need={}",
                allowed ? "granted" : "denied", context.userId(), resourceType, level, requiredLevel);
        return allowed;
    }

    public boolean canPerformOperation(AccessContext context, ResourceType resourceType, Operation operation) {
        return hasAccess(context, resourceType, operation.requiredLevel());
    }

    /**
     * Winning level plus every matched rule, for diagnostics and UI hints. No side effects.
     */
    public AccessDetails getAccessDetails(AccessContext context, ResourceType resourceType) {
        List<AccessRule> rules = registry.rulesFor(resourceType);
        if (rules.isEmpty()) {
            return AccessDetails.none();
        }

        List<AccessRule> matched = new ArrayList<>();
        AccessLevel highest = AccessLevel.NONE;
        for (AccessRule rule : rules) {
            if (evaluator.evaluate(context, rule.condition())) {
                matched.add(rule);
                highest = AccessLevel.max(highest, rule.accessLevel());
            }
        }
        return AccessDetails.of(highest, matched);
    }
}
