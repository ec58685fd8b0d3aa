package com.example.villages.authz.condition;

import com.example.villages.authz.condition.AccessCondition.AllOf;
import com.example.villages.authz.condition.AccessCondition.AnyOf;
import com.example.villages.authz.condition.AccessCondition.FactCondition;
import com.example.villages.authz.condition.AccessCondition.Not;
import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.UserRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Evaluates a condition tree against an {@link AccessContext}.
 *
 * <p>Pure and deterministic: every fact must already be present in the context.
 * Anything not recognised evaluates to {@code false}.
 */
@Slf4j
@Component
public class ConditionEvaluator {

    public boolean evaluate(AccessContext context, AccessCondition condition) {
        if (condition instanceof FactCondition leaf) {
            return evaluateFact(context, leaf.fact());
        }
        if (condition instanceof AllOf all) {
            return all.conditions().stream().allMatch(c -> evaluate(context, c));
        }
        if (condition instanceof AnyOf any) {
            return any.conditions().stream().anyMatch(c -> evaluate(context, c));
        }
        if (condition instanceof Not not) {
            return !evaluate(context, not.condition());
        }

        log.warn("Unknown access condition {} evaluated as false",
                condition != null ? condition.getClass().getName() : "null");
        return false;
    }

    private boolean evaluateFact(AccessContext context, Fact fact) {
        return switch (fact) {
            case IS_ADMIN -> context.userRole() == UserRole.ADMIN;
            case IS_OWNER -> context.hasResourceOwner()
                    && context.userId().equals(context.resourceOwnerId());
            case IS_FAMILY_MEMBER -> context.hasFamily()
                    && context.familyId().equals(context.resourceFamilyId());
            // Role only, not scoped to the resource family
            case IS_FAMILY_ADMIN -> context.familyRole() != null
                    && context.familyRole().isFamilyAdmin();
            case IS_PUBLIC -> context.resourcePublic();
            case IS_SYSTEM_RESOURCE -> !context.hasResourceFamily();
        };
    }
}
