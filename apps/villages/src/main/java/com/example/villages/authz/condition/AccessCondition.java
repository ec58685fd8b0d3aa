package com.example.villages.authz.condition;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Boolean expression tree over {@link com.example.villages.authz.model.AccessContext} facts.
 *
 * <p>The hierarchy is closed: a condition is a {@link FactCondition} leaf or one of the
 * {@link AllOf}, {@link AnyOf}, {@link Not} combinators. Trees are immutable and built
 * bottom-up, so they are always finite and acyclic.
 *
 * <pre>{@code
 * AccessCondition familyEditor = AccessCondition.and(
 *         AccessCondition.isFamilyAdmin(),
 *         AccessCondition.isFamilyMember());
 * }</pre>
 */
public sealed interface AccessCondition
        permits AccessCondition.FactCondition, AccessCondition.AllOf, AccessCondition.AnyOf, AccessCondition.Not {

    /**
     * Compact rendering used in startup logs.
     */
    String toExpression();

    record FactCondition(Fact fact) implements AccessCondition {
        public FactCondition {
            Objects.requireNonNull(fact, "fact");
        }

        @Override
        public String toExpression() {
            return fact.expressionName();
        }
    }

    /**
     * True when every child is true. An empty list is vacuously true.
     */
    record AllOf(List<AccessCondition> conditions) implements AccessCondition {
        public AllOf {
            conditions = List.copyOf(conditions);
        }

        @Override
        public String toExpression() {
            return render("and", conditions);
        }
    }

    /**
     * True when at least one child is true. An empty list is false.
     */
    record AnyOf(List<AccessCondition> conditions) implements AccessCondition {
        public AnyOf {
            conditions = List.copyOf(conditions);
        }

        @Override
        public String toExpression() {
            return render("or", conditions);
        }
    }

    record Not(AccessCondition condition) implements AccessCondition {
        public Not {
            Objects.requireNonNull(condition, "condition");
        }

        @Override
        public String toExpression() {
            return "not(" + condition.toExpression() + ")";
        }
    }

    static AccessCondition isAdmin() {
        return new FactCondition(Fact.IS_ADMIN);
    }

    static AccessCondition isOwner() {
        return new FactCondition(Fact.IS_OWNER);
    }

    static AccessCondition isFamilyMember() {
        return new FactCondition(Fact.IS_FAMILY_MEMBER);
    }

    static AccessCondition isFamilyAdmin() {
        return new FactCondition(Fact.IS_FAMILY_ADMIN);
    }

    static AccessCondition isPublic() {
        return new FactCondition(Fact.IS_PUBLIC);
    }

    static AccessCondition isSystemResource() {
        return new FactCondition(Fact.IS_SYSTEM_RESOURCE);
    }

    static AccessCondition and(AccessCondition... conditions) {
        return new AllOf(List.of(conditions));
    }

    static AccessCondition or(AccessCondition... conditions) {
        return new AnyOf(List.of(conditions));
    }

    static AccessCondition not(AccessCondition condition) {
        return new Not(condition);
    }

    private static String render(String operator, List<AccessCondition> children) {
        return children.stream()
                .map(AccessCondition::toExpression)
                .collect(Collectors.joining(", ", operator + "(", ")"));
    }
}
