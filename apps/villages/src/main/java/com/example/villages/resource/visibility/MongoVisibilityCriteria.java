package com.example.villages.resource.visibility;

import org.springframework.data.mongodb.core.query.Criteria;

import java.util.List;

/**
 * Compiles a {@link VisibilityPredicate} into a MongoDB {@link Criteria} over
 * {@code ResourceDoc} property names.
 */
public final class MongoVisibilityCriteria {

    static final String FIELD_ID = "id";
    static final String FIELD_CREATED_BY = "createdBy";
    static final String FIELD_FAMILY_ID = "familyId";
    static final String FIELD_VISIBILITY = "visibility";
    static final String FIELD_SYSTEM_GENERATED = "systemGenerated";

    private MongoVisibilityCriteria() {
    }

    public static Criteria toCriteria(VisibilityPredicate predicate) {
        if (predicate instanceof VisibilityPredicate.Always) {
            return new Criteria();
        }
        if (predicate instanceof VisibilityPredicate.CreatedBy createdBy) {
            return Criteria.where(FIELD_CREATED_BY).is(createdBy.userId());
        }
        if (predicate instanceof VisibilityPredicate.VisibilityIs visibilityIs) {
            return Criteria.where(FIELD_VISIBILITY).is(visibilityIs.visibility().name());
        }
        if (predicate instanceof VisibilityPredicate.FamilyIs familyIs) {
            return Criteria.where(FIELD_FAMILY_ID).is(familyIs.familyId());
        }
        if (predicate instanceof VisibilityPredicate.IdIn idIn) {
            return idIn.ids().isEmpty() ? matchNothing() : Criteria.where(FIELD_ID).in(idIn.ids());
        }
        if (predicate instanceof VisibilityPredicate.SystemGenerated) {
            return Criteria.where(FIELD_SYSTEM_GENERATED).is(true);
        }
        if (predicate instanceof VisibilityPredicate.AllOf allOf) {
            if (allOf.parts().isEmpty()) {
                return new Criteria();
            }
            return new Criteria().andOperator(compileAll(allOf.parts()));
        }
        if (predicate instanceof VisibilityPredicate.AnyOf anyOf) {
            if (anyOf.parts().isEmpty()) {
                return matchNothing();
            }
            return new Criteria().orOperator(compileAll(anyOf.parts()));
        }
        if (predicate instanceof VisibilityPredicate.Not not) {
            return new Criteria().norOperator(toCriteria(not.part()));
        }
        throw new IllegalArgumentException("Unsupported visibility predicate: " + predicate);
    }

    private static List<Criteria> compileAll(List<VisibilityPredicate> parts) {
        return parts.stream().map(MongoVisibilityCriteria::toCriteria).toList();
    }

    private static Criteria matchNothing() {
        return Criteria.where(FIELD_ID).in(List.of());
    }
}
