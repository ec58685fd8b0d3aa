package com.example.villages.resource.visibility;

import com.example.villages.resource.model.ResourceView;
import com.example.villages.resource.model.Visibility;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative filter over resource instances. The same tree is evaluated in memory for a
 * single resource and compiled to a MongoDB query for lists (see {@link MongoVisibilityCriteria}).
 */
public sealed interface VisibilityPredicate {

    boolean test(ResourceView resource);

    static VisibilityPredicate always() {
        return new Always();
    }

    static VisibilityPredicate allOf(VisibilityPredicate... parts) {
        return new AllOf(List.of(parts));
    }

    static VisibilityPredicate anyOf(VisibilityPredicate... parts) {
        return new AnyOf(List.of(parts));
    }

    static VisibilityPredicate anyOf(List<VisibilityPredicate> parts) {
        return new AnyOf(parts);
    }

    static VisibilityPredicate not(VisibilityPredicate part) {
        return new Not(part);
    }

    record Always() implements VisibilityPredicate {
        @Override
        public boolean test(ResourceView resource) {
            return true;
        }
    }

    record CreatedBy(String userId) implements VisibilityPredicate {
        public CreatedBy {
            Objects.requireNonNull(userId, "userId");
        }

        @Override
        public boolean test(ResourceView resource) {
            return resource.isCreatedBy(userId);
        }
    }

    record VisibilityIs(Visibility visibility) implements VisibilityPredicate {
        public VisibilityIs {
            Objects.requireNonNull(visibility, "visibility");
        }

        @Override
        public boolean test(ResourceView resource) {
            return resource.visibility() == visibility;
        }
    }

    /**
     * Resource belongs to the given family. A resource without a family never matches.
     */
    record FamilyIs(String familyId) implements VisibilityPredicate {
        public FamilyIs {
            Objects.requireNonNull(familyId, "familyId");
        }

        @Override
        public boolean test(ResourceView resource) {
            return familyId.equals(resource.familyId());
        }
    }

    record IdIn(Set<String> ids) implements VisibilityPredicate {
        public IdIn {
            ids = Set.copyOf(ids);
        }

        @Override
        public boolean test(ResourceView resource) {
            return resource.id() != null && ids.contains(resource.id());
        }
    }

    record SystemGenerated() implements VisibilityPredicate {
        @Override
        public boolean test(ResourceView resource) {
            return resource.systemGenerated();
        }
    }

    /**
     * Conjunction; empty is true.
     */
    record AllOf(List<VisibilityPredicate> parts) implements VisibilityPredicate {
        public AllOf {
            parts = List.copyOf(parts);
        }

        @Override
        public boolean test(ResourceView resource) {
            return parts.stream().allMatch(part -> part.test(resource));
        }
    }

    /**
     * Disjunction; empty is false.
     */
    record AnyOf(List<VisibilityPredicate> parts) implements VisibilityPredicate {
        public AnyOf {
            parts = List.copyOf(parts);
        }

        @Override
        public boolean test(ResourceView resource) {
            return parts.stream().anyMatch(part -> part.test(resource));
        }
    }

    record Not(VisibilityPredicate part) implements VisibilityPredicate {
        public Not {
            Objects.requireNonNull(part, "part");
        }

        @Override
        public boolean test(ResourceView resource) {
            return !part.test(resource);
        }
    }
}
