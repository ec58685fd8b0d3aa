package com.example.villages.authz.rules;

import com.example.villages.authz.model.AccessRule;
import com.example.villages.authz.model.ResourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-resource-type rule tables.
 *
 * <p>Immutable once built, so it can be shared across request threads without locking.
 * Replacing a type's table is only possible through {@link #toBuilder()}, which yields
 * a new registry; this is a configuration-time operation, never a runtime one.
 */
public final class RuleSetRegistry {

    private final Map<ResourceType, List<AccessRule>> rules;

    private RuleSetRegistry(Map<ResourceType, List<AccessRule>> rules) {
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RuleSetRegistry empty() {
        return builder().build();
    }

    /**
     * Rules for a type in registration order. Empty when the type is unregistered.
     */
    public List<AccessRule> rulesFor(ResourceType type) {
        return type == null ? List.of() : rules.getOrDefault(type, List.of());
    }

    public boolean isRegistered(ResourceType type) {
        return type != null && rules.containsKey(type);
    }

    public Map<ResourceType, List<AccessRule>> asMap() {
        return rules;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.rules.putAll(rules);
        return builder;
    }

    public static final class Builder {

        private final Map<ResourceType, List<AccessRule>> rules = new EnumMap<>(ResourceType.class);

        private Builder() {
        }

        /**
         * Register (or replace) the full rule table for a type.
         */
        public Builder register(ResourceType type, List<AccessRule> typeRules) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(typeRules, "rules");
            rules.put(type, List.copyOf(typeRules));
            return this;
        }

        public Builder register(ResourceType type, AccessRule... typeRules) {
            return register(type, List.of(typeRules));
        }

        public Builder remove(ResourceType type) {
            rules.remove(type);
            return this;
        }

        public RuleSetRegistry build() {
            return new RuleSetRegistry(rules);
        }
    }
}
