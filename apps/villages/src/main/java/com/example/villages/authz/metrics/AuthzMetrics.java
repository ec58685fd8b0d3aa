package com.example.villages.authz.metrics;

import com.example.villages.authz.audit.AuthzAuditEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Decision counters. Tag values come from closed enums, so cardinality stays bounded.
 */
@Component
public class AuthzMetrics {

    private static final String DECISION_METRIC = "authz.decision";
    private static final String OUTCOME_ALLOWED = "allowed";
    private static final String OUTCOME_DENIED = "denied";

    private final MeterRegistry registry;

    public AuthzMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param source {@link AuthzAuditEvent#SOURCE_RULES} or {@link AuthzAuditEvent#SOURCE_VISIBILITY}
     */
    public void recordDecision(@NonNull String source, @NonNull Enum<?> resourceType, boolean allowed) {
        Counter.builder(DECISION_METRIC)
                .tag("source", source)
                .tag("resource_type", resourceType.name())
                .tag("outcome", allowed ? OUTCOME_ALLOWED : OUTCOME_DENIED)
                .description("Authorization decisions")
                .register(registry)
                .increment();
    }
}
