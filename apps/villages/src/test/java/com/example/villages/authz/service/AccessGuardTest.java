package com.example.villages.authz.service;

import com.example.villages.authz.audit.AuthzAuditEvent;
import com.example.villages.authz.audit.AuthzAuditService;
import com.example.villages.authz.condition.ConditionEvaluator;
import com.example.villages.authz.engine.AccessDecisionEngine;
import com.example.villages.authz.exception.ResourceAccessDeniedException;
import com.example.villages.authz.metrics.AuthzMetrics;
import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.authz.rules.DefaultRuleSets;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static com.example.villages.util.AccessContextTestBuilder.aFamilyMemberOf;
import static com.example.villages.util.AccessContextTestBuilder.anAccessContext;
import static com.example.villages.util.AccessContextTestBuilder.anAdminContext;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccessGuard")
class AccessGuardTest {

    @Mock
    private AuthzAuditService auditService;

    private SimpleMeterRegistry meterRegistry;
    private AccessGuard guard;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        AccessDecisionEngine engine = new AccessDecisionEngine(DefaultRuleSets.registry(), new ConditionEvaluator());
        guard = new AccessGuard(engine, auditService, new AuthzMetrics(meterRegistry));
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("should pass when the level is sufficient")
        void shouldPassWhenSufficient() {
            AccessContext ctx = aFamilyMemberOf("F1").withResourceFamilyId("F1").build();

            assertThatCode(() -> guard.check(ctx, ResourceType.DOCUMENT, Operation.READ))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should throw with required and actual levels when insufficient")
        void shouldThrowWhenInsufficient() {
            AccessContext ctx = aFamilyMemberOf("F1").withUserId("member-7").withResourceFamilyId("F1").build();

            assertThatThrownBy(() -> guard.check(ctx, ResourceType.DOCUMENT, Operation.DELETE))
                    .isInstanceOfSatisfying(ResourceAccessDeniedException.class, denied -> {
                        assertThat(denied.getUserId()).isEqualTo("member-7");
                        assertThat(denied.getResourceType()).isEqualTo(ResourceType.DOCUMENT);
                        assertThat(denied.getOperation()).isEqualTo(Operation.DELETE);
                        assertThat(denied.getRequiredLevel()).isEqualTo(AccessLevel.DELETE);
                        assertThat(denied.getActualLevel()).isEqualTo(AccessLevel.READ);
                    });
        }

        @Test
        @DisplayName("should deny when the custom check fails even if the level is sufficient")
        void shouldDenyWhenCustomCheckFails() {
            AccessContext admin = anAdminContext();

            assertThatThrownBy(() -> guard.check(admin, ResourceType.RESOURCE, Operation.DELETE, ctx -> false))
                    .isInstanceOf(ResourceAccessDeniedException.class)
                    .hasMessageContaining("custom check");
        }

        @Test
        @DisplayName("should record metrics and audit for every decision")
        void shouldRecordMetricsAndAudit() {
            AccessContext ctx = anAccessContext().build();

            assertThatThrownBy(() -> guard.check(ctx, ResourceType.NOTIFICATION, Operation.READ))
                    .isInstanceOf(ResourceAccessDeniedException.class);
            guard.check(anAdminContext(), ResourceType.NOTIFICATION, Operation.READ);

            assertThat(meterRegistry.get("authz.decision")
                    .tag("source", AuthzAuditEvent.SOURCE_RULES)
                    .tag("outcome", "denied")
                    .tag("resource_type", "NOTIFICATION")
                    .counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("authz.decision")
                    .tag("outcome", "allowed")
                    .counter().count()).isEqualTo(1.0);
            verify(auditService).logRuleDecision(
                    eq(ctx), eq(ResourceType.NOTIFICATION), eq(Operation.READ), any(), eq(false), isNull());
        }
    }

    @Nested
    @DisplayName("guard")
    class Guard {

        @Test
        @DisplayName("should run the handler when allowed")
        void shouldRunHandlerWhenAllowed() {
            AccessContext owner = anAccessContext().ownedByCaller().build();

            StepVerifier.create(guard.guard(owner, ResourceType.CARE_PLAN, Operation.UPDATE, () -> Mono.just("updated")))
                    .expectNext("updated")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should never invoke the handler when denied")
        void shouldNotInvokeHandlerWhenDenied() {
            AtomicInteger invocations = new AtomicInteger();
            AccessContext stranger = anAccessContext().withResourceOwnerId("other").build();

            Mono<String> guarded = guard.guard(stranger, ResourceType.CARE_PLAN, Operation.DELETE, () -> {
                invocations.incrementAndGet();
                return Mono.just("deleted");
            });

            StepVerifier.create(guarded)
                    .expectError(ResourceAccessDeniedException.class)
                    .verify();
            assertThat(invocations).hasValue(0);
        }

        @Test
        @DisplayName("should evaluate lazily at subscription time")
        void shouldEvaluateLazily() {
            AtomicInteger invocations = new AtomicInteger();

            Mono<String> guarded = guard.guard(anAdminContext(), ResourceType.FAMILY, Operation.CREATE, () -> {
                invocations.incrementAndGet();
                return Mono.just("created");
            });

            assertThat(invocations).hasValue(0);
            StepVerifier.create(guarded).expectNext("created").verifyComplete();
            assertThat(invocations).hasValue(1);
        }

        @Test
        @DisplayName("should apply the custom check before the handler")
        void shouldApplyCustomCheck() {
            AtomicInteger invocations = new AtomicInteger();
            AccessContext owner = anAccessContext().ownedByCaller().build();

            Mono<String> guarded = guard.guard(owner, ResourceType.ACTIVITY, Operation.READ,
                    ctx -> ctx.hasFamily(),
                    () -> {
                        invocations.incrementAndGet();
                        return Mono.just("activity");
                    });

            StepVerifier.create(guarded)
                    .expectError(ResourceAccessDeniedException.class)
                    .verify();
            assertThat(invocations).hasValue(0);
        }

        @Test
        @DisplayName("guardMany should emit an error instead of items when denied")
        void guardManyShouldErrorWhenDenied() {
            AccessContext ctx = anAccessContext().build();

            StepVerifier.create(guard.guardMany(ctx, ResourceType.MESSAGE, Operation.READ, () -> Flux.just("a", "b")))
                    .expectError(ResourceAccessDeniedException.class)
                    .verify();
        }
    }
}
