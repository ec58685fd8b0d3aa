package com.example.villages.authz.aspect;

import com.example.villages.authz.annotation.RequiresAccess;
import com.example.villages.authz.exception.ResourceAccessDeniedException;
import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.service.AccessGuard;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.lang.reflect.Method;

/**
 * Aspect that enforces {@link RequiresAccess} through {@link AccessGuard}.
 *
 * <p>Reactive return types fail with an error signal; other methods throw before
 * the target is invoked. A method called without an {@link AccessContext} is denied.
 */
@Aspect
@Component
@Order(1)
public class AccessControlAspect {

    private static final Logger log = LoggerFactory.getLogger(AccessControlAspect.class);

    private final AccessGuard accessGuard;

    public AccessControlAspect(AccessGuard accessGuard) {
        this.accessGuard = accessGuard;
    }

    @Around("@annotation(requiresAccess)")
    public Object checkAccess(ProceedingJoinPoint joinPoint, RequiresAccess requiresAccess) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        Class<?> returnType = method.getReturnType();

        AccessContext context = extractContext(joinPoint.getArgs());
        if (context == null) {
            log.error("No AccessContext found in method arguments: {}", method.getName());
            ResourceAccessDeniedException denied = new ResourceAccessDeniedException(
                    "Access context unavailable", null, requiresAccess.resource(), requiresAccess.operation());
            if (Mono.class.isAssignableFrom(returnType)) {
                return Mono.error(denied);
            }
            if (Flux.class.isAssignableFrom(returnType)) {
                return Flux.error(denied);
            }
            throw denied;
        }

        if (Mono.class.isAssignableFrom(returnType)) {
            return accessGuard.guard(context, requiresAccess.resource(), requiresAccess.operation(),
                    () -> proceedAsMono(joinPoint));
        }
        if (Flux.class.isAssignableFrom(returnType)) {
            return accessGuard.guardMany(context, requiresAccess.resource(), requiresAccess.operation(),
                    () -> proceedAsFlux(joinPoint));
        }

        accessGuard.check(context, requiresAccess.resource(), requiresAccess.operation());
        log.debug("Access check passed for {} ({} {})",
                method.getName(), requiresAccess.operation(), requiresAccess.resource());
        return joinPoint.proceed();
    }

    private Mono<Object> proceedAsMono(ProceedingJoinPoint joinPoint) {
        try {
            Object result = joinPoint.proceed();
            if (result instanceof Mono<?> mono) {
                return mono.cast(Object.class);
            }
            return Mono.justOrEmpty(result);
        } catch (Throwable e) {
            return Mono.error(e);
        }
    }

    private Flux<Object> proceedAsFlux(ProceedingJoinPoint joinPoint) {
        try {
            Object result = joinPoint.proceed();
            if (result instanceof Flux<?> flux) {
                return flux.cast(Object.class);
            }
            return Flux.empty();
        } catch (Throwable e) {
            return Flux.error(e);
        }
    }

    private AccessContext extractContext(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof AccessContext context) {
                return context;
            }
        }
        return null;
    }
}
