package com.example.villages.authz.annotation;

import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the rule table and operation a method is guarded by.
 * The method must take an {@link com.example.villages.authz.model.AccessContext} argument.
 *
 * <pre>{@code
 * @RequiresAccess(resource = ResourceType.CARE_PLAN, operation = Operation.UPDATE)
 * public Mono<CarePlan> update(AccessContext context, CarePlanUpdate update) { ... }
 * }</pre>
 *
 * <p>Processed by {@link com.example.villages.authz.aspect.AccessControlAspect}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequiresAccess {

    ResourceType resource();

    Operation operation();
}
