package com.chainpulse.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * One of quick, standard or comprehensive (case-insensitive); null is allowed.
 * Error code for API: INVALID_STRATEGY.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = SearchStrategyValidator.class)
public @interface SearchStrategy {

    String message() default "INVALID_STRATEGY";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
