package com.withdrawalaudit.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Optional duration in minutes: numeric, non-negative, at most 30 days.
 * Error code for API: INVALID_DURATION.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = DurationMinutesValidator.class)
public @interface DurationMinutes {

    String message() default "INVALID_DURATION";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
