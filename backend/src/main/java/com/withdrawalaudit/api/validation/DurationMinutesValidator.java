package com.withdrawalaudit.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Jakarta Bean Validation adapter for {@link DurationInputValidator}.
 */
@Component
public class DurationMinutesValidator implements ConstraintValidator<DurationMinutes, String> {

    private final DurationInputValidator durationInputValidator;

    public DurationMinutesValidator(DurationInputValidator durationInputValidator) {
        this.durationInputValidator = durationInputValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return durationInputValidator.isValid(value);
    }
}
