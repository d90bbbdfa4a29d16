package com.chainpulse.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.Locale;
import java.util.Set;

public class SearchStrategyValidator implements ConstraintValidator<SearchStrategy, String> {

    static final Set<String> SUPPORTED = Set.of("quick", "standard", "comprehensive");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || SUPPORTED.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
