package com.fakebusters.backend.global.error;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import org.springframework.stereotype.Component;

/**
 * Runs Bean Validation on service commands and turns violations into a
 * {@link ValidationProblemException}.
 */
@Component
public class CommandValidator {

    private final Validator validator;

    public CommandValidator(Validator validator) {
        this.validator = validator;
    }

    public <T> T requireValid(T command) {
        if (command == null) {
            throw new ValidationProblemException(Map.of("command", "must not be null"));
        }
        Set<ConstraintViolation<T>> violations = validator.validate(command);
        if (violations.isEmpty()) {
            return command;
        }
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        violations.stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .forEach(violation -> fieldErrors.merge(
                        violation.getPropertyPath().toString(),
                        violation.getMessage(),
                        (first, second) -> first + ", " + second));
        throw new ValidationProblemException(fieldErrors);
    }
}
