package com.fakebusters.backend.global.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;

/**
 * Raised when command attributes fail Bean Validation. Carries one message per failing field,
 * keyed by the property path.
 */
public class ValidationProblemException extends ProblemException {

    public static final String CODE = "VALIDATION_ERROR";

    private final Map<String, String> fieldErrors;

    public ValidationProblemException(Map<String, String> fieldErrors) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE, describe(fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    private static String describe(Map<String, String> fieldErrors) {
        if (fieldErrors == null || fieldErrors.isEmpty()) {
            return "Validation failed";
        }
        return fieldErrors.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("; "));
    }
}
