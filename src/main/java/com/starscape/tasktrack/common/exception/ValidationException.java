package com.starscape.tasktrack.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a payload fails validation. Carries every failing field,
 * keyed by its wire name, not just the first one encountered.
 */
public class ValidationException extends RuntimeException {
    
    private final Map<String, String> fieldErrors;
    
    public ValidationException(Map<String, String> fieldErrors) {
        super("Validation failed for fields " + fieldErrors.keySet());
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }
    
    public static ValidationException of(String field, String message) {
        return new ValidationException(Map.of(field, message));
    }
    
    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
