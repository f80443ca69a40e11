package com.starscape.tasktrack.features.createtask.app;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.starscape.tasktrack.common.exception.ValidationException;
import com.starscape.tasktrack.features.createtask.api.dto.CreateTaskRequest;
import com.starscape.tasktrack.features.updatetask.api.dto.UpdateTaskRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates and normalizes task payloads before anything is written.
 * <p>
 * All failing fields are reported together, keyed by their wire name
 * ({@code due_date}, not {@code dueDate}). Titles and tag names are trimmed
 * before the constraints run. A due date may be today but not earlier, where
 * "today" comes from the injected {@link Clock}.
 */
@Component
public class TaskPayloadValidator {
    
    static final String DUE_DATE_FIELD = "due_date";
    static final String DUE_DATE_IN_PAST = "Due date cannot be in the past";
    
    private static final PropertyNamingStrategies.SnakeCaseStrategy WIRE_NAMES =
            new PropertyNamingStrategies.SnakeCaseStrategy();
    
    private final Validator validator;
    private final Clock clock;
    
    public TaskPayloadValidator(Validator validator, Clock clock) {
        this.validator = validator;
        this.clock = clock;
    }
    
    public CreateTaskRequest validateCreate(CreateTaskRequest request) {
        if (request == null) {
            throw ValidationException.of("body", "Request body is required");
        }
        CreateTaskRequest normalized = new CreateTaskRequest(
            trim(request.title()),
            request.description(),
            request.priority(),
            request.dueDate(),
            request.completed() != null ? request.completed() : Boolean.FALSE,
            request.tags() != null ? trimAll(request.tags()) : List.of()
        );
        check(validator.validate(normalized), normalized.dueDate());
        return normalized;
    }
    
    public UpdateTaskRequest validateUpdate(UpdateTaskRequest request) {
        if (request == null) {
            throw ValidationException.of("body", "Request body is required");
        }
        UpdateTaskRequest normalized = new UpdateTaskRequest(
            trim(request.title()),
            request.description(),
            request.priority(),
            request.dueDate(),
            request.completed(),
            request.tags() != null ? trimAll(request.tags()) : null
        );
        check(validator.validate(normalized), normalized.dueDate());
        return normalized;
    }
    
    private <T> void check(Set<ConstraintViolation<T>> violations, LocalDate dueDate) {
        Map<String, String> errors = new LinkedHashMap<>();
        violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .forEach(v -> errors.putIfAbsent(fieldName(v.getPropertyPath()), v.getMessage()));
        
        if (dueDate != null && dueDate.isBefore(LocalDate.now(clock))) {
            errors.putIfAbsent(DUE_DATE_FIELD, DUE_DATE_IN_PAST);
        }
        
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
    
    /**
     * First node of the path, so a bad element of tags is reported as "tags".
     */
    private static String fieldName(Path path) {
        for (Path.Node node : path) {
            if (node.getName() != null) {
                return WIRE_NAMES.translate(node.getName());
            }
        }
        return "body";
    }
    
    private static String trim(String value) {
        return value != null ? value.trim() : null;
    }
    
    private static List<String> trimAll(List<String> values) {
        return values.stream()
                .map(TaskPayloadValidator::trim)
                .toList();
    }
}
