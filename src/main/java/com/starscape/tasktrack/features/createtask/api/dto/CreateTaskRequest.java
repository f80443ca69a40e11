package com.starscape.tasktrack.features.createtask.api.dto;

import jakarta.validation.constraints.*;
import org.hibernate.validator.constraints.CodePointLength;

import java.time.LocalDate;
import java.util.List;

public record CreateTaskRequest(
    @NotBlank(message = "Title is required")
    @CodePointLength(max = 200, message = "Title must be 200 characters or less")
    String title,
    
    String description,
    
    @NotNull(message = "Priority is required")
    @Min(value = 1, message = "Priority must be between 1 and 5")
    @Max(value = 5, message = "Priority must be between 1 and 5")
    Integer priority,
    
    @NotNull(message = "Due date is required")
    LocalDate dueDate,
    
    Boolean completed,
    
    List<
        @NotBlank(message = "Tag names cannot be blank")
        @CodePointLength(max = 100, message = "Tag names must be 100 characters or less")
        String> tags
) {}
