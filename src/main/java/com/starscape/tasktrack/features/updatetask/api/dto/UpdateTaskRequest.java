package com.starscape.tasktrack.features.updatetask.api.dto;

import jakarta.validation.constraints.*;
import org.hibernate.validator.constraints.CodePointLength;

import java.time.LocalDate;
import java.util.List;

/**
 * Partial update. A null component means "leave unchanged"; for tags an empty
 * list is not null and clears every tag.
 */
public record UpdateTaskRequest(
    @CodePointLength(min = 1, max = 200, message = "Title must be between 1 and 200 characters")
    String title,
    
    String description,
    
    @Min(value = 1, message = "Priority must be between 1 and 5")
    @Max(value = 5, message = "Priority must be between 1 and 5")
    Integer priority,
    
    LocalDate dueDate,
    
    Boolean completed,
    
    List<
        @NotBlank(message = "Tag names cannot be blank")
        @CodePointLength(max = 100, message = "Tag names must be 100 characters or less")
        String> tags
) {}
