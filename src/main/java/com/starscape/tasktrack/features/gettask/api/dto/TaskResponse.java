package com.starscape.tasktrack.features.gettask.api.dto;

import com.starscape.tasktrack.features.tags.api.dto.TagResponse;

import java.time.LocalDate;
import java.util.List;

/**
 * A task with its tags resolved to full tag objects.
 */
public record TaskResponse(
    Long id,
    String title,
    String description,
    int priority,
    LocalDate dueDate,
    boolean completed,
    List<TagResponse> tags
) {}
