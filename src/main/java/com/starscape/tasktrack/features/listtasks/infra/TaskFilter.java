package com.starscape.tasktrack.features.listtasks.infra;

import java.util.List;

/**
 * Optional list filters. Null means "no constraint"; a task must carry every
 * name in tagNames.
 */
public record TaskFilter(
    Boolean completed,
    Integer priority,
    List<String> tagNames
) {
    public TaskFilter {
        tagNames = tagNames != null ? List.copyOf(tagNames) : List.of();
    }
}
