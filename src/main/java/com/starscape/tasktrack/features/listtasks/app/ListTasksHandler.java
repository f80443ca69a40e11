package com.starscape.tasktrack.features.listtasks.app;

import com.starscape.tasktrack.common.config.TaskProperties;
import com.starscape.tasktrack.common.exception.ValidationException;
import com.starscape.tasktrack.features.createtask.domain.Task;
import com.starscape.tasktrack.features.gettask.api.dto.TaskResponse;
import com.starscape.tasktrack.features.gettask.app.TaskResponseAssembler;
import com.starscape.tasktrack.features.listtasks.infra.TaskFilter;
import com.starscape.tasktrack.features.listtasks.infra.TaskQueryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handler for listing tasks with pagination and filtering.
 * Supports filtering by completion, priority, and a comma-separated list of
 * tag names that a task must all carry.
 */
@Service
public class ListTasksHandler {
    
    private final TaskQueryRepository taskQueryRepository;
    private final TaskResponseAssembler assembler;
    private final TaskProperties properties;
    
    public ListTasksHandler(
            TaskQueryRepository taskQueryRepository,
            TaskResponseAssembler assembler,
            TaskProperties properties) {
        this.taskQueryRepository = taskQueryRepository;
        this.assembler = assembler;
        this.properties = properties;
    }
    
    @Transactional(readOnly = true)
    public List<TaskResponse> handle(
            int skip,
            Integer limit,
            Boolean completed,
            Integer priority,
            String tags) {
        
        Map<String, String> errors = new LinkedHashMap<>();
        if (skip < 0) {
            errors.put("skip", "Skip must be zero or greater");
        }
        if (limit != null && limit < 1) {
            errors.put("limit", "Limit must be at least 1");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        
        TaskFilter filter = new TaskFilter(completed, priority, parseTagNames(tags));
        List<Task> tasks = taskQueryRepository.findVisible(filter, skip, properties.resolvePageSize(limit));
        return assembler.toResponses(tasks);
    }
    
    /**
     * Split "a, b,,c" into [a, b, c].
     */
    static List<String> parseTagNames(String tags) {
        if (tags == null || tags.isBlank()) {
            return List.of();
        }
        return Arrays.stream(tags.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .distinct()
                .toList();
    }
}
