package com.starscape.tasktrack.features.gettask.app;

import com.starscape.tasktrack.features.createtask.domain.Task;
import com.starscape.tasktrack.features.gettask.api.dto.TaskResponse;
import com.starscape.tasktrack.features.tags.api.dto.TagResponse;
import com.starscape.tasktrack.features.tags.domain.Tag;
import com.starscape.tasktrack.features.tags.domain.TagRepository;
import com.starscape.tasktrack.features.tags.domain.TaskTag;
import com.starscape.tasktrack.features.tags.domain.TaskTagRepository;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds fully materialized task responses. Tags are read eagerly here so
 * nothing lazy escapes the transaction.
 */
@Component
public class TaskResponseAssembler {
    
    private final TaskTagRepository taskTagRepository;
    private final TagRepository tagRepository;
    
    public TaskResponseAssembler(TaskTagRepository taskTagRepository, TagRepository tagRepository) {
        this.taskTagRepository = taskTagRepository;
        this.tagRepository = tagRepository;
    }
    
    public TaskResponse toResponse(Task task) {
        List<TaskTag> taskTags = taskTagRepository.findByTaskId(task.getTaskId());
        return toResponse(task, taskTags, loadTags(taskTags));
    }
    
    /**
     * Load tags for multiple tasks with two queries instead of one per task.
     */
    public List<TaskResponse> toResponses(List<Task> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        
        List<Long> taskIds = tasks.stream()
                .map(Task::getTaskId)
                .toList();
        List<TaskTag> taskTags = taskTagRepository.findByTaskIdIn(taskIds);
        Map<Long, Tag> tagsById = loadTags(taskTags);
        
        Map<Long, List<TaskTag>> taskTagsByTaskId = taskTags.stream()
                .collect(Collectors.groupingBy(TaskTag::getTaskId));
        
        return tasks.stream()
                .map(task -> toResponse(task, taskTagsByTaskId.getOrDefault(task.getTaskId(), List.of()), tagsById))
                .toList();
    }
    
    private Map<Long, Tag> loadTags(List<TaskTag> taskTags) {
        if (taskTags.isEmpty()) {
            return Map.of();
        }
        List<Long> tagIds = taskTags.stream()
                .map(TaskTag::getTagId)
                .distinct()
                .toList();
        return tagRepository.findByTagIdIn(tagIds).stream()
                .collect(Collectors.toMap(Tag::getTagId, Function.identity()));
    }
    
    private TaskResponse toResponse(Task task, List<TaskTag> taskTags, Map<Long, Tag> tagsById) {
        List<TagResponse> tags = taskTags.stream()
                .map(tt -> tagsById.get(tt.getTagId()))
                .sorted(Comparator.comparing(Tag::getName))
                .map(TagResponse::from)
                .toList();
        
        return new TaskResponse(
            task.getTaskId(),
            task.getTitle(),
            task.getDescription(),
            task.getPriority(),
            task.getDueDate(),
            task.isCompleted(),
            tags
        );
    }
}
