package com.starscape.tasktrack.features.updatetask.app;

import com.starscape.tasktrack.common.exception.NotFoundException;
import com.starscape.tasktrack.features.createtask.app.TaskPayloadValidator;
import com.starscape.tasktrack.features.createtask.domain.Task;
import com.starscape.tasktrack.features.createtask.domain.TaskRepository;
import com.starscape.tasktrack.features.gettask.api.dto.TaskResponse;
import com.starscape.tasktrack.features.gettask.app.TaskResponseAssembler;
import com.starscape.tasktrack.features.tags.app.TagReconciler;
import com.starscape.tasktrack.features.tags.domain.Tag;
import com.starscape.tasktrack.features.tags.domain.TaskTag;
import com.starscape.tasktrack.features.tags.domain.TaskTagRepository;
import com.starscape.tasktrack.features.updatetask.api.dto.UpdateTaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Handler for partially updating a task.
 * Only fields present in the request change. A present tags list, even an
 * empty one, replaces the task's whole tag set.
 */
@Service
public class UpdateTaskHandler {
    
    private static final Logger log = LoggerFactory.getLogger(UpdateTaskHandler.class);
    
    private final TaskPayloadValidator validator;
    private final TaskRepository taskRepository;
    private final TaskTagRepository taskTagRepository;
    private final TagReconciler tagReconciler;
    private final TaskResponseAssembler assembler;
    
    public UpdateTaskHandler(
            TaskPayloadValidator validator,
            TaskRepository taskRepository,
            TaskTagRepository taskTagRepository,
            TagReconciler tagReconciler,
            TaskResponseAssembler assembler) {
        this.validator = validator;
        this.taskRepository = taskRepository;
        this.taskTagRepository = taskTagRepository;
        this.tagReconciler = tagReconciler;
        this.assembler = assembler;
    }
    
    @Transactional
    public TaskResponse handle(Long taskId, UpdateTaskRequest request) {
        Task task = taskRepository.findActiveById(taskId)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        
        // Nothing is touched until the whole payload is valid
        UpdateTaskRequest payload = validator.validateUpdate(request);
        
        if (payload.title() != null) {
            task.rename(payload.title());
        }
        if (payload.description() != null) {
            task.describe(payload.description());
        }
        if (payload.priority() != null) {
            task.changePriority(payload.priority());
        }
        if (payload.dueDate() != null) {
            task.reschedule(payload.dueDate());
        }
        if (payload.completed() != null) {
            task.markCompleted(payload.completed());
        }
        task = taskRepository.save(task);
        
        if (payload.tags() != null) {
            replaceTags(task.getTaskId(), payload.tags());
        }
        
        log.info("Updated task {}", taskId);
        return assembler.toResponse(task);
    }
    
    private void replaceTags(Long taskId, List<String> names) {
        List<Tag> tags = tagReconciler.reconcile(names);
        taskTagRepository.deleteByTaskId(taskId);
        for (Tag tag : tags) {
            taskTagRepository.save(new TaskTag(taskId, tag.getTagId()));
        }
        log.debug("Replaced tags of task {} with {}", taskId, names);
    }
}
