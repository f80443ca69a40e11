package com.starscape.tasktrack.features.createtask.app;

import com.starscape.tasktrack.features.createtask.api.dto.CreateTaskRequest;
import com.starscape.tasktrack.features.createtask.domain.Task;
import com.starscape.tasktrack.features.createtask.domain.TaskRepository;
import com.starscape.tasktrack.features.gettask.api.dto.TaskResponse;
import com.starscape.tasktrack.features.gettask.app.TaskResponseAssembler;
import com.starscape.tasktrack.features.tags.app.TagReconciler;
import com.starscape.tasktrack.features.tags.domain.Tag;
import com.starscape.tasktrack.features.tags.domain.TaskTag;
import com.starscape.tasktrack.features.tags.domain.TaskTagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Handler for creating a task.
 * Validates the payload, resolves tag names to tags (creating missing ones),
 * then writes the task and its tag links in one transaction.
 */
@Service
public class CreateTaskHandler {
    
    private static final Logger log = LoggerFactory.getLogger(CreateTaskHandler.class);
    
    private final TaskPayloadValidator validator;
    private final TaskRepository taskRepository;
    private final TaskTagRepository taskTagRepository;
    private final TagReconciler tagReconciler;
    private final TaskResponseAssembler assembler;
    
    public CreateTaskHandler(
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
    public TaskResponse handle(CreateTaskRequest request) {
        CreateTaskRequest payload = validator.validateCreate(request);
        
        List<Tag> tags = tagReconciler.reconcile(payload.tags());
        
        Task task = taskRepository.save(new Task(
            payload.title(),
            payload.description(),
            payload.priority(),
            payload.dueDate(),
            payload.completed()
        ));
        
        for (Tag tag : tags) {
            taskTagRepository.save(new TaskTag(task.getTaskId(), tag.getTagId()));
        }
        
        log.info("Created task {} with {} tag(s)", task.getTaskId(), tags.size());
        return assembler.toResponse(task);
    }
}
