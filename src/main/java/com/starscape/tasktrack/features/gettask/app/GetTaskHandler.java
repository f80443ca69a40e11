package com.starscape.tasktrack.features.gettask.app;

import com.starscape.tasktrack.common.exception.NotFoundException;
import com.starscape.tasktrack.features.createtask.domain.Task;
import com.starscape.tasktrack.features.createtask.domain.TaskRepository;
import com.starscape.tasktrack.features.gettask.api.dto.TaskResponse;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for retrieving a single task with its tags.
 * Soft-deleted tasks are reported exactly like tasks that never existed.
 */
@Service
public class GetTaskHandler {
    
    private final TaskRepository taskRepository;
    private final TaskResponseAssembler assembler;
    
    public GetTaskHandler(TaskRepository taskRepository, TaskResponseAssembler assembler) {
        this.taskRepository = taskRepository;
        this.assembler = assembler;
    }
    
    @Transactional(readOnly = true)
    public TaskResponse handle(Long taskId) {
        Task task = taskRepository.findActiveById(taskId)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        return assembler.toResponse(task);
    }
}
