package com.starscape.tasktrack.features.deletetask.app;

import com.starscape.tasktrack.common.exception.NotFoundException;
import com.starscape.tasktrack.features.createtask.domain.Task;
import com.starscape.tasktrack.features.createtask.domain.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for soft-deleting tasks.
 * The row and its tag links stay in storage; the task just stops being visible.
 * Deleting an already deleted task is reported as not found.
 */
@Service
public class DeleteTaskHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteTaskHandler.class);
    
    private final TaskRepository taskRepository;
    
    public DeleteTaskHandler(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }
    
    @Transactional
    public void handle(Long taskId) {
        Task task = taskRepository.findActiveById(taskId)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        
        task.markDeleted();
        taskRepository.save(task);
        log.info("Soft-deleted task {}", taskId);
    }
}
