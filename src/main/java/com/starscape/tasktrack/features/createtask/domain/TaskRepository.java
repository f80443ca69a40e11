package com.starscape.tasktrack.features.createtask.domain;

import java.util.Optional;

public interface TaskRepository {
    Task save(Task task);
    Optional<Task> findByTaskIdAndVisibility(Long taskId, TaskVisibility visibility);
    
    /**
     * Soft-deleted tasks are reported as absent.
     */
    default Optional<Task> findActiveById(Long taskId) {
        return findByTaskIdAndVisibility(taskId, TaskVisibility.ACTIVE);
    }
}
