package com.starscape.tasktrack.features.createtask.infra;

import com.starscape.tasktrack.features.createtask.domain.Task;
import com.starscape.tasktrack.features.createtask.domain.TaskRepository;
import com.starscape.tasktrack.features.createtask.domain.TaskVisibility;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaTaskRepository extends JpaRepository<Task, Long>, TaskRepository {
    
    @Override
    Optional<Task> findByTaskIdAndVisibility(Long taskId, TaskVisibility visibility);
}
