package com.starscape.tasktrack.features.createtask.api;

import com.starscape.tasktrack.features.createtask.api.dto.CreateTaskRequest;
import com.starscape.tasktrack.features.createtask.app.CreateTaskHandler;
import com.starscape.tasktrack.features.gettask.api.dto.TaskResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for creating tasks.
 * Validation happens in the handler so that every field error is reported at once.
 */
@RestController
@RequestMapping("/tasks")
public class CreateTaskController {
    
    private final CreateTaskHandler createTaskHandler;
    
    public CreateTaskController(CreateTaskHandler createTaskHandler) {
        this.createTaskHandler = createTaskHandler;
    }
    
    /**
     * Create a task.
     * POST /tasks
     */
    @PostMapping
    public ResponseEntity<TaskResponse> createTask(@RequestBody CreateTaskRequest request) {
        TaskResponse response = createTaskHandler.handle(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
