package com.starscape.tasktrack.features.updatetask.api;

import com.starscape.tasktrack.features.gettask.api.dto.TaskResponse;
import com.starscape.tasktrack.features.updatetask.api.dto.UpdateTaskRequest;
import com.starscape.tasktrack.features.updatetask.app.UpdateTaskHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/tasks")
public class UpdateTaskController {
    
    private final UpdateTaskHandler updateTaskHandler;
    
    public UpdateTaskController(UpdateTaskHandler updateTaskHandler) {
        this.updateTaskHandler = updateTaskHandler;
    }
    
    /**
     * Partially update a task.
     * PATCH /tasks/{taskId}
     */
    @PatchMapping("/{taskId}")
    public ResponseEntity<TaskResponse> updateTask(
            @PathVariable Long taskId,
            @RequestBody UpdateTaskRequest request) {
        
        return ResponseEntity.ok(updateTaskHandler.handle(taskId, request));
    }
}
