package com.starscape.tasktrack.features.gettask.api;

import com.starscape.tasktrack.features.gettask.api.dto.TaskResponse;
import com.starscape.tasktrack.features.gettask.app.GetTaskHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/tasks")
public class GetTaskController {
    
    private final GetTaskHandler getTaskHandler;
    
    public GetTaskController(GetTaskHandler getTaskHandler) {
        this.getTaskHandler = getTaskHandler;
    }
    
    /**
     * Get a task by ID.
     * GET /tasks/{taskId}
     */
    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable Long taskId) {
        return ResponseEntity.ok(getTaskHandler.handle(taskId));
    }
}
