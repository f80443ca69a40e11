package com.starscape.tasktrack.features.deletetask.api;

import com.starscape.tasktrack.features.deletetask.api.dto.DeleteTaskResponse;
import com.starscape.tasktrack.features.deletetask.app.DeleteTaskHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for task deletion. Deletion is always soft.
 */
@RestController
@RequestMapping("/tasks")
public class DeleteTaskController {
    
    private final DeleteTaskHandler deleteTaskHandler;
    
    public DeleteTaskController(DeleteTaskHandler deleteTaskHandler) {
        this.deleteTaskHandler = deleteTaskHandler;
    }
    
    /**
     * Soft delete a task.
     * DELETE /tasks/{taskId}
     */
    @DeleteMapping("/{taskId}")
    public ResponseEntity<DeleteTaskResponse> deleteTask(@PathVariable Long taskId) {
        deleteTaskHandler.handle(taskId);
        return ResponseEntity.ok(new DeleteTaskResponse("Task deleted successfully"));
    }
}
