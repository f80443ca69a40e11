package com.starscape.tasktrack.features.listtasks.api;

import com.starscape.tasktrack.features.gettask.api.dto.TaskResponse;
import com.starscape.tasktrack.features.listtasks.app.ListTasksHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for listing tasks with pagination and filtering.
 */
@RestController
@RequestMapping("/tasks")
public class ListTasksController {
    
    private final ListTasksHandler listTasksHandler;
    
    public ListTasksController(ListTasksHandler listTasksHandler) {
        this.listTasksHandler = listTasksHandler;
    }
    
    @GetMapping
    public ResponseEntity<List<TaskResponse>> listTasks(
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Boolean completed,
            @RequestParam(required = false) Integer priority,
            @RequestParam(required = false) String tags) {
        
        return ResponseEntity.ok(listTasksHandler.handle(skip, limit, completed, priority, tags));
    }
}
