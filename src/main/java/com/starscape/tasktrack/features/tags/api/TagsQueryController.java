package com.starscape.tasktrack.features.tags.api;

import com.starscape.tasktrack.features.tags.api.dto.TagResponse;
import com.starscape.tasktrack.features.tags.app.ListTagsHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for querying tags.
 * Provides read-only access to the tag catalogue.
 */
@RestController
@RequestMapping("/tags")
public class TagsQueryController {
    
    private final ListTagsHandler listTagsHandler;
    
    public TagsQueryController(ListTagsHandler listTagsHandler) {
        this.listTagsHandler = listTagsHandler;
    }
    
    /**
     * Get all tags.
     * GET /tags
     */
    @GetMapping
    public ResponseEntity<List<TagResponse>> listTags() {
        return ResponseEntity.ok(listTagsHandler.handle());
    }
}
