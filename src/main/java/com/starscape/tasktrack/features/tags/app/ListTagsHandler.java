package com.starscape.tasktrack.features.tags.app;

import com.starscape.tasktrack.features.tags.api.dto.TagResponse;
import com.starscape.tasktrack.features.tags.domain.TagRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Handler for listing every known tag, including ones no task references any more.
 * Returns tags sorted alphabetically.
 */
@Service
public class ListTagsHandler {
    
    private final TagRepository tagRepository;
    
    public ListTagsHandler(TagRepository tagRepository) {
        this.tagRepository = tagRepository;
    }
    
    @Transactional(readOnly = true)
    public List<TagResponse> handle() {
        return tagRepository.findAllByOrderByNameAsc().stream()
                .map(TagResponse::from)
                .toList();
    }
}
