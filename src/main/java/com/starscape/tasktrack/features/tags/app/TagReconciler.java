package com.starscape.tasktrack.features.tags.app;

import com.starscape.tasktrack.features.tags.domain.Tag;
import com.starscape.tasktrack.features.tags.domain.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves tag names to persisted tags, creating the missing ones.
 * <p>
 * Names are matched exactly (case-sensitive). The result follows the input
 * order with repeated names collapsed to their first occurrence. Tags are
 * never deleted here, even when an update leaves one unreferenced.
 * <p>
 * Missing tags are inserted with an insert-if-absent inside the caller's
 * transaction. When two requests create the same name at once, the second
 * insert waits for the first transaction and then inserts nothing; both end
 * up linking the same row. New names are inserted in sorted order so that
 * concurrent requests always take the row locks in the same sequence.
 */
@Service
public class TagReconciler {
    
    private static final Logger log = LoggerFactory.getLogger(TagReconciler.class);
    
    private final TagRepository tagRepository;
    
    public TagReconciler(TagRepository tagRepository) {
        this.tagRepository = tagRepository;
    }
    
    @Transactional
    public List<Tag> reconcile(Collection<String> names) {
        Set<String> distinct = new LinkedHashSet<>(names);
        
        Map<String, Tag> resolved = new HashMap<>();
        for (String name : new TreeSet<>(distinct)) {
            resolved.put(name, findOrCreate(name));
        }
        
        return distinct.stream()
                .map(resolved::get)
                .toList();
    }
    
    private Tag findOrCreate(String name) {
        var existing = tagRepository.findByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        
        if (tagRepository.insertIfAbsent(name) > 0) {
            log.info("Created tag '{}'", name);
        } else {
            log.debug("Tag '{}' was created concurrently, reusing it", name);
        }
        return tagRepository.findByName(name)
                .orElseThrow(() -> new IllegalStateException("Tag not visible after insert: " + name));
    }
}
