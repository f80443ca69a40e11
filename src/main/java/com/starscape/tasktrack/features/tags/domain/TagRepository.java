package com.starscape.tasktrack.features.tags.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Tag domain entity.
 */
public interface TagRepository {
    
    /**
     * Inserts a tag unless one with the same name already exists.
     * Blocks while another open transaction holds an insert of that name.
     *
     * @return 1 when a row was inserted, 0 when the name was already taken
     */
    int insertIfAbsent(String name);
    
    Optional<Tag> findByName(String name);
    List<Tag> findByTagIdIn(Collection<Long> tagIds);
    List<Tag> findAllByOrderByNameAsc();
}
