package com.starscape.tasktrack.features.tags.infra;

import com.starscape.tasktrack.features.tags.domain.Tag;
import com.starscape.tasktrack.features.tags.domain.TagRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JPA repository implementation for Tag entity.
 */
@Repository
public interface JpaTagRepository extends JpaRepository<Tag, Long>, TagRepository {
    
    // ON CONFLICT without a target: H2's PostgreSQL mode only accepts this form
    @Override
    @Modifying
    @Query(value = "INSERT INTO tags (name, created_at) VALUES (:name, CURRENT_TIMESTAMP) ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(@Param("name") String name);
    
    @Override
    Optional<Tag> findByName(String name);
    
    @Override
    List<Tag> findByTagIdIn(Collection<Long> tagIds);
    
    @Override
    List<Tag> findAllByOrderByNameAsc();
}
