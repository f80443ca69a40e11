package com.starscape.tasktrack.features.tags.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Tag entity. Names are globally unique and case-sensitive; a tag is shared by
 * every task that references it and is never deleted when it becomes unused.
 */
@Entity
@Table(name = "tags", uniqueConstraints = {
    @UniqueConstraint(name = "tags_name_unique", columnNames = {"name"})
})
public class Tag extends com.starscape.tasktrack.common.domain.Entity<Long> {
    
    public static final int MAX_NAME_LENGTH = 100;
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "tag_id")
    private Long tagId;
    
    @Column(nullable = false, length = MAX_NAME_LENGTH)
    private String name;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected Tag() {
        // JPA constructor
    }
    
    public Tag(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tag name cannot be blank");
        }
        if (name.codePointCount(0, name.length()) > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Tag name must be " + MAX_NAME_LENGTH + " characters or less");
        }
        
        this.name = name;
        this.createdAt = Instant.now();
    }
    
    @Override
    public Long getId() {
        return tagId;
    }
    
    // Getters
    public Long getTagId() { return tagId; }
    public String getName() { return name; }
    public Instant getCreatedAt() { return createdAt; }
}
