package com.starscape.tasktrack.features.createtask.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "tasks")
public class Task extends com.starscape.tasktrack.common.domain.Entity<Long> {
    
    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "task_id")
    private Long taskId;
    
    @Column(nullable = false, length = MAX_TITLE_LENGTH)
    private String title;
    
    @Column(columnDefinition = "text")
    private String description;
    
    @Column(nullable = false)
    private int priority;
    
    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;
    
    @Column(nullable = false)
    private boolean completed;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TaskVisibility visibility;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected Task() {
        // JPA constructor
    }
    
    public Task(String title, String description, int priority, LocalDate dueDate, boolean completed) {
        validateTitle(title);
        validatePriority(priority);
        validateDueDate(dueDate);
        
        this.title = title;
        this.description = description;
        this.priority = priority;
        this.dueDate = dueDate;
        this.completed = completed;
        this.visibility = TaskVisibility.ACTIVE;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }
    
    private static void validateTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title cannot be blank");
        }
        if (title.codePointCount(0, title.length()) > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("Title must be " + MAX_TITLE_LENGTH + " characters or less");
        }
    }
    
    private static void validatePriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
    }
    
    private static void validateDueDate(LocalDate dueDate) {
        if (dueDate == null) {
            throw new IllegalArgumentException("Due date cannot be null");
        }
    }
    
    @Override
    public Long getId() {
        return taskId;
    }
    
    // Getters
    public Long getTaskId() { return taskId; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public int getPriority() { return priority; }
    public LocalDate getDueDate() { return dueDate; }
    public boolean isCompleted() { return completed; }
    public TaskVisibility getVisibility() { return visibility; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    
    public boolean isDeleted() {
        return visibility == TaskVisibility.DELETED;
    }
    
    public void rename(String title) {
        validateTitle(title);
        this.title = title;
        touch();
    }
    
    public void describe(String description) {
        this.description = description;
        touch();
    }
    
    public void changePriority(int priority) {
        validatePriority(priority);
        this.priority = priority;
        touch();
    }
    
    public void reschedule(LocalDate dueDate) {
        validateDueDate(dueDate);
        this.dueDate = dueDate;
        touch();
    }
    
    public void markCompleted(boolean completed) {
        this.completed = completed;
        touch();
    }
    
    /**
     * Hide the task from every read path. There is no way back.
     * @throws IllegalStateException if the task is already deleted
     */
    public void markDeleted() {
        if (isDeleted()) {
            throw new IllegalStateException("Task " + taskId + " is already deleted");
        }
        this.visibility = TaskVisibility.DELETED;
        touch();
    }
    
    private void touch() {
        this.updatedAt = Instant.now();
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
