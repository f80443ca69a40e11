package com.starscape.tasktrack.features.createtask.domain;

/**
 * Visibility of a task. The only transition is ACTIVE to DELETED.
 */
public enum TaskVisibility {
    ACTIVE,
    DELETED
}
