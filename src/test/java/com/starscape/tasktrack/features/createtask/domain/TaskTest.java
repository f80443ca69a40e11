package com.starscape.tasktrack.features.createtask.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {
    
    private static Task newTask() {
        return new Task("Write report", null, 3, LocalDate.of(2999, 1, 1), false);
    }
    
    @Test
    void startsActive() {
        Task task = newTask();
        
        assertEquals(TaskVisibility.ACTIVE, task.getVisibility());
        assertFalse(task.isDeleted());
        assertFalse(task.isCompleted());
    }
    
    @Test
    void deletionIsOneWay() {
        Task task = newTask();
        task.markDeleted();
        
        assertTrue(task.isDeleted());
        assertThrows(IllegalStateException.class, task::markDeleted);
        assertEquals(TaskVisibility.DELETED, task.getVisibility());
    }
    
    @Test
    void editsKeepTaskActive() {
        Task task = newTask();
        task.rename("Review report");
        task.changePriority(5);
        task.markCompleted(true);
        
        assertEquals("Review report", task.getTitle());
        assertEquals(5, task.getPriority());
        assertTrue(task.isCompleted());
        assertFalse(task.isDeleted());
    }
    
    @Test
    void rejectsPriorityOutsideRange() {
        Task task = newTask();
        
        assertThrows(IllegalArgumentException.class, () -> task.changePriority(6));
        assertThrows(IllegalArgumentException.class,
                () -> new Task("Write report", null, 0, LocalDate.of(2999, 1, 1), false));
        assertEquals(3, task.getPriority());
    }
    
    @Test
    void rejectsBlankTitle() {
        assertThrows(IllegalArgumentException.class,
                () -> new Task(" ", null, 3, LocalDate.of(2999, 1, 1), false));
    }
    
    @Test
    void acceptsTitleOfTwoHundredSupplementaryCharacters() {
        String title = "\uD83D\uDE00".repeat(200);
        
        Task task = new Task(title, null, 3, LocalDate.of(2999, 1, 1), false);
        
        assertEquals(title, task.getTitle());
        assertThrows(IllegalArgumentException.class, () -> task.rename(title + "x"));
    }
}
