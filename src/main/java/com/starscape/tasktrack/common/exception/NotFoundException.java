package com.starscape.tasktrack.common.exception;

/**
 * Thrown when a requested entity does not exist or is no longer visible.
 */
public class NotFoundException extends RuntimeException {
    
    public NotFoundException(String message) {
        super(message);
    }
}
