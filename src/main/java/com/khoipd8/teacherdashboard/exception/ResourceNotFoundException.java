package com.khoipd8.teacherdashboard.exception;

/** A lookup key (teacher id, roll number) matched no row. */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
