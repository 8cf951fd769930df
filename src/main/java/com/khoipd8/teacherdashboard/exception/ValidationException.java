package com.khoipd8.teacherdashboard.exception;

/** Required request input is missing or blank. */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
