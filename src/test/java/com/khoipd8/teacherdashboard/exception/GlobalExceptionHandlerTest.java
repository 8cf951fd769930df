package com.khoipd8.teacherdashboard.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    @Test
    void serverErrorMessageFollowsEndpoint() {
        assertEquals("Server error fetching student details",
                GlobalExceptionHandler.serverErrorMessage("/api/student-details/101"));
        assertEquals("Server error fetching syllabus data",
                GlobalExceptionHandler.serverErrorMessage("/api/syllabus-data"));
        assertEquals("Server error", GlobalExceptionHandler.serverErrorMessage("/unknown"));
        assertEquals("Server error", GlobalExceptionHandler.serverErrorMessage(null));
    }
}
