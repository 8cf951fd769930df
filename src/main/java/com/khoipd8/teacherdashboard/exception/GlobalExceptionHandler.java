package com.khoipd8.teacherdashboard.exception;

import com.khoipd8.teacherdashboard.dto.ErrorResponseDto;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns service exceptions into the {@code {success:false, message}} body. Unexpected failures
 * get a fixed per-endpoint message; the cause is only logged. Client errors raised by Spring MVC
 * itself keep their own 4xx status.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String DEFAULT_SERVER_ERROR = "Server error";

    private static final Map<String, String> SERVER_ERRORS = new LinkedHashMap<>();

    static {
        SERVER_ERRORS.put("/api/auth", "Server error during authentication");
        SERVER_ERRORS.put("/api/teacher-data", "Server error fetching teacher data");
        SERVER_ERRORS.put("/api/dashboard-data", "Server error fetching dashboard data");
        SERVER_ERRORS.put("/api/enrollment-data", "Server error fetching enrollment data");
        SERVER_ERRORS.put("/api/categories-data", "Server error fetching categories data");
        SERVER_ERRORS.put("/api/performance-data", "Server error fetching performance data");
        SERVER_ERRORS.put("/api/workshops-data", "Server error fetching workshops data");
        SERVER_ERRORS.put("/api/discipline-data", "Server error fetching discipline data");
        SERVER_ERRORS.put("/api/achievements-data", "Server error fetching achievements data");
        SERVER_ERRORS.put("/api/attendance-data", "Server error fetching attendance data");
        SERVER_ERRORS.put("/api/assessments-data", "Server error fetching assessments data");
        SERVER_ERRORS.put("/api/syllabus-data", "Server error fetching syllabus data");
        SERVER_ERRORS.put("/api/calendar-data", "Server error fetching calendar data");
        SERVER_ERRORS.put("/api/communications-data", "Server error fetching communications data");
        SERVER_ERRORS.put("/api/student-details", "Server error fetching student details");
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponseDto> handleValidation(ValidationException ex) {
        return new ResponseEntity<>(new ErrorResponseDto(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidCredentials(InvalidCredentialsException ex) {
        return new ResponseEntity<>(new ErrorResponseDto(ex.getMessage()), HttpStatus.UNAUTHORIZED);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(ResourceNotFoundException ex) {
        return new ResponseEntity<>(new ErrorResponseDto(ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                                 HttpServletRequest request) {
        log.warn("⚠️ Malformed request body on {}: {}", request.getRequestURI(), ex.getMessage());
        return new ResponseEntity<>(new ErrorResponseDto("Malformed request body"), HttpStatus.BAD_REQUEST);
    }

    /** Routing and content negotiation errors keep the status Spring MVC assigned them. */
    @ExceptionHandler({
            NoResourceFoundException.class,
            NoHandlerFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponseDto> handleClientError(Exception ex, HttpServletRequest request) {
        ErrorResponse error = (ErrorResponse) ex;
        log.warn("⚠️ {} {} rejected: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return new ResponseEntity<>(new ErrorResponseDto(error.getBody().getDetail()), error.getHeaders(),
                error.getStatusCode());
    }

    @ExceptionHandler(TableStoreException.class)
    public ResponseEntity<ErrorResponseDto> handleTableStore(TableStoreException ex, HttpServletRequest request) {
        log.error("❌ Sheet fetch failed for {} (sheet {}): {}", request.getRequestURI(), ex.getTable(), ex.getMessage(), ex);
        return serverError(request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("❌ Unexpected error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return serverError(request);
    }

    static String serverErrorMessage(String requestUri) {
        for (Map.Entry<String, String> entry : SERVER_ERRORS.entrySet()) {
            if (requestUri != null && requestUri.startsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        return DEFAULT_SERVER_ERROR;
    }

    private ResponseEntity<ErrorResponseDto> serverError(HttpServletRequest request) {
        return new ResponseEntity<>(new ErrorResponseDto(serverErrorMessage(request.getRequestURI())),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
