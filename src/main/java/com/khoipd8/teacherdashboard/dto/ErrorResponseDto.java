package com.khoipd8.teacherdashboard.dto;

import lombok.Data;

/** Body of every non-2xx answer. */
@Data
public class ErrorResponseDto {
    private final boolean success = false;
    private final String message;
}
