package com.khoipd8.teacherdashboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AuthResponseDto {
    private boolean success;
    private String message;
    private String token;
}
