package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AuthenticationEntry {
    private String id;
    private String token;
}
