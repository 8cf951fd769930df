package com.khoipd8.teacherdashboard.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Status", description = "Liveness banner")
public class StatusController {

    public static final String BANNER = "Teacher Dashboard API is running";

    @GetMapping("/")
    @Operation(summary = "Plain-text banner confirming the API is up")
    public String status() {
        return BANNER;
    }
}
