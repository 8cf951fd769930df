package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.dto.AuthRequestDto;
import com.khoipd8.teacherdashboard.dto.AuthResponseDto;
import com.khoipd8.teacherdashboard.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Authentication", description = "Employee-id login")
@Slf4j
public class AuthController {

    @Autowired
    private AuthService authService;

    @PostMapping("/auth")
    @Operation(summary = "Log in with an employee id",
               description = "Checks the id against the Authentication sheet and issues a placeholder token")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Authentication successful"),
        @ApiResponse(responseCode = "400", description = "Employee ID is required"),
        @ApiResponse(responseCode = "401", description = "Invalid Employee ID"),
        @ApiResponse(responseCode = "500", description = "Server error during authentication")
    })
    public ResponseEntity<AuthResponseDto> authenticate(@RequestBody(required = false) AuthRequestDto request) {
        String employeeId = request == null ? null : request.getEmployeeId();
        log.info("🔐 Login attempt for employee '{}'", employeeId);
        return ResponseEntity.ok(authService.authenticate(employeeId));
    }
}
