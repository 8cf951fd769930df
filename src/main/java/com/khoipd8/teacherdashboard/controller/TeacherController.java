package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.model.Teacher;
import com.khoipd8.teacherdashboard.service.TeacherService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Teacher", description = "Teacher profile")
@Slf4j
public class TeacherController {

    @Autowired
    private TeacherService teacherService;

    @GetMapping("/teacher-data")
    @Operation(summary = "Teacher profile", description = "Without an id the first listed teacher is returned")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Profile found"),
        @ApiResponse(responseCode = "404", description = "Teacher not found"),
        @ApiResponse(responseCode = "500", description = "Server error fetching teacher data")
    })
    public ResponseEntity<Teacher> teacher(
            @Parameter(description = "Employee id", example = "EMP001")
            @RequestParam(value = "id", required = false) String id) {
        log.info("👩‍🏫 Teacher profile requested, id={}", id);
        return ResponseEntity.ok(teacherService.teacher(id));
    }
}
