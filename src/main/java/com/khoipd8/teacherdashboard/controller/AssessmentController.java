package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.dto.AssessmentsDto;
import com.khoipd8.teacherdashboard.service.AssessmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Assessments", description = "Assessment calendar and grades")
@Slf4j
public class AssessmentController {

    @Autowired
    private AssessmentService assessmentService;

    @GetMapping("/assessments-data")
    @Operation(summary = "Assessments with averages, grade distribution and trend")
    public ResponseEntity<AssessmentsDto> assessments() {
        log.info("🧮 Assessments requested");
        return ResponseEntity.ok(assessmentService.assessments());
    }
}
