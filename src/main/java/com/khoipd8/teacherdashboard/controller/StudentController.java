package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.dto.CategoriesDto;
import com.khoipd8.teacherdashboard.dto.PerformanceDto;
import com.khoipd8.teacherdashboard.dto.StudentDetailsDto;
import com.khoipd8.teacherdashboard.model.Student;
import com.khoipd8.teacherdashboard.service.StudentViewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Students", description = "Enrollment, categories and learner profiles")
@Slf4j
public class StudentController {

    @Autowired
    private StudentViewService studentViewService;

    @GetMapping("/enrollment-data")
    @Operation(summary = "Enrolled students")
    public ResponseEntity<List<Student>> enrollment() {
        log.info("📋 Enrollment list requested");
        return ResponseEntity.ok(studentViewService.enrollment());
    }

    @GetMapping("/categories-data")
    @Operation(summary = "Caste and service category counts",
               description = "Includes a per-caste breakdown by gender and learner type")
    public ResponseEntity<CategoriesDto> categories() {
        log.info("📋 Category breakdown requested");
        return ResponseEntity.ok(studentViewService.categories());
    }

    @GetMapping("/performance-data")
    @Operation(summary = "Bright learners and late bloomers with strengths and weaknesses")
    public ResponseEntity<PerformanceDto> performance() {
        log.info("📈 Learner profiles requested");
        return ResponseEntity.ok(studentViewService.performance());
    }

    @GetMapping("/student-details/{id}")
    @Operation(summary = "Merged record of one student",
               description = "Enrollment, performance report, discipline history and achievements")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Student found"),
        @ApiResponse(responseCode = "404", description = "Student not found"),
        @ApiResponse(responseCode = "500", description = "Server error fetching student details")
    })
    public ResponseEntity<StudentDetailsDto> studentDetails(
            @Parameter(description = "Roll number", example = "101", required = true)
            @PathVariable String id) {
        log.info("🎓 Details requested for student {}", id);
        return ResponseEntity.ok(studentViewService.studentDetails(id));
    }
}
