package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.dto.DisciplineDto;
import com.khoipd8.teacherdashboard.model.Achievement;
import com.khoipd8.teacherdashboard.service.StudentRecordService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Student records", description = "Discipline and achievement logs")
@Slf4j
public class StudentRecordsController {

    @Autowired
    private StudentRecordService studentRecordService;

    @GetMapping("/discipline-data")
    @Operation(summary = "Discipline incidents")
    public ResponseEntity<List<DisciplineDto>> discipline() {
        log.info("📝 Discipline log requested");
        return ResponseEntity.ok(studentRecordService.discipline());
    }

    @GetMapping("/achievements-data")
    @Operation(summary = "Student achievements")
    public ResponseEntity<List<Achievement>> achievements() {
        log.info("🏆 Achievements requested");
        return ResponseEntity.ok(studentRecordService.achievements());
    }
}
