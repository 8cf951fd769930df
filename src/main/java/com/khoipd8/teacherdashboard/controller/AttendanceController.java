package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.dto.AttendanceDto;
import com.khoipd8.teacherdashboard.service.AttendanceService;
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
@Tag(name = "Attendance", description = "Daily and weekly attendance")
@Slf4j
public class AttendanceController {

    @Autowired
    private AttendanceService attendanceService;

    @GetMapping("/attendance-data")
    @Operation(summary = "Today, weekly average, 7-day trend and per-student rollup")
    public ResponseEntity<AttendanceDto> attendance() {
        log.info("🗓️ Attendance requested");
        return ResponseEntity.ok(attendanceService.attendance());
    }
}
