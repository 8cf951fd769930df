package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.dto.DashboardDto;
import com.khoipd8.teacherdashboard.service.DashboardService;
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
@Tag(name = "Dashboard", description = "Landing page counters")
@Slf4j
public class DashboardController {

    @Autowired
    private DashboardService dashboardService;

    @GetMapping("/dashboard-data")
    @Operation(summary = "Class headline counters",
               description = "Totals by gender, learner type, caste category and performance band")
    public ResponseEntity<DashboardDto> dashboard() {
        log.info("📊 Dashboard data requested");
        return ResponseEntity.ok(dashboardService.dashboard());
    }
}
