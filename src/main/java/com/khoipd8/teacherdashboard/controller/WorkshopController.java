package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.dto.WorkshopsDto;
import com.khoipd8.teacherdashboard.service.WorkshopService;
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
@Tag(name = "Workshops", description = "Teacher workshops and service courses")
@Slf4j
public class WorkshopController {

    @Autowired
    private WorkshopService workshopService;

    @GetMapping("/workshops-data")
    @Operation(summary = "Workshops and service courses with their sessions")
    public ResponseEntity<WorkshopsDto> workshops() {
        log.info("🛠️ Workshops requested");
        return ResponseEntity.ok(workshopService.workshops());
    }
}
