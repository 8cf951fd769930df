package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.dto.CalendarDto;
import com.khoipd8.teacherdashboard.service.CalendarService;
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
@Tag(name = "Calendar", description = "School calendar")
@Slf4j
public class CalendarController {

    @Autowired
    private CalendarService calendarService;

    @GetMapping("/calendar-data")
    @Operation(summary = "Five-week calendar grid and upcoming events")
    public ResponseEntity<CalendarDto> calendar() {
        log.info("📅 Calendar requested");
        return ResponseEntity.ok(calendarService.calendar());
    }
}
