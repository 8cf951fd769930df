package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.dto.SyllabusDto;
import com.khoipd8.teacherdashboard.service.SyllabusService;
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
@Tag(name = "Syllabus", description = "Syllabus coverage")
@Slf4j
public class SyllabusController {

    @Autowired
    private SyllabusService syllabusService;

    @GetMapping("/syllabus-data")
    @Operation(summary = "Unit completion, time allocation and upcoming topics")
    public ResponseEntity<SyllabusDto> syllabus() {
        log.info("📚 Syllabus requested");
        return ResponseEntity.ok(syllabusService.syllabus());
    }
}
