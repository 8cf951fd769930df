package com.khoipd8.teacherdashboard.controller;

import com.khoipd8.teacherdashboard.dto.CommunicationsDto;
import com.khoipd8.teacherdashboard.service.CommunicationService;
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
@Tag(name = "Communications", description = "Parent communication")
@Slf4j
public class CommunicationController {

    @Autowired
    private CommunicationService communicationService;

    @GetMapping("/communications-data")
    @Operation(summary = "Communication log, parent directory and meeting stats")
    public ResponseEntity<CommunicationsDto> communications() {
        log.info("✉️ Communications requested");
        return ResponseEntity.ok(communicationService.communications());
    }
}
