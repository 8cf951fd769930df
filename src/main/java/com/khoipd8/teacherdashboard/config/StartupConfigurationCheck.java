package com.khoipd8.teacherdashboard.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Reports missing workbook settings once at startup. The process keeps running;
 * readiness is left to the {@code sheets} health indicator.
 */
@Component
@Slf4j
public class StartupConfigurationCheck implements ApplicationRunner {

    private final SheetsProperties properties;

    public StartupConfigurationCheck(SheetsProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isConfigured()) {
            log.warn("sheets.spreadsheet-id is not set (SPREADSHEET_ID); every data endpoint will answer 500 until it is");
            return;
        }
        boolean hasKey = properties.getApiKey() != null && !properties.getApiKey().isBlank();
        boolean hasToken = properties.getAccessToken() != null && !properties.getAccessToken().isBlank();
        if (!hasKey && !hasToken) {
            log.warn("Neither sheets.api-key nor sheets.access-token is set; the Sheets API will reject every fetch");
        }
        log.info("Teacher dashboard reading spreadsheet {}", properties.getSpreadsheetId());
    }
}
