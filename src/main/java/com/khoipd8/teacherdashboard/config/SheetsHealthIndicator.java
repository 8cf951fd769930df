package com.khoipd8.teacherdashboard.config;

import com.khoipd8.teacherdashboard.exception.TableStoreException;
import com.khoipd8.teacherdashboard.repository.TableStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the class workbook can be reached, as the {@code sheets} component of
 * {@code /actuator/health}.
 */
@Component("sheets")
public class SheetsHealthIndicator implements HealthIndicator {

    private final TableStore tableStore;
    private final SheetsProperties properties;

    public SheetsHealthIndicator(TableStore tableStore, SheetsProperties properties) {
        this.tableStore = tableStore;
        this.properties = properties;
    }

    @Override
    public Health health() {
        if (!properties.isConfigured()) {
            return Health.down()
                    .withDetail("reason", "sheets.spreadsheet-id is not set")
                    .build();
        }
        try {
            return Health.up()
                    .withDetail("spreadsheetId", properties.getSpreadsheetId())
                    .withDetail("title", tableStore.describe())
                    .build();
        } catch (TableStoreException e) {
            return Health.down()
                    .withDetail("spreadsheetId", properties.getSpreadsheetId())
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
