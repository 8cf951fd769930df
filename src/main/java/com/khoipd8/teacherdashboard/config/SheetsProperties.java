package com.khoipd8.teacherdashboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the Google Sheets workbook that backs every dashboard view.
 *
 * <p>Either {@code apiKey} (sheet shared by link) or {@code accessToken} (OAuth bearer)
 * must be set for the upstream calls to succeed.</p>
 */
@ConfigurationProperties(prefix = "sheets")
@Data
public class SheetsProperties {

    /** Spreadsheet id taken from the workbook URL. */
    private String spreadsheetId;

    private String apiKey;

    private String accessToken;

    private String baseUrl = "https://sheets.googleapis.com/v4/spreadsheets";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(15);

    public boolean isConfigured() {
        return spreadsheetId != null && !spreadsheetId.isBlank();
    }
}
