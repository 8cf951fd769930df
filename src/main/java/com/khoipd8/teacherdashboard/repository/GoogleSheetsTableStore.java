package com.khoipd8.teacherdashboard.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.khoipd8.teacherdashboard.config.SheetsProperties;
import com.khoipd8.teacherdashboard.exception.TableStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link TableStore} backed by the Google Sheets v4 {@code values.get} REST call.
 */
@Repository
@Slf4j
public class GoogleSheetsTableStore implements TableStore {

    private final RestTemplate restTemplate;
    private final SheetsProperties properties;

    public GoogleSheetsTableStore(RestTemplate sheetsRestTemplate, SheetsProperties properties) {
        this.restTemplate = sheetsRestTemplate;
        this.properties = properties;
    }

    @Override
    public List<List<String>> fetchRows(String sheetName, String range) {
        String a1 = sheetName + "!" + range;
        URI uri = spreadsheetUri(sheetName)
                .pathSegment("values", a1)
                .queryParam("majorDimension", "ROWS")
                .build()
                .encode()
                .toUri();

        JsonNode body = get(uri, sheetName);
        List<List<String>> rows = toRows(body, sheetName);
        log.debug("Fetched {} rows from {}", rows.size(), a1);
        return rows;
    }

    @Override
    public String describe() {
        URI uri = spreadsheetUri("(workbook)")
                .queryParam("fields", "properties.title")
                .build()
                .encode()
                .toUri();
        JsonNode body = get(uri, "(workbook)");
        JsonNode title = body.path("properties").path("title");
        if (!title.isTextual()) {
            throw new TableStoreException("(workbook)", "Spreadsheet metadata has no title");
        }
        return title.asText();
    }

    private UriComponentsBuilder spreadsheetUri(String sheetName) {
        if (!properties.isConfigured()) {
            throw new TableStoreException(sheetName, "sheets.spreadsheet-id is not configured");
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .pathSegment(properties.getSpreadsheetId());
        if (hasText(properties.getApiKey())) {
            builder.queryParam("key", properties.getApiKey());
        }
        return builder;
    }

    private JsonNode get(URI uri, String sheetName) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (hasText(properties.getAccessToken())) {
            headers.setBearerAuth(properties.getAccessToken());
        }

        try {
            ResponseEntity<JsonNode> response =
                    restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
            JsonNode body = response.getBody();
            if (body == null || !body.isObject()) {
                throw new TableStoreException(sheetName, "Sheets API returned an empty or non-object body");
            }
            return body;
        } catch (RestClientResponseException e) {
            throw new TableStoreException(sheetName,
                    "Sheets API answered " + e.getStatusCode().value() + " for " + sheetName, e);
        } catch (ResourceAccessException e) {
            throw new TableStoreException(sheetName, "Sheets API unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TableStoreException(sheetName, "Could not read " + sheetName + ": " + e.getMessage(), e);
        }
    }

    static List<List<String>> toRows(JsonNode body, String sheetName) {
        JsonNode values = body.get("values");
        if (values == null || values.isNull()) {
            return Collections.emptyList();
        }
        if (!values.isArray()) {
            throw new TableStoreException(sheetName, "'values' of " + sheetName + " is not an array");
        }

        List<List<String>> rows = new ArrayList<>(values.size());
        for (JsonNode row : values) {
            if (!row.isArray()) {
                throw new TableStoreException(sheetName, "Row of " + sheetName + " is not an array");
            }
            List<String> cells = new ArrayList<>(row.size());
            for (JsonNode cell : row) {
                cells.add(cell.isNull() ? null : cell.asText());
            }
            rows.add(cells);
        }
        return rows;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
