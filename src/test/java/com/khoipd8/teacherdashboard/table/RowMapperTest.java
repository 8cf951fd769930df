package com.khoipd8.teacherdashboard.table;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RowMapperTest {

    @Test
    void shortRowTakesDeclaredDefaults() {
        MappedRow row = RowMapper.map(List.of("101", "Asha", "Female"), Sheets.STUDENTS);

        assertEquals("101", row.get("rollNo"));
        assertEquals("Female", row.get("gender"));
        assertNull(row.get("contact"));
        assertEquals("Active", row.get("status"));
        assertEquals("X-A", row.get("class"));
    }

    @Test
    void emptyCellCountsAsMissing() {
        MappedRow row = RowMapper.map(Arrays.asList("T1", "Ravi", "Math", "X-B", ""), Sheets.TEACHERS);

        assertEquals("General", row.get("department"));
    }

    @Test
    void emptyRowMapsToAllDefaults() {
        MappedRow row = RowMapper.map(List.of(), Sheets.DISCIPLINE);

        assertNull(row.get("id"));
        assertEquals("Verbal Warning", row.get("action"));
    }

    @Test
    void mapAllSkipsHeaderAndKeepsOrder() {
        List<List<String>> rows = List.of(
                List.of("id", "token"),
                List.of("E2", "x"),
                List.of("E1"));

        List<String> ids = RowMapper.mapAll(rows, Sheets.AUTHENTICATION, r -> r.get("id"));

        assertEquals(List.of("E2", "E1"), ids);
    }

    @Test
    void headerOnlyOrMissingTableHasNoRecords() {
        assertTrue(RowMapper.mapAll(List.of(List.of("id")), Sheets.AUTHENTICATION, r -> r).isEmpty());
        assertTrue(RowMapper.mapAll(List.of(), Sheets.AUTHENTICATION, r -> r).isEmpty());
        assertTrue(RowMapper.mapAll(null, Sheets.AUTHENTICATION, r -> r).isEmpty());
    }

    @Test
    void listCellsAreSplitAndTrimmed() {
        assertEquals(List.of("Focus", "Speed"), RowMapper.splitList("Focus, Speed"));
        assertEquals(List.of("a", "", "b"), RowMapper.splitList("a,,b"));
        assertTrue(RowMapper.splitList("").isEmpty());
        assertTrue(RowMapper.splitList(null).isEmpty());
    }
}
