package com.khoipd8.teacherdashboard.table;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableSchemaTest {

    @Test
    void rangeCoversSchemaWidth() {
        assertEquals("A:B", Sheets.AUTHENTICATION.range());
        assertEquals("A:H", Sheets.STUDENTS.range());
        assertEquals("A:I", Sheets.SYLLABUS.range());
        assertEquals("A:F", Sheets.EVENTS.range());
    }

    @Test
    void columnLettersRollOver() {
        assertEquals("Z", TableSchema.columnLetter(25));
        assertEquals("AA", TableSchema.columnLetter(26));
        assertEquals("AZ", TableSchema.columnLetter(51));
    }

    @Test
    void rejectsUnknownAndDuplicateColumns() {
        assertThrows(IllegalArgumentException.class, () -> Sheets.GRADES.indexOf("teacher"));
        assertThrows(IllegalArgumentException.class, () -> TableSchema.sheet("X").column("id").column("id").build());
    }
}
