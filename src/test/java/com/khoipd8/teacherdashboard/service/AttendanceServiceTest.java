package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.AttendanceDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

import static com.khoipd8.teacherdashboard.service.InMemoryTableStore.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttendanceServiceTest {

    // Thursday 14 March 2024
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-14T09:00:00Z"), ZoneOffset.UTC);

    private InMemoryTableStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTableStore()
                .sheet("Students", List.of("Roll", "Name"), List.of(
                        row("101", "Asha"),
                        row("102", "Ravi")));
    }

    private AttendanceDto attendance() {
        return new AttendanceService(store.loader(), new FallbackPolicy(new Random(3)), clock).attendance();
    }

    @Test
    void noRowsForTodayFallsBackPerStudent() {
        store.sheet("Attendance", List.of("Id", "Date", "Student", "Status"), List.of(
                row("1", "2024-03-13", "101", "Present"),
                row("2", "2024-03-13", "102", "Absent")));

        AttendanceDto dto = attendance();

        assertEquals(0, dto.getPresentToday());
        assertEquals(2, dto.getTotalStudents());
        for (AttendanceDto.StudentAttendance student : dto.getStudents()) {
            assertTrue("Present".equals(student.getStatus()) || "Absent".equals(student.getStatus()));
            assertEquals("", student.getRemarks());
        }
        assertTrue(dto.getSyntheticMetrics().contains("students[0].status"));
        assertTrue(dto.getSyntheticMetrics().contains("students[1].status"));
    }

    @Test
    void weeklyAverageAndTrendUseRecordedDays() {
        store.sheet("Attendance", List.of("Id", "Date", "Student", "Status", "Remarks"), List.of(
                row("1", "2024-03-13", "101", "Present"),
                row("2", "2024-03-13", "102", "Absent"),
                row("3", "2024/03/14", "101", "Present", "On time"),
                row("4", "2024-03-14", "102", "Present"),
                row("5", "2024-02-01", "102", "Absent")));

        AttendanceDto dto = attendance();

        assertEquals(2, dto.getPresentToday());
        assertEquals(75, dto.getWeeklyAverage());
        assertFalse(dto.getSyntheticMetrics().contains("weeklyAverage"));

        List<AttendanceDto.TrendPoint> trend = dto.getAttendanceTrend();
        assertEquals(7, trend.size());
        assertEquals("3/8", trend.get(0).getDate());
        assertEquals("3/13", trend.get(5).getDate());
        assertEquals(50, trend.get(5).getPercentage());
        assertEquals("3/14", trend.get(6).getDate());
        assertEquals(100, trend.get(6).getPercentage());
        assertTrue(dto.getSyntheticMetrics().contains("attendanceTrend[0].percentage"));

        AttendanceDto.StudentAttendance asha = dto.getStudents().get(0);
        assertEquals("Present", asha.getStatus());
        assertEquals("On time", asha.getRemarks());
        assertEquals(2, asha.getTotalDays());
        assertEquals(100, asha.getPercentage());

        AttendanceDto.StudentAttendance ravi = dto.getStudents().get(1);
        assertEquals(3, ravi.getTotalDays());
        assertEquals(1, ravi.getTotalPresent());
        assertEquals(33, ravi.getPercentage());
        assertEquals(1, dto.getBelowThreshold());
    }

    @Test
    void classComparisonLeadsWithOwnClass() {
        store.sheet("Attendance", List.of("Id", "Date", "Student", "Status"), List.of(
                row("1", "2024-03-12", "101", "Present")));

        List<AttendanceDto.ClassAttendance> comparison = attendance().getClassComparison();

        assertEquals(4, comparison.size());
        assertEquals("X-A", comparison.get(0).getClassName());
        assertEquals(100, comparison.get(0).getPercentage());
        for (AttendanceDto.ClassAttendance other : comparison.subList(1, 4)) {
            assertTrue(other.getPercentage() >= 85 && other.getPercentage() <= 94);
        }
    }

    @Test
    void emptyWeekUsesDefaultAverageAndStudentPercentage() {
        store.headerOnly("Attendance");

        AttendanceDto dto = attendance();

        assertEquals(90, dto.getWeeklyAverage());
        assertEquals(90, dto.getStudents().get(0).getPercentage());
        assertEquals(0, dto.getStudents().get(0).getTotalDays());
        assertEquals(0, dto.getBelowThreshold());
        assertTrue(dto.getSyntheticMetrics().contains("weeklyAverage"));
        assertTrue(dto.getSyntheticMetrics().contains("classComparison[0].percentage"));
    }
}
