package com.khoipd8.teacherdashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AttendanceDto {
    private int presentToday;
    private int totalStudents;
    private int weeklyAverage;
    private int belowThreshold;
    private List<TrendPoint> attendanceTrend;
    private List<ClassAttendance> classComparison;
    private List<StudentAttendance> students;
    private List<String> syntheticMetrics;

    @Data
    @AllArgsConstructor
    public static class TrendPoint {
        private String date;    // M/D
        private int percentage;
    }

    @Data
    @AllArgsConstructor
    public static class ClassAttendance {
        @JsonProperty("class")
        private String className;

        private int percentage;
    }

    @Data
    @Builder
    public static class StudentAttendance {
        private String rollNo;
        private String name;
        private String status;
        private String remarks;
        private int totalPresent;
        private int totalDays;
        private int percentage;
    }
}
