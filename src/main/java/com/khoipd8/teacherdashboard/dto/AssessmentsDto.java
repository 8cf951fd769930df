package com.khoipd8.teacherdashboard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AssessmentsDto {
    private NextAssessment nextAssessment;
    private int lastAssessmentAverage;
    private int pendingGrades;
    private List<AssessmentSummary> assessments;
    private List<GradeCount> gradeDistribution;
    private List<TrendPoint> performanceTrend;
    private List<String> syntheticMetrics;

    @Data
    @AllArgsConstructor
    public static class NextAssessment {
        private String date;
        private String name;
    }

    @Data
    @Builder
    public static class AssessmentSummary {
        private String id;
        private String date;
        private String title;
        private String type;
        private String maxScore;
        private Integer average;  // null until grades are entered
        private String status;
    }

    @Data
    @AllArgsConstructor
    public static class GradeCount {
        private String grade;
        private int count;
    }

    @Data
    @AllArgsConstructor
    public static class TrendPoint {
        private String assessment;
        private int average;
    }
}
