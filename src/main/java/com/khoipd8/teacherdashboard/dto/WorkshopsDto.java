package com.khoipd8.teacherdashboard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class WorkshopsDto {
    private List<CourseSummary> workshops;
    private List<CourseSummary> serviceCourses;
    private List<String> syntheticMetrics;

    @Data
    @Builder
    public static class CourseSummary {
        private String id;
        private String title;
        private String duration;
        private String status;
        private String participants;
        private List<Session> sessions;
    }

    @Data
    @AllArgsConstructor
    public static class Session {
        private String date;
        private String topic;
    }
}
