package com.khoipd8.teacherdashboard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class SyllabusDto {
    private int completionPercentage;
    private int completedUnits;
    private int totalUnits;
    private int remainingDays;
    private List<Topic> topics;
    private List<UnitCompletion> unitCompletion;
    private List<TimeAllocation> timeAllocation;
    private List<UpcomingTopic> upcomingTopics;
    private List<String> syntheticMetrics;

    @Data
    @Builder
    public static class Topic {
        private String id;
        private String unit;
        private String name;
        private String expectedHours;
        private String timeSpent;
        private String status;
        private String startDate;
        private String completionDate;
    }

    @Data
    @AllArgsConstructor
    public static class UnitCompletion {
        private String unit;
        private int percentage;
    }

    @Data
    @AllArgsConstructor
    public static class TimeAllocation {
        private String topic;
        private int planned;
        private int actual;
    }

    @Data
    @Builder
    public static class UpcomingTopic {
        private String id;
        private String name;
        private String unit;
        private String plannedStart;
        private String estimatedHours;
    }
}
