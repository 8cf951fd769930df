package com.khoipd8.teacherdashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PerformanceDto {
    private List<LearnerProfile> brightLearners;
    private List<LearnerProfile> lateBoomers;

    @Data
    @Builder
    public static class LearnerProfile {
        private String id;
        private String name;
        private String rollNo;

        @JsonProperty("class")
        private String className;

        private String category;
        private String serviceCategory;
        private List<String> strengths;
        private List<String> weaknesses;
    }
}
