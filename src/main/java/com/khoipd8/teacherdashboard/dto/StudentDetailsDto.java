package com.khoipd8.teacherdashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Everything known about one student: enrollment, performance report, discipline history and
 * achievements.
 */
@Data
@Builder
public class StudentDetailsDto {
    private String rollNo;
    private String name;
    private String gender;
    private String category;
    private String serviceCategory;
    private String contact;

    @JsonProperty("class")
    private String className;

    private String performanceReport;
    private List<String> strengths;
    private List<String> weaknesses;
    private List<String> suggestions;
    private List<DisciplineNote> disciplineRecords;
    private List<String> achievements;

    @Data
    @Builder
    public static class DisciplineNote {
        private String id;
        private String date;
        private String incident;
        private String action;
    }
}
