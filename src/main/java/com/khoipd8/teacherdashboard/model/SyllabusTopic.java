package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

/** One topic row of the syllabus plan; hours are kept as typed. */
@Data
@Builder
public class SyllabusTopic {
    private String id;
    private String unit;
    private String name;
    private String expectedHours;
    private String timeSpent;
    private String status;
    private String startDate;
    private String completionDate;
    private String topicGroup;
}
