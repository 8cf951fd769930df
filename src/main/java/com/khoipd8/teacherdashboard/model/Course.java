package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/** A workshop or an in-service course with its comma separated session plan. */
@Data
@Builder
public class Course {
    private String id;
    private String title;
    private String duration;
    private String status;
    private List<String> sessionDates;
    private List<String> sessionTopics;
}
