package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Grade {
    private String assessmentId;
    private String studentId;
    private String score;
    private String percentage;
    private String grade;
}
