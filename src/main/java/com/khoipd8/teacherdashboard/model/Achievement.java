package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Achievement {
    private String id;
    private String date;
    private String studentName;
    private String title;
    private String description;
}
