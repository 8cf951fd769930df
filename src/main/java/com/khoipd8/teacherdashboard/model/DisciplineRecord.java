package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DisciplineRecord {
    private String id;
    private String date;
    private String studentName;
    private String rollNo;
    private String description;
    private String action;
}
