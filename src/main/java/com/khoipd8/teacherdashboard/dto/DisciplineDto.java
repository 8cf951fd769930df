package com.khoipd8.teacherdashboard.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DisciplineDto {
    private String id;
    private String date;
    private String studentName;
    private String rollNo;
    private String description;
    private String actionTaken;
}
