package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Assessment {
    private String id;
    private String date;
    private String title;
    private String type;
    private String maxScore;
    private String status;
}
