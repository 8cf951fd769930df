package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CalendarEvent {
    private String id;
    private String date;
    private String title;
    private String type;
    private String time;
    private String description;
}
