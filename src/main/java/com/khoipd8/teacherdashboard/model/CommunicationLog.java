package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CommunicationLog {
    private String id;
    private String date;
    private String student;
    private String parent;
    private String type;
    private String subject;
    private String status;
}
