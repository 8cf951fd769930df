package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ParentContact {
    private String id;
    private String student;
    private String name;
    private String relation;
    private String phone;
    private String email;
    private String lastContact;
}
