package com.khoipd8.teacherdashboard.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Teacher {
    private String id;
    private String name;
    private String subject;

    @JsonProperty("class")
    private String className;

    private String department;
}
