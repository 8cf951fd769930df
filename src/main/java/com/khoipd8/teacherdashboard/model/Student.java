package com.khoipd8.teacherdashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

/**
 * Enrollment row of the Students sheet, keyed by roll number.
 */
@Data
@Builder
public class Student {
    private String rollNo;
    private String name;
    private String gender;      // Male, Female
    private String category;    // General, OBC, SC, ST, Muslim
    private String serviceCategory; // "1".."5"
    private String contact;
    private String status;

    @JsonIgnore
    private String className;
}
