package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

/** One student's mark for one day. */
@Data
@Builder
public class AttendanceEntry {
    private String id;
    private String date;
    private String studentId;
    private String status;
    private String remarks;
}
