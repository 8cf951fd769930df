package com.khoipd8.teacherdashboard.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DashboardDto {
    private int totalStudents;
    private int boys;
    private int girls;
    private int brightLearners;
    private int lateBoomers;
    private int workshopsCompleted;
    private int pendingReports;
    private List<CategoryCountDto> categories;
    private List<CountDto> performance;
    private List<String> syntheticMetrics;
}
