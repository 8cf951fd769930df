package com.khoipd8.teacherdashboard.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PerformanceRecord {
    private String id;
    private String summaryLabel;
    private String category;
    private List<String> strengths;
    private List<String> weaknesses;
    private List<String> suggestions;
    private String report;
    private String remarks;
}
