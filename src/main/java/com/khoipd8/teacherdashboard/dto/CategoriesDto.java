package com.khoipd8.teacherdashboard.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class CategoriesDto {
    private List<CountDto> casteCategories;
    private List<CategoryCountDto> serviceCategories;
    private List<CategoryBreakdown> detailedCategories;

    @Data
    @Builder
    public static class CategoryBreakdown {
        private String name;
        private int total;
        private int boys;
        private int girls;
        private int brightLearners;
        private int lateBoomers;
    }
}
