package com.khoipd8.teacherdashboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/** Count keyed as {@code {category, count}}. */
@Data
@AllArgsConstructor
public class CategoryCountDto {
    private String category;
    private int count;
}
