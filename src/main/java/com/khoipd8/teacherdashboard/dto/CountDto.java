package com.khoipd8.teacherdashboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/** Count keyed as {@code {name, count}}. */
@Data
@AllArgsConstructor
public class CountDto {
    private String name;
    private int count;
}
