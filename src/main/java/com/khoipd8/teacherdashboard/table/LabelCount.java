package com.khoipd8.teacherdashboard.table;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class LabelCount {
    private String label;
    private int count;
}
