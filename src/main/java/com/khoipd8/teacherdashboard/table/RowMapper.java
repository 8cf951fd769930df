package com.khoipd8.teacherdashboard.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Projects raw sheet rows onto a {@link TableSchema}. Row 0 of a sheet is its header and is
 * never mapped; short rows and blank cells fall back to the column defaults.
 */
public final class RowMapper {

    private RowMapper() {
    }

    public static MappedRow map(List<String> cells, TableSchema schema) {
        String[] values = new String[schema.width()];
        for (int i = 0; i < values.length; i++) {
            String cell = cells != null && i < cells.size() ? cells.get(i) : null;
            values[i] = cell != null && !cell.isEmpty() ? cell : schema.defaultAt(i);
        }
        return new MappedRow(schema, values);
    }

    public static <T> List<T> mapAll(List<List<String>> rows, TableSchema schema, Function<MappedRow, T> factory) {
        if (rows == null || rows.size() <= 1) {
            return Collections.emptyList();
        }
        List<T> records = new ArrayList<>(rows.size() - 1);
        for (List<String> row : rows.subList(1, rows.size())) {
            records.add(factory.apply(map(row, schema)));
        }
        return records;
    }

    public static List<String> splitList(String cell) {
        if (cell == null || cell.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.stream(cell.split(",", -1))
                .map(String::trim)
                .toList();
    }
}
