package com.khoipd8.teacherdashboard.table;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Raw rows of the sheets fetched for one request. Discarded with the response.
 */
public final class TableSnapshot {

    private final Map<TableSchema, List<List<String>>> rowsBySchema;

    public TableSnapshot(Map<TableSchema, List<List<String>>> rowsBySchema) {
        this.rowsBySchema = rowsBySchema;
    }

    public List<List<String>> rows(TableSchema schema) {
        List<List<String>> rows = rowsBySchema.get(schema);
        if (rows == null) {
            throw new IllegalStateException("Sheet " + schema.getSheetName() + " was not loaded for this request");
        }
        return Collections.unmodifiableList(rows);
    }

    public <T> List<T> records(TableSchema schema, Function<MappedRow, T> factory) {
        return RowMapper.mapAll(rows(schema), schema, factory);
    }
}
