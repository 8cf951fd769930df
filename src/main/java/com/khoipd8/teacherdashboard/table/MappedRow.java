package com.khoipd8.teacherdashboard.table;

import java.util.List;

/**
 * One data row resolved against its {@link TableSchema}: every field already holds either the
 * cell text or the column default.
 */
public final class MappedRow {

    private final TableSchema schema;
    private final String[] values;

    MappedRow(TableSchema schema, String[] values) {
        this.schema = schema;
        this.values = values;
    }

    public String get(String field) {
        return values[schema.indexOf(field)];
    }

    /** Comma separated cell split into trimmed items; blank cell gives an empty list. */
    public List<String> getList(String field) {
        return RowMapper.splitList(get(field));
    }

    public TableSchema getSchema() {
        return schema;
    }
}
