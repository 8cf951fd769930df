package com.khoipd8.teacherdashboard.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed column layout of one sheet: the sheet name plus the ordered fields it is read into,
 * each with the value used when a row is too short or the cell is blank.
 */
public final class TableSchema {

    private final String sheetName;
    private final List<Column> columns;
    private final Map<String, Integer> positions;

    private TableSchema(String sheetName, List<Column> columns) {
        this.sheetName = sheetName;
        this.columns = Collections.unmodifiableList(columns);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            if (index.put(columns.get(i).getName(), i) != null) {
                throw new IllegalArgumentException("Duplicate column '" + columns.get(i).getName() + "' in " + sheetName);
            }
        }
        this.positions = index;
    }

    public static Builder sheet(String sheetName) {
        return new Builder(sheetName);
    }

    public String getSheetName() {
        return sheetName;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public int width() {
        return columns.size();
    }

    /** Column range covering exactly the schema width, e.g. {@code A:G}. */
    public String range() {
        return "A:" + columnLetter(columns.size() - 1);
    }

    public int indexOf(String field) {
        Integer position = positions.get(field);
        if (position == null) {
            throw new IllegalArgumentException("Sheet " + sheetName + " has no column '" + field + "'");
        }
        return position;
    }

    public String defaultAt(int index) {
        return columns.get(index).getDefaultValue();
    }

    static String columnLetter(int index) {
        StringBuilder letters = new StringBuilder();
        int n = index;
        do {
            letters.insert(0, (char) ('A' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return letters.toString();
    }

    @Override
    public String toString() {
        return sheetName + "!" + range();
    }

    public static final class Column {

        private final String name;
        private final String defaultValue;

        Column(String name, String defaultValue) {
            this.name = name;
            this.defaultValue = defaultValue;
        }

        public String getName() {
            return name;
        }

        public String getDefaultValue() {
            return defaultValue;
        }
    }

    public static final class Builder {

        private final String sheetName;
        private final List<Column> columns = new ArrayList<>();

        private Builder(String sheetName) {
            this.sheetName = sheetName;
        }

        public Builder column(String name) {
            return column(name, null);
        }

        public Builder column(String name, String defaultValue) {
            columns.add(new Column(name, defaultValue));
            return this;
        }

        public TableSchema build() {
            if (columns.isEmpty()) {
                throw new IllegalStateException("Sheet " + sheetName + " declares no columns");
            }
            return new TableSchema(sheetName, new ArrayList<>(columns));
        }
    }
}
