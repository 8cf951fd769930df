package com.khoipd8.teacherdashboard.exception;

/**
 * The spreadsheet backend could not be reached or answered with something that is not a value range.
 */
public class TableStoreException extends RuntimeException {

    private final String table;

    public TableStoreException(String table, String message) {
        super(message);
        this.table = table;
    }

    public TableStoreException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
