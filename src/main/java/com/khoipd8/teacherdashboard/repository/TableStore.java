package com.khoipd8.teacherdashboard.repository;

import com.khoipd8.teacherdashboard.exception.TableStoreException;

import java.util.List;

/**
 * Read access to the spreadsheet backend.
 */
public interface TableStore {

    /**
     * Rows of {@code sheetName} within the column range {@code range} (e.g. {@code A:G}) as ordered
     * cell strings, header first. Rows may be shorter than the range; an empty sheet gives an empty list.
     *
     * @throws TableStoreException when the backend cannot be reached or answers with an unexpected payload
     */
    List<List<String>> fetchRows(String sheetName, String range);

    /** Title of the workbook, used as a connectivity probe. */
    String describe();
}
