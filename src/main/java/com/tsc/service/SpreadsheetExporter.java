package com.tsc.service;

import java.util.List;

public interface SpreadsheetExporter {

    /**
     * Writes one header row followed by one row per record and returns the workbook bytes.
     */
    <T> byte[] renderSpreadsheet(String sheetName, List<T> rows, List<ExportColumn<T>> columns);
}
