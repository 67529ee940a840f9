package com.tsc.service;

import java.util.function.Function;

/**
 * One spreadsheet column: header text and how to read the cell value from a row.
 */
public class ExportColumn<T> {

    private final String header;
    private final Function<T, Object> value;

    public ExportColumn(String header, Function<T, Object> value) {
        this.header = header;
        this.value = value;
    }

    public String getHeader() {
        return header;
    }

    public Object valueOf(T row) {
        return value.apply(row);
    }
}
