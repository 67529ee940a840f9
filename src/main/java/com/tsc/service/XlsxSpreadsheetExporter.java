package com.tsc.service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

@Component
public class XlsxSpreadsheetExporter implements SpreadsheetExporter {

    private static final byte[] HEADER_FILL = {(byte) 0x36, (byte) 0x60, (byte) 0x92};
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int MAX_COLUMN_CHARS = 50;

    @Override
    public <T> byte[] renderSpreadsheet(String sheetName, List<T> rows, List<ExportColumn<T>> columns) {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet(sheetName);
            int[] widths = new int[columns.size()];

            CellStyle headerStyle = headerStyle(workbook);
            Row header = sheet.createRow(0);
            for (int c = 0; c < columns.size(); c++) {
                Cell cell = header.createCell(c);
                cell.setCellValue(columns.get(c).getHeader());
                cell.setCellStyle(headerStyle);
                widths[c] = columns.get(c).getHeader().length();
            }

            int r = 1;
            for (T record : rows) {
                Row row = sheet.createRow(r++);
                for (int c = 0; c < columns.size(); c++) {
                    Object value = columns.get(c).valueOf(record);
                    Cell cell = row.createCell(c);
                    String text = write(cell, value);
                    widths[c] = Math.max(widths[c], text.length());
                }
            }

            for (int c = 0; c < widths.length; c++) {
                // Column width is measured in 1/256 of a character
                sheet.setColumnWidth(c, (Math.min(widths[c], MAX_COLUMN_CHARS) + 2) * 256);
            }

            workbook.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write spreadsheet " + sheetName, e);
        }
    }

    private static CellStyle headerStyle(XSSFWorkbook workbook) {
        Font font = workbook.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());

        XSSFCellStyle style = workbook.createCellStyle();
        style.setFont(font);
        style.setFillForegroundColor(new XSSFColor(HEADER_FILL, null));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        return style;
    }

    // Returns the displayed text, used for column sizing
    private static String write(Cell cell, Object value) {
        if (value == null) {
            cell.setBlank();
            return "";
        }
        if (value instanceof BigDecimal) {
            cell.setCellValue(((BigDecimal) value).doubleValue());
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
            return value.toString();
        }
        String text = value instanceof LocalDateTime ? ((LocalDateTime) value).format(TIMESTAMP) : value.toString();
        cell.setCellValue(text);
        return text;
    }
}
