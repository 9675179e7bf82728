package com.example.spimex.bulletin;

import com.example.spimex.exception.BulletinParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads the metric ton section of a SPIMEX oil products bulletin.
 * <p>
 * Layout of the first sheet: a row whose second column contains the unit marker, one
 * header row, then instrument rows until the section total. Columns used: product code,
 * product name, delivery basis, volume, total, and the contract count in the last column.
 */
@Slf4j
@Component
public class BulletinParser {

    static final String SECTION_MARKER = "Единица измерения: Метрическая тонна";
    static final String SECTION_TOTAL = "Итого";

    private static final int CODE_COLUMN = 1;
    private static final int NAME_COLUMN = 2;
    private static final int BASIS_COLUMN = 3;
    private static final int VOLUME_COLUMN = 4;
    private static final int TOTAL_COLUMN = 5;

    /**
     * Rows between the marker and the first instrument row
     */
    private static final int HEADER_OFFSET = 2;

    private final DataFormatter formatter = new DataFormatter();

    public List<BulletinRow> parse(byte[] workbookBytes, LocalDate tradeDate) {
        try (var workbook = new HSSFWorkbook(new ByteArrayInputStream(workbookBytes))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new BulletinParseException(tradeDate, "workbook has no sheets");
            }
            return parseSheet(workbook.getSheetAt(0), tradeDate);
        } catch (IOException | RuntimeException e) {
            if (e instanceof BulletinParseException parseException) {
                throw parseException;
            }
            throw new BulletinParseException(tradeDate, "unreadable workbook: " + e.getMessage(), e);
        }
    }

    private List<BulletinRow> parseSheet(Sheet sheet, LocalDate tradeDate) {
        var markerRow = findMarkerRow(sheet);
        if (markerRow < 0) {
            throw new BulletinParseException(tradeDate, "metric ton section not found");
        }

        var countColumn = lastColumn(sheet, markerRow + 1);
        var rows = new LinkedHashMap<String, BulletinRow>();
        var dropped = 0;

        for (var index = markerRow + HEADER_OFFSET; index <= sheet.getLastRowNum(); index++) {
            var row = sheet.getRow(index);
            if (row == null) {
                continue;
            }
            var code = text(row, CODE_COLUMN);
            if (code.startsWith(SECTION_TOTAL)) {
                break;
            }
            if (code.isEmpty()) {
                continue;
            }

            var count = number(row, countColumn, tradeDate, index).intValue();
            if (count <= 0) {
                dropped++;
                continue;
            }

            var parsed = BulletinRow.builder()
                    .exchangeProductId(code)
                    .exchangeProductName(text(row, NAME_COLUMN))
                    .deliveryBasisName(text(row, BASIS_COLUMN))
                    .volume(number(row, VOLUME_COLUMN, tradeDate, index))
                    .total(number(row, TOTAL_COLUMN, tradeDate, index))
                    .count(count)
                    .build();

            if (rows.putIfAbsent(code, parsed) != null) {
                log.warn("Bulletin {}: duplicate product code {} at row {}, keeping the first", tradeDate, code, index + 1);
            }
        }

        log.debug("Bulletin {}: {} instrument rows, {} without contracts", tradeDate, rows.size(), dropped);
        return new ArrayList<>(rows.values());
    }

    private int findMarkerRow(Sheet sheet) {
        for (var row : sheet) {
            if (text(row, CODE_COLUMN).contains(SECTION_MARKER)) {
                return row.getRowNum();
            }
        }
        return -1;
    }

    /**
     * Contract count sits in the last column of the section header
     */
    private int lastColumn(Sheet sheet, int headerRow) {
        var header = sheet.getRow(headerRow);
        if (header != null && header.getLastCellNum() > TOTAL_COLUMN) {
            return header.getLastCellNum() - 1;
        }
        var widest = TOTAL_COLUMN + 1;
        for (var row : sheet) {
            widest = Math.max(widest, row.getLastCellNum());
        }
        return widest - 1;
    }

    private String text(Row row, int column) {
        var cell = row.getCell(column);
        return cell == null ? "" : formatter.formatCellValue(cell).trim();
    }

    private BigDecimal number(Row row, int column, LocalDate tradeDate, int rowIndex) {
        var cell = row.getCell(column);
        if (cell == null) {
            return BigDecimal.ZERO;
        }
        var type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        if (type == CellType.NUMERIC) {
            return BigDecimal.valueOf(cell.getNumericCellValue());
        }
        return parseText(cell, tradeDate, rowIndex);
    }

    private BigDecimal parseText(Cell cell, LocalDate tradeDate, int rowIndex) {
        var raw = formatter.formatCellValue(cell).trim();
        if (raw.isEmpty() || raw.equals("-")) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(raw.replace('\u00A0', ' ').replace(" ", "").replace(',', '.'));
        } catch (NumberFormatException e) {
            throw new BulletinParseException(tradeDate,
                    String.format("non-numeric value '%s' at row %d, column %d", raw, rowIndex + 1, cell.getColumnIndex() + 1), e);
        }
    }
}
