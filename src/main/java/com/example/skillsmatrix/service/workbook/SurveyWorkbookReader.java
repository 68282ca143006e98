package com.example.skillsmatrix.service.workbook;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the active sheet of a survey workbook. The first row holds the headers; every
 * following non-blank row becomes a list of strings as wide as the header row.
 * Formula cells are rendered from their cached result and never re-evaluated.
 */
@Slf4j
@Component
public class SurveyWorkbookReader {
    static final String ABSENT = "None";
    private static final char NO_BREAK_SPACE = '\u00a0';
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    public SurveySheet read(InputStream input) {
        try (Workbook workbook = WorkbookFactory.create(input)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new WorkbookReadException("Workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(workbook.getActiveSheetIndex());
            DataFormatter fmt = new DataFormatter();

            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null || headerRow.getLastCellNum() <= 0) {
                throw new WorkbookReadException("Header row is empty in sheet " + sheet.getSheetName());
            }
            List<String> headers = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                Cell cell = headerRow.getCell(c);
                String name = cell == null ? "" : cellText(cell, fmt);
                headers.add(name.replace(NO_BREAK_SPACE, ' '));
            }
            log.info("Read {} column headers from sheet {}", headers.size(), sheet.getSheetName());

            List<List<String>> rows = new ArrayList<>();
            List<Integer> rowNumbers = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (isRowBlank(row, fmt)) {
                    continue;
                }
                List<String> values = new ArrayList<>(headers.size());
                for (int c = 0; c < headers.size(); c++) {
                    values.add(renderCell(row.getCell(c), fmt));
                }
                rows.add(values);
                rowNumbers.add(r + 1);
            }
            log.info("Read {} rows of survey data", rows.size());
            return new SurveySheet(sheet.getSheetName(), headers, rows, rowNumbers);
        } catch (IOException | EncryptedDocumentException | IllegalArgumentException e) {
            throw new WorkbookReadException("Unable to read survey workbook: " + e.getMessage(), e);
        }
    }

    private String renderCell(Cell cell, DataFormatter fmt) {
        if (cell == null) {
            return ABSENT;
        }
        CellType cellType = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        if (cellType == CellType.BLANK) {
            return ABSENT;
        }
        if (cellType == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().toLocalDate().format(DATE_FORMAT);
        }
        return cellText(cell, fmt).replace(NO_BREAK_SPACE, ' ').trim();
    }

    private String cellText(Cell cell, DataFormatter fmt) {
        if (cell.getCellType() != CellType.FORMULA) {
            return fmt.formatCellValue(cell);
        }
        switch (cell.getCachedFormulaResultType()) {
            case NUMERIC:
                return fmt.formatRawCellContents(cell.getNumericCellValue(),
                        cell.getCellStyle().getDataFormat(), cell.getCellStyle().getDataFormatString());
            case STRING:
                return cell.getRichStringCellValue().getString();
            case BOOLEAN:
                return cell.getBooleanCellValue() ? "TRUE" : "FALSE";
            case ERROR:
                return FormulaError.forInt(cell.getErrorCellValue()).getString();
            default:
                return "";
        }
    }

    private boolean isRowBlank(Row row, DataFormatter fmt) {
        if (row == null) {
            return true;
        }
        for (int c = Math.max(row.getFirstCellNum(), 0); c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c);
            String v = cell == null ? "" : cellText(cell, fmt).replace(NO_BREAK_SPACE, ' ');
            if (v != null && !v.trim().isBlank()) {
                return false;
            }
        }
        return true;
    }
}
