package com.example.skillsmatrix.service.workbook;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SurveyWorkbookReaderTest {

    private final SurveyWorkbookReader reader = new SurveyWorkbookReader();

    @Test
    void readsHeadersAndRenderedRows() throws IOException {
        byte[] bytes;
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Responses");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Bullhorn ID");
            header.createCell(1).setCellValue("Submitted");
            header.createCell(2).setCellValue("Work Experience");
            header.createCell(3).setCellValue("Other Tools");

            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("m/d/yy"));

            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue(1001);
            first.createCell(1).setCellValue(LocalDate.of(2023, 1, 1));
            first.getCell(1).setCellStyle(dateStyle);
            first.createCell(2).setCellValue("  5 to 9  ");

            sheet.createRow(2).createCell(0).setCellValue("   ");

            Row third = sheet.createRow(4);
            third.createCell(0).setCellValue("1002");
            third.createCell(3).setCellValue("Polarion");

            bytes = toBytes(workbook);
        }

        SurveySheet result = reader.read(new ByteArrayInputStream(bytes));

        assertThat(result.sheetName()).isEqualTo("Responses");
        assertThat(result.headers()).containsExactly("Bullhorn ID", "Submitted", "Work Experience", "Other Tools");
        assertThat(result.rows()).hasSize(2);
        assertThat(result.rows().get(0)).containsExactly("1001", "2023-01-01", "5 to 9", "None");
        assertThat(result.rows().get(1)).containsExactly("1002", "None", "None", "Polarion");
        assertThat(result.rowNumbers()).containsExactly(2, 5);
    }

    @Test
    void noBreakSpacesAroundAnswersAreTrimmed() throws IOException {
        byte[] bytes;
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Responses");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Automotive");
            header.createCell(1).setCellValue("Other Tools");
            Row answers = sheet.createRow(1);
            answers.createCell(0).setCellValue("Yes\u00a0");
            answers.createCell(1).setCellValue("\u00a0None\u00a0");
            sheet.createRow(2).createCell(1).setCellValue("\u00a0");
            bytes = toBytes(workbook);
        }

        SurveySheet result = reader.read(new ByteArrayInputStream(bytes));

        assertThat(result.rows()).singleElement().isEqualTo(List.of("Yes", "None"));
    }

    @Test
    void formulaCellsUseTheirCachedResult() throws IOException {
        byte[] bytes;
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Responses");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Bullhorn ID");
            header.createCell(1).setCellValue("Other Tools");
            Row row = sheet.createRow(1);
            Cell id = row.createCell(0);
            id.setCellFormula("1+1");
            id.setCellValue(1003);
            Cell tools = row.createCell(1);
            tools.setCellFormula("\"X\"");
            tools.setCellValue("Polarion");
            bytes = toBytes(workbook);
        }

        SurveySheet result = reader.read(new ByteArrayInputStream(bytes));

        assertThat(result.rows()).singleElement().isEqualTo(List.of("1003", "Polarion"));
    }

    @Test
    void replacesNoBreakSpaceInHeaders() throws IOException {
        byte[] bytes;
        try (Workbook workbook = new XSSFWorkbook()) {
            Row header = workbook.createSheet("Responses").createRow(0);
            header.createCell(0).setCellValue("Work\u00a0Experience");
            header.createCell(1).setCellValue("Aircraft\u00a0Power\u00a0Generation");
            bytes = toBytes(workbook);
        }

        SurveySheet result = reader.read(new ByteArrayInputStream(bytes));

        assertThat(result.headers()).containsExactly("Work Experience", "Aircraft Power Generation");
        assertThat(result.rows()).isEmpty();
    }

    @Test
    void missingHeaderRowIsRejected() throws IOException {
        byte[] bytes;
        try (Workbook workbook = new XSSFWorkbook()) {
            workbook.createSheet("Empty");
            bytes = toBytes(workbook);
        }

        assertThatThrownBy(() -> reader.read(new ByteArrayInputStream(bytes)))
                .isInstanceOf(WorkbookReadException.class)
                .hasMessageContaining("Header row is empty");
    }

    @Test
    void nonWorkbookInputIsRejected() {
        byte[] notExcel = "ID,Name\n1,Jane".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.read(new ByteArrayInputStream(notExcel)))
                .isInstanceOf(WorkbookReadException.class)
                .hasMessageStartingWith("Unable to read survey workbook");
    }

    private static byte[] toBytes(Workbook workbook) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        workbook.write(out);
        return out.toByteArray();
    }
}
