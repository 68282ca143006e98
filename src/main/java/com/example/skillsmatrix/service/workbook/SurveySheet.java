package com.example.skillsmatrix.service.workbook;

import java.util.List;

/**
 * Headers and data rows of one sheet. {@code rowNumbers} holds the 1-based sheet row of
 * each entry in {@code rows}; blank rows are skipped, so the numbers can have gaps.
 */
public record SurveySheet(
        String sheetName,
        List<String> headers,
        List<List<String>> rows,
        List<Integer> rowNumbers
) {
}
