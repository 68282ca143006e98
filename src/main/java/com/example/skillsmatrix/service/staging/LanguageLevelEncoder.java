package com.example.skillsmatrix.service.staging;

import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class LanguageLevelEncoder {

    static final Set<String> LEVEL_CODES = Set.of("2", "3", "4", "5");

    public static boolean isLevelCode(String value) {
        return value != null && LEVEL_CODES.contains(value.trim());
    }

    /**
     * Renders a proficiency cell. A level code becomes {@code "<header> (Level <value>)"},
     * any other non-sentinel value is kept as a free-text language name, and a sentinel
     * yields the empty string, meaning the cell contributes nothing.
     */
    public String encode(String headerLabel, String cellValue, SentinelSet sentinels) {
        if (isLevelCode(cellValue)) {
            return headerLabel + " (Level " + cellValue + ")";
        }
        if (!sentinels.contains(cellValue)) {
            return cellValue;
        }
        return "";
    }
}
