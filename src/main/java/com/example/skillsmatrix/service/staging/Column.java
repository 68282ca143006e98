package com.example.skillsmatrix.service.staging;

import java.util.Locale;

/**
 * One cell of a row together with its position and header label.
 */
public record Column(int index, String header, String value) {
    private static final char NO_BREAK_SPACE = '\u00a0';

    public boolean isYes() {
        return value != null
                && value.replace(NO_BREAK_SPACE, ' ').trim().toLowerCase(Locale.ROOT).equals("yes");
    }
}
