package com.example.skillsmatrix.bullhorn;

import java.util.List;

public record UpdateReport(
        int updated,
        int skipped,
        int failed,
        List<String> candidatesMissingId
) {
}
