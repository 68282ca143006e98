package com.example.skillsmatrix.service.staging;

import java.util.List;

public record StagingResult(
        List<String> headers,
        List<ProfileRecord> records,
        List<StagingIssue> issues
) {
}
