package com.example.skillsmatrix.service.staging;

public record StagingIssue(
        Integer rowNumber,
        String columnName,
        String message
) {
}
