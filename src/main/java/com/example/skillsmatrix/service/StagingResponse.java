package com.example.skillsmatrix.service;

import com.example.skillsmatrix.service.staging.StagingIssue;

import java.util.List;

public record StagingResponse(
        List<String> headers,
        List<ProfileView> preview,
        int totalRecords,
        List<StagingIssue> issues
) {
}
