package com.example.skillsmatrix.service;

import com.example.skillsmatrix.bullhorn.UpdateReport;
import com.example.skillsmatrix.service.staging.StagingIssue;

import java.util.List;

public record SyncResult(
        int totalRecords,
        List<StagingIssue> issues,
        UpdateReport update
) {
}
