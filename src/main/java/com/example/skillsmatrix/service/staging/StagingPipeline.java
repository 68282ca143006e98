package com.example.skillsmatrix.service.staging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns survey rows into profile records: boundaries are resolved once, then every row is
 * classified, flattened and mapped independently. A row that cannot be staged is reported
 * and skipped; header problems abort the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StagingPipeline {

    private final HeaderBoundaryResolver boundaryResolver;
    private final RowClassifier rowClassifier;
    private final ListFlattener listFlattener;
    private final WorkExperienceMapper workExperienceMapper;

    public StagingResult stage(List<String> headers, List<List<String>> rows, StagingSettings settings) {
        List<Integer> rowNumbers = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            rowNumbers.add(r + 1);
        }
        return stage(headers, rows, rowNumbers, settings);
    }

    /**
     * Stages {@code rows}, reporting row issues under the matching entry of {@code rowNumbers}
     * (typically the sheet row the values were read from).
     */
    public StagingResult stage(List<String> headers, List<List<String>> rows, List<Integer> rowNumbers,
                               StagingSettings settings) {
        if (rowNumbers.size() != rows.size()) {
            throw new IllegalArgumentException("Got " + rowNumbers.size() + " row numbers for " + rows.size() + " rows");
        }
        BoundarySet boundaries = boundaryResolver.resolve(headers);
        if (boundaries.workExperience() < ProfileRecord.WORK_EXPERIENCE) {
            throw new StagingConfigurationException("Header '" + HeaderBoundaryResolver.WORK_EXPERIENCE
                    + "' is at column " + boundaries.workExperience() + ", basic information needs it at column "
                    + ProfileRecord.WORK_EXPERIENCE + " or later");
        }
        List<StagingIssue> issues = new ArrayList<>();

        List<String> unordered = boundaries.unorderedBoundaries();
        if (!unordered.isEmpty()) {
            if (settings.rejectUnorderedHeaders()) {
                throw new UnorderedHeadersException(unordered);
            }
            log.warn("Marker headers out of order, buckets may be wrong: {}", unordered);
            for (String violation : unordered) {
                issues.add(new StagingIssue(null, null, "Marker headers out of order: " + violation));
            }
        }

        List<ClassificationRule> rules = rowClassifier.rulesFor(boundaries, settings.sentinels());
        List<ProfileRecord> records = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            try {
                StagedRecord staged = rowClassifier.classify(headers, rows.get(r), rules);
                FlattenedRecord flattened = listFlattener.flatten(staged);
                records.add(workExperienceMapper.mapExperience(flattened, settings.workExperienceMapping()));
            } catch (RowShapeException e) {
                log.warn("Skipping row {}: {}", rowNumbers.get(r), e.getMessage());
                issues.add(new StagingIssue(rowNumbers.get(r), null, e.getMessage()));
            }
        }

        log.info("Staged {} of {} rows ({} issues)", records.size(), rows.size(), issues.size());
        return new StagingResult(Collections.unmodifiableList(new ArrayList<>(headers)), records, issues);
    }
}
