package com.example.skillsmatrix.service.staging;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Assigns every column of a survey row to at most one bucket. The rule table is evaluated
 * top to bottom and the first matching rule owns the column; unmatched columns are dropped.
 */
@Component
@RequiredArgsConstructor
public class RowClassifier {

    private final LanguageLevelEncoder languageLevelEncoder;

    public List<ClassificationRule> rulesFor(BoundarySet b, SentinelSet sentinels) {
        return List.of(
                new ClassificationRule("basic-information",
                        c -> c.index() <= b.workExperience(), Bucket.BASIC_INFORMATION, Column::value),
                new ClassificationRule("industry-experience",
                        c -> c.index() <= b.space() && c.isYes(), Bucket.INDUSTRY_EXPERIENCE, Column::header),
                new ClassificationRule("domains",
                        c -> c.index() <= b.aircraftPower() && c.isYes(), Bucket.DOMAINS, Column::header),
                new ClassificationRule("standards",
                        c -> c.index() < b.otherStandards() && c.isYes(), Bucket.STANDARDS, Column::header),
                new ClassificationRule("other-standards",
                        c -> c.index() == b.otherStandards() && !sentinels.contains(c.value()),
                        Bucket.STANDARDS, Column::value),
                new ClassificationRule("skills",
                        c -> c.index() <= b.devsecops() && c.isYes(), Bucket.SKILLS, Column::header),
                new ClassificationRule("language-levels",
                        c -> c.index() < b.otherLanguages() && LanguageLevelEncoder.isLevelCode(c.value()),
                        Bucket.LANGUAGES, c -> languageLevelEncoder.encode(c.header(), c.value(), sentinels), true),
                new ClassificationRule("other-languages",
                        c -> c.index() == b.otherLanguages() && !sentinels.contains(c.value()),
                        Bucket.LANGUAGES, Column::value),
                new ClassificationRule("tools",
                        c -> c.index() < b.otherTools() && c.isYes(), Bucket.TOOLS, Column::header),
                new ClassificationRule("other-tools",
                        c -> c.index() == b.otherTools() && !sentinels.contains(c.value()),
                        Bucket.TOOLS, Column::value)
        );
    }

    public StagedRecord classify(List<String> headers, List<String> row, BoundarySet boundaries, SentinelSet sentinels) {
        return classify(headers, row, rulesFor(boundaries, sentinels));
    }

    public StagedRecord classify(List<String> headers, List<String> row, List<ClassificationRule> rules) {
        if (row == null) {
            throw new RowShapeException("Row is missing");
        }
        if (row.size() != headers.size()) {
            throw new RowShapeException("Row has " + row.size() + " cells but the header has " + headers.size());
        }
        StagedRecord record = new StagedRecord();
        for (int i = 0; i < row.size(); i++) {
            Column column = new Column(i, headers.get(i), row.get(i));
            Optional<ClassificationRule> rule = firstMatch(rules, column);
            if (rule.isEmpty()) {
                continue;
            }
            String contribution = rule.get().contributionOf(column);
            if (rule.get().contributes(contribution)) {
                record.append(rule.get().bucket(), contribution);
            }
        }
        return record;
    }

    public static Optional<ClassificationRule> firstMatch(List<ClassificationRule> rules, Column column) {
        for (ClassificationRule rule : rules) {
            if (rule.matches(column)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
