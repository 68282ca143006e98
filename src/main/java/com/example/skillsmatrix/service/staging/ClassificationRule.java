package com.example.skillsmatrix.service.staging;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of the classification table. When {@code omitEmpty} is set, an empty
 * contribution means the column matched but adds nothing to its bucket.
 */
public record ClassificationRule(
        String name,
        Predicate<Column> matcher,
        Bucket bucket,
        Function<Column, String> contribution,
        boolean omitEmpty
) {

    public ClassificationRule(String name, Predicate<Column> matcher, Bucket bucket,
                              Function<Column, String> contribution) {
        this(name, matcher, bucket, contribution, false);
    }

    public boolean matches(Column column) {
        return matcher.test(column);
    }

    public String contributionOf(Column column) {
        return contribution.apply(column);
    }

    public boolean contributes(String value) {
        return !omitEmpty || (value != null && !value.isEmpty());
    }
}
