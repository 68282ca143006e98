package com.example.skillsmatrix.service.staging;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Values a respondent typed to mean "no answer". Matching is exact and case-sensitive;
 * a {@code null} member stands for an absent cell.
 */
public final class SentinelSet {

    private static final SentinelSet DEFAULTS = of(Arrays.asList(
            "N", "No", "NO", "Np", "no", "n", "noo", "nm",
            "none", "None", "NOne", "nOne", " ", "", "null", null
    ));

    private final Set<String> values;

    private SentinelSet(Collection<String> values) {
        this.values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public static SentinelSet of(Collection<String> values) {
        if (values == null) {
            throw new IllegalArgumentException("sentinel values must not be null");
        }
        return new SentinelSet(values);
    }

    public static SentinelSet defaults() {
        return DEFAULTS;
    }

    public boolean contains(String value) {
        return values.contains(value);
    }

    public Set<String> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SentinelSet other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SentinelSet" + values;
    }
}
