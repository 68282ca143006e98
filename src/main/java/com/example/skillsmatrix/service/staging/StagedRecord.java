package com.example.skillsmatrix.service.staging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-respondent buckets while a row is being classified. Every bucket starts empty and
 * only grows by {@link #append(Bucket, String)} in column order.
 */
public class StagedRecord {

    private final Map<Bucket, List<String>> buckets = new EnumMap<>(Bucket.class);

    public StagedRecord() {
        for (Bucket bucket : Bucket.values()) {
            buckets.put(bucket, new ArrayList<>());
        }
    }

    public void append(Bucket bucket, String value) {
        buckets.get(bucket).add(value);
    }

    public List<String> bucket(Bucket bucket) {
        return Collections.unmodifiableList(buckets.get(bucket));
    }

    public List<String> basicInformation() {
        return bucket(Bucket.BASIC_INFORMATION);
    }

    @Override
    public String toString() {
        return "StagedRecord" + buckets;
    }
}
