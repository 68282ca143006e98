package com.example.skillsmatrix.service.staging;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ListFlattener {
    static final String SEPARATOR = ", ";

    /**
     * Joins every category bucket into one display string in append order. Basic
     * information stays positional.
     */
    public FlattenedRecord flatten(StagedRecord record) {
        Map<Bucket, String> categories = new EnumMap<>(Bucket.class);
        for (Bucket bucket : Bucket.values()) {
            if (bucket.isCategory()) {
                categories.put(bucket, String.join(SEPARATOR, record.bucket(bucket)));
            }
        }
        return new FlattenedRecord(record.basicInformation(), categories);
    }

    public List<FlattenedRecord> flattenAll(List<StagedRecord> records) {
        return records.stream().map(this::flatten).toList();
    }
}
