package com.example.skillsmatrix.service.staging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public record FlattenedRecord(
        List<String> basicInformation,
        Map<Bucket, String> categories
) {

    public FlattenedRecord {
        basicInformation = Collections.unmodifiableList(new ArrayList<>(basicInformation));
        categories = Collections.unmodifiableMap(Bucket.copyOf(categories));
    }

    public String category(Bucket bucket) {
        return categories.get(bucket);
    }
}
