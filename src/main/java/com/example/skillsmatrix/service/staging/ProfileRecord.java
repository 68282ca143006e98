package com.example.skillsmatrix.service.staging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Final staged record handed to the upload side. {@code basicInformation} keeps the raw
 * cells; position 8 is also exposed, resolved, as {@link #workExperience()}.
 */
public record ProfileRecord(
        List<String> basicInformation,
        WorkExperience workExperience,
        Map<Bucket, String> categories
) {
    public static final int CANDIDATE_ID = 0;
    public static final int NAME = 3;
    public static final int SECONDARY_NAME = 4;
    public static final int PROJECT_ROLE = 5;
    public static final int OEM_EXPERIENCE = 7;
    public static final int WORK_EXPERIENCE = 8;

    public ProfileRecord {
        basicInformation = Collections.unmodifiableList(new ArrayList<>(basicInformation));
        categories = Collections.unmodifiableMap(Bucket.copyOf(categories));
    }

    public String basic(int position) {
        return position < basicInformation.size() ? basicInformation.get(position) : null;
    }

    public String category(Bucket bucket) {
        return categories.getOrDefault(bucket, "");
    }

    public String candidateId() {
        return basic(CANDIDATE_ID);
    }

    public String name() {
        return basic(NAME);
    }
}
