package com.example.skillsmatrix.service;

import com.example.skillsmatrix.service.staging.Bucket;
import com.example.skillsmatrix.service.staging.ProfileRecord;
import com.example.skillsmatrix.service.staging.WorkExperience;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ProfileView(
        List<String> basicInformation,
        Integer workExperienceCode,
        String unmappedWorkExperience,
        Map<String, String> categories
) {

    public static ProfileView of(ProfileRecord record) {
        Map<String, String> categories = new LinkedHashMap<>();
        for (Bucket bucket : Bucket.values()) {
            if (bucket.isCategory()) {
                categories.put(bucket.label(), record.category(bucket));
            }
        }
        Integer code = null;
        String unmapped = null;
        if (record.workExperience() instanceof WorkExperience.Ordinal ordinal) {
            code = ordinal.code();
        } else if (record.workExperience() instanceof WorkExperience.Unmapped descriptor) {
            unmapped = descriptor.descriptor();
        }
        return new ProfileView(record.basicInformation(), code, unmapped, categories);
    }
}
