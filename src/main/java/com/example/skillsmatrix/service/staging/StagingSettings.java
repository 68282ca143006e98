package com.example.skillsmatrix.service.staging;

/**
 * Read-only inputs of one staging run.
 */
public record StagingSettings(
        SentinelSet sentinels,
        WorkExperienceMapping workExperienceMapping,
        boolean rejectUnorderedHeaders
) {

    public StagingSettings {
        if (sentinels == null || workExperienceMapping == null) {
            throw new IllegalArgumentException("sentinels and work experience mapping are required");
        }
    }

    public static StagingSettings defaults() {
        return new StagingSettings(SentinelSet.defaults(), WorkExperienceMapping.defaults(), false);
    }
}
