package com.example.skillsmatrix.service.staging;

import org.springframework.stereotype.Component;

@Component
public class WorkExperienceMapper {

    /**
     * Resolves the range descriptor at basic-information position 8. Unknown descriptors
     * are carried through as {@link WorkExperience.Unmapped}.
     *
     * @throws RowShapeException if the record has no position 8
     */
    public ProfileRecord mapExperience(FlattenedRecord record, WorkExperienceMapping mapping) {
        if (record.basicInformation().size() <= ProfileRecord.WORK_EXPERIENCE) {
            throw new RowShapeException("Basic information has " + record.basicInformation().size()
                    + " values, no work experience at position " + ProfileRecord.WORK_EXPERIENCE);
        }
        String descriptor = record.basicInformation().get(ProfileRecord.WORK_EXPERIENCE);
        return new ProfileRecord(record.basicInformation(), mapping.resolve(descriptor), record.categories());
    }
}
