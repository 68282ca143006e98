package com.example.skillsmatrix.service.staging;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordinal table from a years-of-experience range label to its code.
 */
public record WorkExperienceMapping(Map<String, Integer> ordinals) {

    private static final WorkExperienceMapping DEFAULTS = new WorkExperienceMapping(orderedDefaults());

    public WorkExperienceMapping {
        if (ordinals == null) {
            throw new IllegalArgumentException("work experience ordinals must not be null");
        }
        ordinals = Collections.unmodifiableMap(new LinkedHashMap<>(ordinals));
    }

    public static WorkExperienceMapping defaults() {
        return DEFAULTS;
    }

    public WorkExperience resolve(String descriptor) {
        Integer code = descriptor == null ? null : ordinals.get(descriptor);
        if (code == null) {
            return new WorkExperience.Unmapped(descriptor);
        }
        return new WorkExperience.Ordinal(code);
    }

    private static Map<String, Integer> orderedDefaults() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("0 to 4", 1);
        map.put("5 to 9", 2);
        map.put("10 to 14", 3);
        map.put("15 to 19", 4);
        map.put("20 to 24", 5);
        map.put("25 to 29", 6);
        map.put("30 or more", 7);
        return map;
    }
}
