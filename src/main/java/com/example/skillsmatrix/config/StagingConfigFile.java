package com.example.skillsmatrix.config;

import java.util.List;
import java.util.Map;

public record StagingConfigFile(
        List<String> sentinels,
        Map<String, Integer> workExperience
) {
}
