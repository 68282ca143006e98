package com.example.skillsmatrix.config;

import com.example.skillsmatrix.service.staging.SentinelSet;
import com.example.skillsmatrix.service.staging.StagingSettings;
import com.example.skillsmatrix.service.staging.WorkExperienceMapping;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
@Configuration
public class StagingConfig {

    @Bean
    public StagingSettings stagingSettings(SkillsMatrixProperties properties) {
        SkillsMatrixProperties.Staging staging = properties.getStaging();
        return load(new ClassPathResource(staging.getConfigLocation()), staging.isRejectUnorderedHeaders());
    }

    static StagingSettings load(ClassPathResource resource, boolean rejectUnorderedHeaders) {
        if (!resource.exists()) {
            log.info("{} not found, using built-in sentinels and work experience table", resource.getPath());
            return new StagingSettings(SentinelSet.defaults(), WorkExperienceMapping.defaults(), rejectUnorderedHeaders);
        }
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream input = resource.getInputStream()) {
            StagingConfigFile config = mapper.readValue(input, StagingConfigFile.class);
            SentinelSet sentinels = config == null || config.sentinels() == null
                    ? SentinelSet.defaults()
                    : SentinelSet.of(config.sentinels());
            WorkExperienceMapping mapping = config == null || config.workExperience() == null
                    ? WorkExperienceMapping.defaults()
                    : new WorkExperienceMapping(config.workExperience());
            log.info("Loaded {} sentinel values and {} work experience ranges from {}",
                    sentinels.values().size(), mapping.ordinals().size(), resource.getPath());
            return new StagingSettings(sentinels, mapping, rejectUnorderedHeaders);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read staging configuration: " + e.getMessage(), e);
        }
    }
}
