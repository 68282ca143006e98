package com.example.skillsmatrix.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds skills-matrix.* from application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "skills-matrix")
public class SkillsMatrixProperties {

    private Staging staging = new Staging();

    private Bullhorn bullhorn = new Bullhorn();

    @Getter
    @Setter
    public static class Staging {

        /** Classpath resource holding sentinel values and the work experience table. */
        private String configLocation = "staging-config.json";

        /** Fail the run instead of warning when marker headers are out of zone order. */
        private boolean rejectUnorderedHeaders = false;

        /** Maximum number of staged records echoed back by the stage endpoint. */
        private int previewLimit = 500;
    }

    @Getter
    @Setter
    public static class Bullhorn {

        private String authUrl = "https://auth.bullhornstaffing.com/oauth";

        private String restUrl;

        private String clientId;

        private String clientSecret;

        private String username;

        private String password;

        private int connectTimeoutMs = 10_000;

        private int readTimeoutMs = 30_000;
    }
}
