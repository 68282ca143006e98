package com.example.skillsmatrix;

import com.example.skillsmatrix.config.SkillsMatrixProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SkillsMatrixProperties.class)
public class SkillsMatrixApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillsMatrixApplication.class, args);
    }
}
