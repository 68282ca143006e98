package com.example.skillsmatrix.service.staging;

import java.util.List;

public class UnorderedHeadersException extends StagingConfigurationException {

    private final List<String> violations;

    public UnorderedHeadersException(List<String> violations) {
        super("Marker headers are out of order: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
