package com.example.skillsmatrix.service.staging;

import java.util.List;

public class MissingHeaderException extends StagingConfigurationException {

    private final List<String> missingHeaders;

    public MissingHeaderException(List<String> missingHeaders) {
        super("Missing required header(s): " + String.join(", ", missingHeaders));
        this.missingHeaders = List.copyOf(missingHeaders);
    }

    public List<String> getMissingHeaders() {
        return missingHeaders;
    }
}
