package com.example.skillsmatrix.service.staging;

/**
 * The header layout cannot be staged at all; the whole run is aborted.
 */
public class StagingConfigurationException extends RuntimeException {

    public StagingConfigurationException(String message) {
        super(message);
    }
}
