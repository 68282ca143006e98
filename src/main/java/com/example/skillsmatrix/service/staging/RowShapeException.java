package com.example.skillsmatrix.service.staging;

/**
 * A single row cannot be staged. The row is skipped, the batch continues.
 */
public class RowShapeException extends RuntimeException {

    public RowShapeException(String message) {
        super(message);
    }
}
