package com.example.skillsmatrix.service.workbook;

public class WorkbookReadException extends RuntimeException {

    public WorkbookReadException(String message) {
        super(message);
    }

    public WorkbookReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
