package com.example.skillsmatrix.bullhorn;

public class BullhornException extends RuntimeException {

    public BullhornException(String message) {
        super(message);
    }

    public BullhornException(String message, Throwable cause) {
        super(message, cause);
    }
}
