package com.mainframe.anonymizer.exception;

/**
 * Base class of every fatal anonymization error.
 */
public class AnonymizerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AnonymizerException(String message) {
        super(message);
    }

    public AnonymizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
