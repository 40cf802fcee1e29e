package com.mainframe.anonymizer.exception;

/**
 * Persisted mapping state could not be read or written.
 */
public class MappingStateException extends AnonymizerException {

    private static final long serialVersionUID = 1L;

    public MappingStateException(String message) {
        super(message);
    }

    public MappingStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
