package com.mainframe.anonymizer.exception;

import com.mainframe.anonymizer.model.SourceLocation;

/**
 * No valid, unique replacement could be generated for an identifier.
 */
public class MappingException extends AnonymizerException {

    private static final long serialVersionUID = 1L;
    private final String identifier;
    private final transient SourceLocation location;

    public MappingException(String identifier, SourceLocation location, String reason) {
        super("Cannot map identifier '" + identifier + "'"
                + (location != null ? " at " + location : "") + ": " + reason);
        this.identifier = identifier;
        this.location = location;
    }

    public String getIdentifier() {
        return identifier;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
