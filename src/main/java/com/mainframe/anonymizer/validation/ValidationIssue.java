package com.mainframe.anonymizer.validation;

import lombok.Builder;
import lombok.Data;

/**
 * One finding of the source validator.
 */
@Data
@Builder
public class ValidationIssue {
    private ValidationSeverity severity;
    /** File the finding belongs to; null for findings about the mapping table. */
    private String fileName;
    /** 1-based line, 0 when the finding is not tied to a line. */
    private int line;
    private String message;

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[").append(severity).append("] ");
        if (fileName != null) {
            sb.append(fileName);
            if (line > 0) {
                sb.append(':').append(line);
            }
            sb.append(": ");
        }
        return sb.append(message).toString();
    }
}
