package com.mainframe.anonymizer.exception;

/**
 * A rewritten line no longer fits between columns 8 and 72.
 */
public class ColumnOverflowException extends AnonymizerException {

    private static final long serialVersionUID = 1L;
    private final String file;
    private final int line;
    private final int column;
    private final String identifier;
    private final int actualLength;
    private final int maxLength;

    public ColumnOverflowException(String file, int line, int column, String identifier, int actualLength, int maxLength) {
        super(String.format("Code area overflow in %s:%d at column %d (identifier '%s'): %d characters, maximum is %d",
                file, line, column, identifier, actualLength, maxLength));
        this.file = file;
        this.line = line;
        this.column = column;
        this.identifier = identifier;
        this.actualLength = actualLength;
        this.maxLength = maxLength;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getIdentifier() {
        return identifier;
    }

    public int getActualLength() {
        return actualLength;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
