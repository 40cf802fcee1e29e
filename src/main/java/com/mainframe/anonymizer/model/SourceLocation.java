package com.mainframe.anonymizer.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A position in a source file: file name, 1-based line and 1-based absolute column.
 */
@Data
@AllArgsConstructor
public class SourceLocation {
    private String file;
    private int line;
    private int column;

    public static SourceLocation of(String file, int line) {
        return new SourceLocation(file, line, 0);
    }

    @Override
    public String toString() {
        return column > 0 ? file + ":" + line + ":" + column : file + ":" + line;
    }
}
