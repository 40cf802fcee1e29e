package com.mainframe.anonymizer.transform;

import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * A rewritten source file, ready to be written.
 */
@Data
@Builder
public class TransformedFile {
    private String originalFileName;
    /** Output path relative to the output directory, with the renamed file stem. */
    private String outputFileName;
    /** Physical lines without terminators. */
    private List<String> lines;
    /** Full text with the original line terminators. */
    private String content;
    private int changedLines;
}
