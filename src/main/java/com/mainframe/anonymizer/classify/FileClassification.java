package com.mainframe.anonymizer.classify;

import java.util.List;
import java.util.Map;

import com.mainframe.anonymizer.overlay.OverlayRelationship;
import com.mainframe.anonymizer.parser.CobolToken;
import com.mainframe.anonymizer.parser.SourceLine;

import lombok.Builder;
import lombok.Data;

/**
 * Everything the classifier learned about one file.
 */
@Data
@Builder
public class FileClassification {
    private String fileName;
    private List<SourceLine> lines;
    /** Tokens per line, parallel to {@link #lines}. */
    private List<List<CobolToken>> tokens;
    private List<ClassifiedIdentifier> identifiers;
    private List<OverlayRelationship> overlays;
    /** Storage offset of every named data item, keyed by upper-cased name. */
    private Map<String, Integer> positions;
    private List<String> warnings;
}
