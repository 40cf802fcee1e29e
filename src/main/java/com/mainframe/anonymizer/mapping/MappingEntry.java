package com.mainframe.anonymizer.mapping;

import com.mainframe.anonymizer.model.IdentifierCategory;
import com.mainframe.anonymizer.model.SourceLocation;

import lombok.Builder;
import lombok.Getter;

/**
 * Original name and its replacement. The replacement never changes once issued; only
 * the occurrence count and the external flag move.
 */
@Getter
@Builder
public class MappingEntry {
    private final String originalName;
    private final String originalKey;
    private final String replacement;
    private final IdentifierCategory category;
    private final SourceLocation firstSeen;
    private final boolean neverRename;
    private volatile boolean externallyVisible;
    @Builder.Default
    private volatile int occurrenceCount = 1;

    void incrementOccurrences() {
        occurrenceCount++;
    }

    void markExternallyVisible() {
        externallyVisible = true;
    }
}
