package com.mainframe.anonymizer.model;

/**
 * Syntactic region a classifier is currently in.
 */
public enum SourceRegion {
    /** Before any division header, e.g. at the top of a copybook. */
    NONE,
    /** IDENTIFICATION and ENVIRONMENT divisions. */
    HEADER,
    /** DATA DIVISION: record layouts. */
    LAYOUT,
    /** PROCEDURE DIVISION. */
    EXECUTABLE
}
