package com.mainframe.anonymizer.classify;

import com.mainframe.anonymizer.model.SourceRegion;

import lombok.Getter;
import lombok.Setter;

/**
 * Running context the classifier threads through one file. Expectations set by a
 * keyword survive line breaks, so {@code COPY} and its operand may sit on different lines.
 */
@Getter
@Setter
public class ScopeContext {

    /**
     * What the next identifier is expected to be, set by the keyword that precedes it.
     */
    public enum Expectation {
        NONE,
        PROGRAM_NAME,
        FRAGMENT_NAME,
        LIBRARY_NAME,
        FILE_NAME,
        OVERLAY_TARGET,
        OCCURS_COUNT,
        INDEX_NAMES
    }

    private SourceRegion region = SourceRegion.NONE;
    private final StorageCursor storage = new StorageCursor();
    private int lastLevel = 0;
    private Expectation expectation = Expectation.NONE;
    private boolean inIncludeStatement;
    private boolean statementStart = true;
    private boolean externalRecord;
    /** Name declared by the current level entry, target of a trailing EXTERNAL. */
    private ClassifiedIdentifier currentDeclaration;

    public void enterRegion(SourceRegion newRegion) {
        storage.closeAll();
        region = newRegion;
        lastLevel = 0;
        externalRecord = false;
        currentDeclaration = null;
        expectation = Expectation.NONE;
        inIncludeStatement = false;
    }

    public void expect(Expectation next) {
        expectation = next;
    }

    public boolean isExpecting(Expectation candidate) {
        return expectation == candidate;
    }

    /**
     * A period ends every clause, except that PROGRAM-ID is itself followed by one.
     */
    public void endSentence() {
        if (expectation != Expectation.PROGRAM_NAME) {
            expectation = Expectation.NONE;
        }
        inIncludeStatement = false;
        statementStart = true;
    }

    public int nestingDepth() {
        return storage.depth();
    }
}
