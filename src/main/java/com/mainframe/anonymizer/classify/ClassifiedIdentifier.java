package com.mainframe.anonymizer.classify;

import com.mainframe.anonymizer.model.IdentifierCategory;
import com.mainframe.anonymizer.model.SourceLocation;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A declaration found by the classifier.
 */
@Data
@AllArgsConstructor
public class ClassifiedIdentifier {
    private String name;
    private IdentifierCategory category;
    private SourceLocation location;
    /** Level number for data items, 0 otherwise. */
    private int levelNumber;
    private boolean externallyVisible;
}
