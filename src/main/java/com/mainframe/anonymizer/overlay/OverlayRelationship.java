package com.mainframe.anonymizer.overlay;

import com.mainframe.anonymizer.model.SourceLocation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A REDEFINES declaration: {@code overlayName} describes the same bytes as {@code targetName}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverlayRelationship {
    private String overlayName;
    private String targetName;
    private int nestingDepth;
    private int levelNumber;
    /** Storage offset the overlay would have had without REDEFINES. */
    private int declaredPosition;
    private SourceLocation location;
}
