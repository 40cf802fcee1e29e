package com.mainframe.anonymizer.overlay;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of resolving one {@link OverlayRelationship} against the mapping table.
 */
@Data
@Builder
public class OverlayResolution {
    private OverlayRelationship relationship;
    private String overlayReplacement;
    private String targetReplacement;
    private int position;
    /** Target never declared in the batch: position is the declared one. */
    private boolean degraded;
}
