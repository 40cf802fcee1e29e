package com.mainframe.anonymizer.overlay;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.mapping.MappingEntry;
import com.mainframe.anonymizer.mapping.MappingTable;

/**
 * Collects REDEFINES declarations and data item offsets for the whole batch and
 * resolves each overlay once every file has been classified, so an overlay may refer
 * to a target declared in another file.
 *
 * Everything is stored in flat maps keyed by upper-cased name.
 */
public class OverlayTracker {
    private static final Logger log = LoggerFactory.getLogger(OverlayTracker.class);

    private final List<OverlayRelationship> declarations = new ArrayList<>();
    private final Map<String, Integer> positions = new LinkedHashMap<>();
    private final Map<String, OverlayResolution> resolutions = new LinkedHashMap<>();

    public synchronized void declare(OverlayRelationship relationship) {
        declarations.add(relationship);
    }

    /**
     * Records a data item's offset. The first declaration of a name wins.
     */
    public synchronized void recordPosition(String name, int offset) {
        positions.putIfAbsent(key(name), offset);
    }

    public synchronized void recordPositions(Map<String, Integer> filePositions) {
        filePositions.forEach(this::recordPosition);
    }

    public synchronized Optional<Integer> positionOf(String name) {
        return Optional.ofNullable(positions.get(key(name)));
    }

    /**
     * Resolves every declared overlay against the mapping table. An overlay takes its
     * target's offset; when the target is unknown a warning is added and the overlay
     * keeps its declared offset, flagged as degraded.
     */
    public synchronized List<OverlayResolution> resolveAll(MappingTable table, List<String> warnings) {
        resolutions.clear();
        List<OverlayResolution> result = new ArrayList<>();

        for (OverlayRelationship relationship : declarations) {
            Integer targetPosition = positions.get(key(relationship.getTargetName()));
            String targetReplacement = replacementOf(relationship.getTargetName(), table);
            boolean degraded = targetPosition == null || targetReplacement == null;

            if (degraded) {
                String warning = String.format("%s: REDEFINES target %s of %s could not be resolved,"
                                + " keeping declared offset %d", relationship.getLocation(),
                        relationship.getTargetName(), relationship.getOverlayName(),
                        relationship.getDeclaredPosition());
                warnings.add(warning);
                log.warn(warning);
            }

            OverlayResolution resolution = OverlayResolution.builder()
                    .relationship(relationship)
                    .overlayReplacement(replacementOf(relationship.getOverlayName(), table))
                    .targetReplacement(targetReplacement)
                    .position(targetPosition != null ? targetPosition : relationship.getDeclaredPosition())
                    .degraded(degraded)
                    .build();
            resolutions.putIfAbsent(key(relationship.getOverlayName()), resolution);
            result.add(resolution);
        }

        log.debug("Resolved {} overlays", result.size());
        return result;
    }

    public synchronized Optional<OverlayResolution> resolutionOf(String overlayName) {
        return Optional.ofNullable(resolutions.get(key(overlayName)));
    }

    /**
     * Name to emit for a REDEFINES operand: the target's replacement, or the target
     * unchanged when it has none.
     */
    public String resolvedTargetName(String targetName, MappingTable table) {
        String replacement = replacementOf(targetName, table);
        return replacement != null ? replacement : targetName;
    }

    private static String replacementOf(String name, MappingTable table) {
        if (name == null) {
            return null;
        }
        if (table.isNeverRename(name)) {
            return name;
        }
        return table.lookup(name).map(MappingEntry::getReplacement).orElse(null);
    }

    private static String key(String name) {
        return name == null ? "" : name.toUpperCase(Locale.ROOT);
    }
}
