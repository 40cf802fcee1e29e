package com.mainframe.anonymizer.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Serializable snapshot of a {@link MappingTable}: every entry plus the per-category
 * counters needed to continue issuing names in a later run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingState {
    private String namingScheme;
    @Builder.Default
    private List<Entry> entries = new ArrayList<>();
    @Builder.Default
    private Map<String, Integer> counters = new TreeMap<>();
    @Builder.Default
    private List<String> neverRename = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private String originalName;
        private String replacement;
        private String category;
        private boolean externallyVisible;
        private String firstSeenFile;
        private int firstSeenLine;
        private int occurrenceCount;
        private boolean neverRename;
    }
}
