package com.mainframe.anonymizer.dependency;

import java.util.List;
import java.util.Set;

/**
 * Files in the order they must be classified: every copybook before the files that
 * include it. Computed once per batch.
 */
public final class ProcessingOrder {

    private final List<SourceUnit> units;
    private final Set<String> fragmentFiles;
    private final DependencyGraph graph;

    public ProcessingOrder(List<SourceUnit> units, Set<String> fragmentFiles, DependencyGraph graph) {
        this.units = List.copyOf(units);
        this.fragmentFiles = Set.copyOf(fragmentFiles);
        this.graph = graph;
    }

    public List<SourceUnit> getUnits() {
        return units;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public int size() {
        return units.size();
    }

    /**
     * True for files included by another file of the batch, or carrying a copybook extension.
     */
    public boolean isFragment(SourceUnit unit) {
        return fragmentFiles.contains(unit.getFileName());
    }

    public int positionOf(SourceUnit unit) {
        for (int i = 0; i < units.size(); i++) {
            if (units.get(i).getFileName().equals(unit.getFileName())) {
                return i;
            }
        }
        return -1;
    }

    public List<String> fileNames() {
        return units.stream().map(SourceUnit::getFileName).toList();
    }
}
