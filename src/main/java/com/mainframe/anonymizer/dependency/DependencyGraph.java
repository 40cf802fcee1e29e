package com.mainframe.anonymizer.dependency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.mainframe.anonymizer.parser.IncludeStatement;

/**
 * "Consumer includes fragment" graph over the files of a batch. Nodes are file names;
 * iteration order is sorted so traversals are deterministic.
 */
public class DependencyGraph {

    private final Map<String, SourceUnit> units = new TreeMap<>();
    private final Map<String, Set<String>> edges = new TreeMap<>();
    /** First COPY statement of each edge, by consumer then fragment file. */
    private final Map<String, Map<String, IncludeStatement>> statements = new TreeMap<>();

    private final List<IncludeStatement> systemIncludes = new ArrayList<>();

    public void addUnit(SourceUnit unit) {
        units.put(unit.getFileName(), unit);
        edges.computeIfAbsent(unit.getFileName(), k -> new TreeSet<>());
    }

    public void addEdge(String consumerFile, String fragmentFile, IncludeStatement statement) {
        edges.computeIfAbsent(consumerFile, k -> new TreeSet<>()).add(fragmentFile);
        statements.computeIfAbsent(consumerFile, k -> new TreeMap<>()).putIfAbsent(fragmentFile, statement);
    }

    /**
     * Records a COPY of a system copybook, which is left out of the batch.
     */
    public void addSystemInclude(IncludeStatement statement) {
        systemIncludes.add(statement);
    }

    public List<IncludeStatement> systemIncludes() {
        return Collections.unmodifiableList(systemIncludes);
    }

    public boolean contains(String fileName) {
        return units.containsKey(fileName);
    }

    public SourceUnit unit(String fileName) {
        return units.get(fileName);
    }

    public Set<String> nodes() {
        return Collections.unmodifiableSet(units.keySet());
    }

    public Set<String> fragmentsOf(String consumerFile) {
        return Collections.unmodifiableSet(edges.getOrDefault(consumerFile, Set.of()));
    }

    /**
     * The statement through which {@code consumerFile} includes {@code fragmentFile}.
     */
    public Optional<IncludeStatement> statementFor(String consumerFile, String fragmentFile) {
        return Optional.ofNullable(statements.getOrDefault(consumerFile, Map.of()).get(fragmentFile));
    }

    /**
     * Files that at least one other file includes.
     */
    public Set<String> includedFiles() {
        Set<String> included = new TreeSet<>();
        edges.values().forEach(included::addAll);
        return included;
    }
}
