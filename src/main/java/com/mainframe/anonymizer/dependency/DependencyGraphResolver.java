package com.mainframe.anonymizer.dependency;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.anonymizer.exception.AnonymizerException;
import com.mainframe.anonymizer.exception.CircularDependencyException;
import com.mainframe.anonymizer.exception.MissingFragmentException;
import com.mainframe.anonymizer.parser.IncludeStatement;
import com.mainframe.anonymizer.parser.IncludeStatementScanner;
import com.mainframe.anonymizer.parser.ReservedWords;

/**
 * Orders a batch so that every copybook is processed before the files that include it.
 *
 * COPY operands are matched against the batch by upper-cased file name without
 * extension; copybooks missing from the batch are looked up with the
 * {@link FragmentLocator} and added to it. The order is a depth-first post-order over
 * file names in sorted order, so it is the same on every run.
 */
public class DependencyGraphResolver {
    private static final Logger log = LoggerFactory.getLogger(DependencyGraphResolver.class);

    private static final Set<String> COPYBOOK_EXTENSIONS = Set.of(".CPY", ".COPY");

    private enum Mark { WHITE, GREY, BLACK }

    private final IncludeStatementScanner scanner = new IncludeStatementScanner();
    private final FragmentLocator locator;

    public DependencyGraphResolver() {
        this(FragmentLocator.none());
    }

    public DependencyGraphResolver(FragmentLocator locator) {
        this.locator = locator;
    }

    /**
     * @throws MissingFragmentException  when a COPY names a copybook that cannot be found
     * @throws CircularDependencyException when copybooks include each other
     */
    public ProcessingOrder buildProcessingOrder(List<SourceUnit> units) {
        DependencyGraph graph = buildGraph(units);
        List<String> order = topologicalOrder(graph);

        Set<String> fragments = new TreeSet<>(graph.includedFiles());
        for (String node : graph.nodes()) {
            if (COPYBOOK_EXTENSIONS.contains(graph.unit(node).getExtension().toUpperCase(Locale.ROOT))) {
                fragments.add(node);
            }
        }

        List<SourceUnit> ordered = order.stream().map(graph::unit).toList();
        log.info("Processing order: {}", order);
        return new ProcessingOrder(ordered, fragments, graph);
    }

    DependencyGraph buildGraph(List<SourceUnit> units) {
        DependencyGraph graph = new DependencyGraph();
        Map<String, String> byUnitName = new TreeMap<>();

        List<SourceUnit> sorted = new ArrayList<>(units);
        sorted.sort((a, b) -> a.getFileName().compareTo(b.getFileName()));
        for (SourceUnit unit : sorted) {
            register(graph, byUnitName, unit);
        }

        Deque<SourceUnit> pending = new ArrayDeque<>(sorted);
        while (!pending.isEmpty()) {
            SourceUnit consumer = pending.poll();
            for (IncludeStatement statement : scanner.scan(consumer.getFileName(), consumer.getLines())) {
                String fragmentKey = normalizeName(statement.getFragmentName());
                if (fragmentKey.isBlank()) {
                    log.warn("{}:{}: COPY statement without a name", consumer.getFileName(), statement.getLine());
                    continue;
                }

                String fragmentFile = byUnitName.get(fragmentKey);
                if (fragmentFile == null) {
                    SourceUnit located = locator.find(fragmentKey).orElse(null);
                    if (located == null) {
                        if (ReservedWords.isSystemIdentifier(fragmentKey)) {
                            log.info("{}:{}: system copybook {} is not part of the batch, left as is",
                                    consumer.getFileName(), statement.getLine(), fragmentKey);
                            graph.addSystemInclude(statement);
                            continue;
                        }
                        throw new MissingFragmentException(fragmentKey, consumer.getFileName(), statement.getLine());
                    }
                    if (graph.contains(located.getFileName())) {
                        throw new AnonymizerException("Copybook " + located.getFileName()
                                + " found outside the batch clashes with a batch file of the same name");
                    }
                    register(graph, byUnitName, located);
                    pending.add(located);
                    fragmentFile = located.getFileName();
                }
                graph.addEdge(consumer.getFileName(), fragmentFile, statement);
            }
        }
        return graph;
    }

    private static void register(DependencyGraph graph, Map<String, String> byUnitName, SourceUnit unit) {
        graph.addUnit(unit);
        String previous = byUnitName.get(unit.getUnitName());
        boolean isCopybook = COPYBOOK_EXTENSIONS.contains(unit.getExtension().toUpperCase(Locale.ROOT));
        if (previous == null || isCopybook && !COPYBOOK_EXTENSIONS.contains(
                graph.unit(previous).getExtension().toUpperCase(Locale.ROOT))) {
            byUnitName.put(unit.getUnitName(), unit.getFileName());
        }
        if (previous != null) {
            log.warn("Files {} and {} share the name {}; COPY {} resolves to {}", previous, unit.getFileName(),
                    unit.getUnitName(), unit.getUnitName(), byUnitName.get(unit.getUnitName()));
        }
    }

    /**
     * Depth-first post-order: dependencies come before their consumers. A grey node
     * reached again closes a cycle.
     */
    List<String> topologicalOrder(DependencyGraph graph) {
        Map<String, Mark> marks = new HashMap<>();
        graph.nodes().forEach(node -> marks.put(node, Mark.WHITE));

        List<String> order = new ArrayList<>();
        Deque<String> path = new ArrayDeque<>();
        for (String node : graph.nodes()) {
            if (marks.get(node) == Mark.WHITE) {
                visit(graph, node, marks, path, order);
            }
        }
        return order;
    }

    private void visit(DependencyGraph graph, String node, Map<String, Mark> marks,
                       Deque<String> path, List<String> order) {
        marks.put(node, Mark.GREY);
        path.addLast(node);

        for (String fragment : graph.fragmentsOf(node)) {
            Mark mark = marks.get(fragment);
            if (mark == Mark.GREY) {
                List<String> cycle = cycleFrom(path, fragment);
                throw new CircularDependencyException(cycle, cycleLinks(graph, cycle));
            }
            if (mark == Mark.WHITE) {
                visit(graph, fragment, marks, path, order);
            }
        }

        path.removeLast();
        marks.put(node, Mark.BLACK);
        order.add(node);
    }

    private static List<String> cycleFrom(Deque<String> path, String repeated) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String node : path) {
            if (node.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(node);
            }
        }
        cycle.add(repeated);
        return cycle;
    }

    /**
     * {@code file:line COPY name} for every edge of a cycle.
     */
    private static List<String> cycleLinks(DependencyGraph graph, List<String> cycle) {
        List<String> links = new ArrayList<>();
        for (int i = 0; i + 1 < cycle.size(); i++) {
            String consumer = cycle.get(i);
            String fragment = cycle.get(i + 1);
            links.add(graph.statementFor(consumer, fragment)
                    .map(statement -> consumer + ":" + statement.getLine() + " COPY " + statement.getFragmentName())
                    .orElse(consumer + " COPY " + fragment));
        }
        return links;
    }

    private static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        return SourceUnit.stem(name);
    }
}
