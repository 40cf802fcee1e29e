package com.mainframe.anonymizer.exception;

import java.util.List;

/**
 * A COPY chain leads back to a file already on the chain.
 */
public class CircularDependencyException extends AnonymizerException {

    private static final long serialVersionUID = 1L;
    private final List<String> cycle;
    private final List<String> links;

    /**
     * @param links one {@code file:line COPY name} entry per edge of the cycle
     */
    public CircularDependencyException(List<String> cycle, List<String> links) {
        super("Circular COPY dependency detected: " + String.join(" -> ", cycle)
                + " (" + String.join(", ", links) + ")");
        this.cycle = List.copyOf(cycle);
        this.links = List.copyOf(links);
    }

    /**
     * The cycle, first element repeated at the end.
     */
    public List<String> getCycle() {
        return cycle;
    }

    public List<String> getLinks() {
        return links;
    }
}
