package io.surfworks.graphforge.core.graph;

import java.util.List;

/**
 * Thrown when a function breaks a structural invariant of the graph.
 *
 * <p>This signals a bug in whatever built or rewrote the graph, not bad user
 * input.
 */
public class GraphVerificationException extends RuntimeException {

    private final GraphVerifier.Rule rule;
    private final List<String> offenders;

    public GraphVerificationException(GraphVerifier.Rule rule, List<String> offenders, String message) {
        super("[" + rule + "] " + message);
        this.rule = rule;
        this.offenders = List.copyOf(offenders);
    }

    public GraphVerifier.Rule rule() {
        return rule;
    }

    /**
     * Names of the entities involved in the violation.
     */
    public List<String> offenders() {
        return offenders;
    }
}
