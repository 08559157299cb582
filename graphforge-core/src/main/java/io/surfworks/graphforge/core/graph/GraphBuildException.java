package io.surfworks.graphforge.core.graph;

/**
 * Thrown when a graph construction call violates its preconditions.
 *
 * <p>Raised before the module or function is modified, so the graph is left
 * as it was before the call.
 */
public class GraphBuildException extends RuntimeException {

    public GraphBuildException(String message) {
        super(message);
    }

    public GraphBuildException(String format, Object... args) {
        super(String.format(format, args));
    }
}
