package io.surfworks.graphforge.core.graph;

/**
 * How a {@link Variable}'s payload is initialized when it is created.
 */
public enum TrainKind {
    /** Payload is left zeroed. */
    NONE,
    /** Uniform random values scaled by the fan-in passed as the init value. */
    XAVIER,
    /** Every element set to the init value. */
    BROADCAST
}
