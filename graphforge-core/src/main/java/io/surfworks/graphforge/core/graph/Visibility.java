package io.surfworks.graphforge.core.graph;

/**
 * Whether a {@link Variable} is observable outside the module.
 */
public enum Visibility {
    /** Model inputs and outputs. */
    PUBLIC,
    /** Learnable or derived internal state. */
    PRIVATE
}
