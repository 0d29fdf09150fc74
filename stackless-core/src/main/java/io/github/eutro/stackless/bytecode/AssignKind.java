package io.github.eutro.stackless.bytecode;

/**
 * How an {@link Bytecode.Assign} moves its source into its destination.
 */
public enum AssignKind {
    COPY,
    MOVE,
    /** A store into a local declared in the source, rather than into a temporary. */
    STORE,
}
