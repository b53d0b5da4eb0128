package dev.execgraph.error;

/**
 * Category of a conversion failure, reported next to the affected format.
 */
public enum ErrorKind {
    /** Malformed input text for a given notation. */
    SYNTAX,
    /** The graph contains a directed cycle. */
    CYCLE,
    /** The graph is acyclic but cannot be expressed as nested Sequence/Parallel blocks. */
    DECOMPOSITION,
    /** Duplicate identifiers, undeclared references, self-loops, empty blocks. */
    VALIDATION
}
