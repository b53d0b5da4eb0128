package dev.execgraph.error;

import java.util.List;

/**
 * The graph cannot be reduced to a single Sequence/Parallel tree.
 */
public final class DecompositionException extends ConversionException {

    private final List<String> unresolvedTasks;
    private final List<String> blockingEdges;

    public DecompositionException(String message) {
        this(message, List.of(), List.of());
    }

    public DecompositionException(String message, List<String> unresolvedTasks, List<String> blockingEdges) {
        super(message);
        this.unresolvedTasks = List.copyOf(unresolvedTasks);
        this.blockingEdges = List.copyOf(blockingEdges);
    }

    public List<String> unresolvedTasks() { return unresolvedTasks; }
    public List<String> blockingEdges() { return blockingEdges; }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DECOMPOSITION;
    }
}
