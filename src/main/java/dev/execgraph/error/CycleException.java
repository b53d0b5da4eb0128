package dev.execgraph.error;

import java.util.List;

public final class CycleException extends ConversionException {

    private final List<String> nodes;

    public CycleException(List<String> nodes) {
        super("Graph contains a cycle through nodes: " + nodes);
        this.nodes = List.copyOf(nodes);
    }

    /** Nodes that could not be ordered, i.e. nodes on or behind a cycle. */
    public List<String> nodes() { return nodes; }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CYCLE;
    }
}
