package dev.execgraph.model;

/**
 * A task in an execution graph. The label defaults to the id.
 */
public record Node(String id, String label) {

    public Node(String id) {
        this(id, id);
    }

    public boolean hasCustomLabel() {
        return !id.equals(label);
    }
}
