package dev.execgraph.model;

/**
 * A dependency: {@code target} runs after {@code source}.
 */
public record Edge(String source, String target) {

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
