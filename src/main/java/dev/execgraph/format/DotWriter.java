package dev.execgraph.format;

import dev.execgraph.model.Edge;
import dev.execgraph.model.Node;
import dev.execgraph.model.TaskGraph;

import java.util.Locale;
import java.util.Set;

/**
 * Writes a {@link TaskGraph} as a DOT digraph: node statements in graph order, then
 * edge statements ordered by source and target position. The output is what an
 * external GraphViz layout run expects.
 */
public final class DotWriter {

    private static final Set<String> KEYWORDS = Set.of("node", "edge", "graph", "digraph", "subgraph", "strict");

    private DotWriter() {}

    public static String write(TaskGraph graph) {
        var sb = new StringBuilder();
        sb.append("digraph ").append(id(graph.name())).append(" {\n");
        for (String nodeId : graph.nodeIds()) {
            Node node = graph.node(nodeId);
            sb.append("  ").append(id(node.id()));
            if (node.hasCustomLabel()) {
                sb.append(" [label=").append(quote(node.label())).append(']');
            }
            sb.append(";\n");
        }
        for (Edge edge : graph.sortedEdges()) {
            sb.append("  ").append(id(edge.source())).append(" -> ").append(id(edge.target())).append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    /** Bare when GraphViz reads it as one plain id, quoted otherwise. */
    private static String id(String name) {
        boolean bare = TaskGraph.isValidIdentifier(name)
            && !KEYWORDS.contains(name.toLowerCase(Locale.ROOT))
            && (!Character.isDigit(name.charAt(0)) || name.chars().allMatch(Character::isDigit));
        return bare ? name : quote(name);
    }

    /**
     * Inverse of the lexer's quoted strings: only {@code \"} and {@code \\} are escapes,
     * other backslash sequences such as {@code \n} are kept for GraphViz to interpret.
     */
    private static String quote(String value) {
        var sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"') {
                sb.append("\\\"");
            } else if (c == '\\' && (i + 1 == value.length() || value.charAt(i + 1) == '"' || value.charAt(i + 1) == '\\')) {
                sb.append("\\\\");
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
