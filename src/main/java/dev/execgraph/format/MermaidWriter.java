package dev.execgraph.format;

import dev.execgraph.error.ValidationException;
import dev.execgraph.model.Edge;
import dev.execgraph.model.Node;
import dev.execgraph.model.TaskGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes a {@link TaskGraph} as a Mermaid flowchart, fusing edges into as few arrow
 * chains as a single greedy walk allows.
 *
 * <p>Tasks named like a Mermaid statement keyword ({@code style}, {@code class}, ...) are
 * always written with a shape so they cannot start a statement. A task named {@code end}
 * cannot be written at all.
 */
public final class MermaidWriter {

    private static final String INDENT = "    ";
    private static final Pattern PLAIN_LABEL = Pattern.compile("[\\w .,:!?'+*/-]*");

    private MermaidWriter() {}

    public static String write(TaskGraph graph, String direction) {
        if (graph.contains(MermaidParser.END)) {
            throw new ValidationException(
                "Task id '%s' is reserved in Mermaid flowcharts".formatted(MermaidParser.END));
        }
        var sb = new StringBuilder();
        sb.append("flowchart ").append(direction).append('\n');

        Set<Edge> written = new HashSet<>();
        Set<String> mentioned = new HashSet<>();
        List<Edge> edges = graph.sortedEdges();

        for (Edge start : edges) {
            if (written.contains(start)) {
                continue;
            }
            written.add(start);
            List<String> chain = new ArrayList<>(List.of(start.source(), start.target()));
            String current = start.target();
            while (graph.successors(current).size() == 1) {
                String next = graph.successors(current).iterator().next();
                Edge link = new Edge(current, next);
                if (graph.predecessors(next).size() != 1 || written.contains(link)) {
                    break;
                }
                written.add(link);
                chain.add(next);
                current = next;
            }

            sb.append(INDENT);
            for (int i = 0; i < chain.size(); i++) {
                if (i > 0) {
                    sb.append(" --> ");
                }
                sb.append(reference(graph.node(chain.get(i)), mentioned));
            }
            sb.append('\n');
        }

        for (String id : graph.nodeIds()) {
            if (!mentioned.contains(id)) {
                sb.append(INDENT).append(reference(graph.node(id), mentioned)).append('\n');
            }
        }
        return sb.toString();
    }

    /** The label goes on the first mention of a node only, keyword ids get it every time. */
    private static String reference(Node node, Set<String> mentioned) {
        boolean first = mentioned.add(node.id());
        if (MermaidParser.DIRECTIVE_KEYWORDS.contains(node.id())) {
            return node.id() + shape(node.label());
        }
        if (!first || !node.hasCustomLabel()) {
            return node.id();
        }
        return node.id() + shape(node.label());
    }

    private static String shape(String label) {
        if (PLAIN_LABEL.matcher(label).matches()) {
            return "[" + label + "]";
        }
        return "[\"" + label.replace("\"", "#quot;") + "\"]";
    }
}
