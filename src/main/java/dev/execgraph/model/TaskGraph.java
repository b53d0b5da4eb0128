package dev.execgraph.model;

import dev.execgraph.error.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable node/edge graph shared by every notation. Nodes keep first-seen order,
 * edges keep insertion order with duplicates collapsed.
 */
public final class TaskGraph {

    public static final String DEFAULT_NAME = "ExecutionGraph";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_]+");

    private final String name;
    private final Map<String, Node> nodes;
    private final Set<Edge> edges;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;

    private TaskGraph(String name, Map<String, Node> nodes, Set<Edge> edges) {
        this.name = name;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));

        var succ = new LinkedHashMap<String, Set<String>>();
        var pred = new LinkedHashMap<String, Set<String>>();
        for (String id : nodes.keySet()) {
            succ.put(id, new LinkedHashSet<>());
            pred.put(id, new LinkedHashSet<>());
        }
        for (Edge e : edges) {
            succ.get(e.source()).add(e.target());
            pred.get(e.target()).add(e.source());
        }
        succ.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        pred.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.successors = Collections.unmodifiableMap(succ);
        this.predecessors = Collections.unmodifiableMap(pred);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static boolean isValidIdentifier(String id) {
        return id != null && IDENTIFIER.matcher(id).matches();
    }

    public String name() { return name; }

    /** Node ids in first-seen order. */
    public List<String> nodeIds() {
        return List.copyOf(nodes.keySet());
    }

    public Node node(String id) {
        return nodes.get(id);
    }

    public Set<Edge> edges() { return edges; }

    public int size() { return nodes.size(); }

    public boolean isEmpty() { return nodes.isEmpty(); }

    public boolean contains(String id) { return nodes.containsKey(id); }

    public Set<String> successors(String id) {
        return successors.getOrDefault(id, Set.of());
    }

    public Set<String> predecessors(String id) {
        return predecessors.getOrDefault(id, Set.of());
    }

    /**
     * Edges ordered by source position, then target position.
     */
    public List<Edge> sortedEdges() {
        var position = new LinkedHashMap<String, Integer>();
        for (String id : nodes.keySet()) {
            position.put(id, position.size());
        }
        var sorted = new ArrayList<>(edges);
        sorted.sort((a, b) -> {
            int bySource = Integer.compare(position.get(a.source()), position.get(b.source()));
            return bySource != 0 ? bySource : Integer.compare(position.get(a.target()), position.get(b.target()));
        });
        return sorted;
    }

    /** Same nodes and same edges; names, labels and ordering are ignored. */
    public boolean sameTopology(TaskGraph other) {
        return nodes.keySet().equals(other.nodes.keySet()) && edges.equals(other.edges);
    }

    @Override
    public String toString() {
        return "TaskGraph[" + name + ", nodes=" + nodes.keySet() + ", edges=" + edges + "]";
    }

    /**
     * Collects nodes and edges. Edges may reference nodes that are not declared yet,
     * they are declared implicitly.
     */
    public static final class Builder {
        private String name = DEFAULT_NAME;
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final Set<Edge> edges = new LinkedHashSet<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /** Declare a node, keeping its position if it was seen before. */
        public Builder node(String id) {
            requireIdentifier(id);
            nodes.putIfAbsent(id, new Node(id));
            return this;
        }

        /** Declare a node with a label; a later label for the same id wins. */
        public Builder node(String id, String label) {
            requireIdentifier(id);
            nodes.put(id, new Node(id, label == null || label.isBlank() ? id : label));
            return this;
        }

        public Builder edge(String source, String target) {
            if (source.equals(target)) {
                throw new ValidationException("Self-loop on node '%s'".formatted(source));
            }
            node(source);
            node(target);
            edges.add(new Edge(source, target));
            return this;
        }

        public boolean contains(String id) {
            return nodes.containsKey(id);
        }

        public TaskGraph build() {
            return new TaskGraph(name, nodes, edges);
        }

        private static void requireIdentifier(String id) {
            if (!isValidIdentifier(id)) {
                throw new ValidationException(
                    "Invalid task identifier '%s': only letters, digits and '_' are allowed".formatted(id));
            }
        }
    }
}
