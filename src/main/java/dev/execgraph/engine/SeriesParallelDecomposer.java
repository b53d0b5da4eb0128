package dev.execgraph.engine;

import dev.execgraph.error.DecompositionException;
import dev.execgraph.model.ConversionOptions;
import dev.execgraph.model.Structure;
import dev.execgraph.model.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Infers nested Sequence/Parallel structure from a plain DAG by repeated reduction.
 *
 * <p>Every task starts as its own element. Two reductions are applied until one element
 * is left:
 * <ul>
 *   <li><b>series</b>: an edge {@code u -> v} where {@code u} has no other successor and
 *       {@code v} has no other predecessor collapses into {@code Sequence(u, v)};</li>
 *   <li><b>parallel</b>: two or more elements with identical predecessor and successor
 *       sets collapse into one {@code Parallel}.</li>
 * </ul>
 * Series is tried first, candidates are visited in id order, and an element is keyed by
 * the id of its first task, so the same graph always yields the same tree. When neither
 * reduction applies the graph is not series-parallel and decomposition fails.
 *
 * <p>The nesting depth of every merged element is tracked; a merge that would nest blocks
 * deeper than {@link ConversionOptions#maxNestingDepth()} fails, so the result always
 * parses back as block text under the same options.
 *
 * <p>Disconnected components share the empty predecessor and successor sets, so they end
 * up as children of a top-level {@code Parallel}.
 */
public final class SeriesParallelDecomposer {

    private static final Logger log = LoggerFactory.getLogger(SeriesParallelDecomposer.class);

    private final TreeMap<String, Structure> elements = new TreeMap<>();
    private final Map<String, TreeSet<String>> predecessors = new HashMap<>();
    private final Map<String, TreeSet<String>> successors = new HashMap<>();
    // blocks nested inside each element, 0 for a single task
    private final Map<String, Integer> depths = new HashMap<>();
    private final int maxDepth;

    private SeriesParallelDecomposer(TaskGraph graph, int maxDepth) {
        this.maxDepth = maxDepth;
        for (String id : graph.nodeIds()) {
            elements.put(id, new Structure.Leaf(id));
            depths.put(id, 0);
            predecessors.put(id, new TreeSet<>(graph.predecessors(id)));
            successors.put(id, new TreeSet<>(graph.successors(id)));
        }
    }

    public static Structure decompose(TaskGraph graph) {
        return decompose(graph, ConversionOptions.defaults());
    }

    /**
     * @throws dev.execgraph.error.CycleException if the graph has a cycle
     * @throws DecompositionException if the graph is empty, too large, not series-parallel
     *     or only expressible with blocks nested deeper than the configured limit
     */
    public static Structure decompose(TaskGraph graph, ConversionOptions options) {
        if (graph.isEmpty()) {
            throw new DecompositionException("Graph has no tasks to decompose");
        }
        if (graph.size() > options.maxTasks()) {
            throw new DecompositionException("Graph has %d tasks, more than the limit of %d"
                .formatted(graph.size(), options.maxTasks()));
        }
        CycleDetector.requireAcyclic(graph);

        Structure result = new SeriesParallelDecomposer(graph, options.maxNestingDepth()).reduce();
        return result instanceof Structure.Leaf ? new Structure.Sequence(List.of(result)) : result;
    }

    private Structure reduce() {
        while (elements.size() > 1) {
            if (!reduceSeries() && !reduceParallel()) {
                throw unresolved();
            }
        }
        return elements.firstEntry().getValue();
    }

    private boolean reduceSeries() {
        for (String from : elements.keySet()) {
            TreeSet<String> out = successors.get(from);
            if (out.size() != 1) {
                continue;
            }
            String to = out.first();
            if (predecessors.get(to).size() == 1) {
                mergeSeries(from, to);
                return true;
            }
        }
        return false;
    }

    private void mergeSeries(String from, String to) {
        log.debug("series: {} -> {}", from, to);
        Structure head = elements.get(from);
        Structure tail = elements.get(to);
        int depth = 1 + Math.max(
            childDepth(head, Structure.Sequence.class, depths.get(from)),
            childDepth(tail, Structure.Sequence.class, depths.get(to)));
        requireDepth(depth, head);

        var children = new ArrayList<Structure>();
        children.addAll(sequenceChildren(head));
        children.addAll(sequenceChildren(elements.remove(to)));
        elements.put(from, new Structure.Sequence(children));
        depths.remove(to);
        depths.put(from, depth);

        predecessors.remove(to);
        TreeSet<String> inherited = successors.remove(to);
        successors.put(from, inherited);
        for (String next : inherited) {
            TreeSet<String> preds = predecessors.get(next);
            preds.remove(to);
            preds.add(from);
        }
    }

    private boolean reduceParallel() {
        Map<Signature, List<String>> groups = new LinkedHashMap<>();
        for (String key : elements.keySet()) {
            var signature = new Signature(Set.copyOf(predecessors.get(key)), Set.copyOf(successors.get(key)));
            groups.computeIfAbsent(signature, s -> new ArrayList<>()).add(key);
        }
        for (var entry : groups.entrySet()) {
            if (entry.getValue().size() >= 2) {
                mergeParallel(entry.getValue(), entry.getKey());
                return true;
            }
        }
        return false;
    }

    private void mergeParallel(List<String> group, Signature signature) {
        log.debug("parallel: {}", group);
        String key = group.get(0);
        int depth = 0;
        for (String member : group) {
            depth = Math.max(depth, 1 + childDepth(elements.get(member), Structure.Parallel.class, depths.get(member)));
        }
        requireDepth(depth, elements.get(key));

        var children = new ArrayList<Structure>();
        for (String member : group) {
            children.addAll(parallelChildren(elements.remove(member)));
            predecessors.remove(member);
            successors.remove(member);
            depths.remove(member);
        }
        children.sort(Comparator.comparing(Structure::firstTask));

        for (String pred : signature.predecessors()) {
            successors.get(pred).removeAll(group);
            successors.get(pred).add(key);
        }
        for (String succ : signature.successors()) {
            predecessors.get(succ).removeAll(group);
            predecessors.get(succ).add(key);
        }
        elements.put(key, new Structure.Parallel(children));
        depths.put(key, depth);
        predecessors.put(key, new TreeSet<>(signature.predecessors()));
        successors.put(key, new TreeSet<>(signature.successors()));
    }

    /** Depth an element contributes as a child of a new block; a block of the same kind is flattened. */
    private static int childDepth(Structure element, Class<? extends Structure> blockKind, int depth) {
        return blockKind.isInstance(element) ? depth - 1 : depth;
    }

    private void requireDepth(int depth, Structure anchor) {
        if (depth > maxDepth) {
            throw new DecompositionException(
                "Rebuilt structure would nest blocks deeper than %d levels (at task '%s')"
                    .formatted(maxDepth, anchor.firstTask()));
        }
    }

    private static List<Structure> sequenceChildren(Structure element) {
        return element instanceof Structure.Sequence sequence ? sequence.children() : List.of(element);
    }

    private static List<Structure> parallelChildren(Structure element) {
        return element instanceof Structure.Parallel parallel ? parallel.children() : List.of(element);
    }

    private DecompositionException unresolved() {
        List<String> tasks = new ArrayList<>();
        List<String> blocking = new ArrayList<>();
        for (var entry : elements.entrySet()) {
            tasks.addAll(entry.getValue().taskIds());
            for (String next : successors.get(entry.getKey())) {
                blocking.add(describe(entry.getValue()) + " -> " + describe(elements.get(next)));
            }
        }
        log.debug("stuck with {} elements: {}", elements.size(), blocking);
        return new DecompositionException(
            "Graph is not series-parallel: tasks %s cannot be grouped into Sequence/Parallel blocks (blocking edges: %s)"
                .formatted(tasks, String.join(", ", blocking)),
            tasks, blocking);
    }

    private static String describe(Structure structure) {
        if (structure instanceof Structure.Leaf leaf) {
            return leaf.id();
        }
        List<Structure> children = structure instanceof Structure.Sequence sequence
            ? sequence.children()
            : ((Structure.Parallel) structure).children();
        String kind = structure instanceof Structure.Sequence ? "Sequence" : "Parallel";
        return children.stream()
            .map(SeriesParallelDecomposer::describe)
            .collect(Collectors.joining(", ", kind + "{", "}"));
    }

    /** Predecessor and successor sets that parallel siblings must share. */
    private record Signature(Set<String> predecessors, Set<String> successors) {}
}
