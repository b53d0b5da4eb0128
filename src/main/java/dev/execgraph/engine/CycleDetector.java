package dev.execgraph.engine;

import dev.execgraph.error.CycleException;
import dev.execgraph.model.TaskGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kahn's algorithm over a {@link TaskGraph}.
 */
public final class CycleDetector {

    private CycleDetector() {}

    /**
     * Topological generations: every task in generation n depends only on tasks in
     * earlier generations. Within a generation tasks keep graph order.
     *
     * @throws CycleException naming the tasks that could not be placed
     */
    public static List<Set<String>> generations(TaskGraph graph) {
        Map<String, Integer> indegree = new LinkedHashMap<>();
        for (String id : graph.nodeIds()) {
            indegree.put(id, graph.predecessors(id).size());
        }

        Deque<String> ready = new ArrayDeque<>();
        for (var entry : indegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        List<Set<String>> generations = new ArrayList<>();
        int placed = 0;
        while (!ready.isEmpty()) {
            Set<String> generation = new LinkedHashSet<>(ready);
            ready.clear();
            generations.add(generation);
            placed += generation.size();
            for (String id : generation) {
                for (String successor : graph.successors(id)) {
                    if (indegree.merge(successor, -1, Integer::sum) == 0) {
                        ready.add(successor);
                    }
                }
            }
        }

        if (placed != graph.size()) {
            List<String> stuck = new ArrayList<>();
            for (var entry : indegree.entrySet()) {
                if (entry.getValue() > 0) {
                    stuck.add(entry.getKey());
                }
            }
            throw new CycleException(stuck);
        }
        return generations;
    }

    public static void requireAcyclic(TaskGraph graph) {
        generations(graph);
    }
}
