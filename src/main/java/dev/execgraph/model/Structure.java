package dev.execgraph.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Nested execution structure of a graph: a task, tasks run one after another,
 * or tasks run side by side.
 */
public sealed interface Structure {

    /** Task ids in tree order. */
    List<String> taskIds();

    /** Id of the first task in tree order; used as the ordering key during decomposition. */
    default String firstTask() {
        Structure current = this;
        while (!(current instanceof Leaf)) {
            current = childrenOf(current).get(0);
        }
        return ((Leaf) current).id();
    }

    /** A single task. */
    record Leaf(String id) implements Structure {
        @Override
        public List<String> taskIds() {
            return List.of(id);
        }
    }

    /** Children run in order; each one starts after the previous one finished. */
    record Sequence(List<Structure> children) implements Structure {
        public Sequence {
            if (children.isEmpty()) {
                throw new IllegalArgumentException("Sequence needs at least one child");
            }
            children = List.copyOf(children);
        }

        @Override
        public List<String> taskIds() {
            return collect(children);
        }
    }

    /** Children share the same predecessors and successors. */
    record Parallel(List<Structure> children) implements Structure {
        public Parallel {
            if (children.isEmpty()) {
                throw new IllegalArgumentException("Parallel needs at least one child");
            }
            children = List.copyOf(children);
        }

        @Override
        public List<String> taskIds() {
            return collect(children);
        }
    }

    static Structure leaf(String id) {
        return new Leaf(id);
    }

    static Structure sequence(Structure... children) {
        return new Sequence(List.of(children));
    }

    static Structure parallel(Structure... children) {
        return new Parallel(List.of(children));
    }

    // no recursion: decomposed trees can nest deeply
    private static List<String> collect(List<Structure> children) {
        var ids = new ArrayList<String>();
        Deque<Structure> pending = new ArrayDeque<>();
        pushReversed(pending, children);
        while (!pending.isEmpty()) {
            Structure next = pending.pop();
            if (next instanceof Leaf leaf) {
                ids.add(leaf.id());
            } else {
                pushReversed(pending, childrenOf(next));
            }
        }
        return ids;
    }

    private static void pushReversed(Deque<Structure> pending, List<Structure> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
    }

    private static List<Structure> childrenOf(Structure structure) {
        if (structure instanceof Sequence sequence) {
            return sequence.children();
        }
        if (structure instanceof Parallel parallel) {
            return parallel.children();
        }
        return List.of();
    }
}
