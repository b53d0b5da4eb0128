package dev.execgraph.engine;

import dev.execgraph.model.Structure;
import dev.execgraph.model.TaskGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires a {@link Structure} into the plain graph it denotes. Inside a sequence the sinks
 * of each child feed the sources of the next child; a parallel exposes the union of its
 * children's sources and sinks.
 */
public final class StructureFlattener {

    private StructureFlattener() {}

    public static TaskGraph toGraph(Structure structure, String graphName) {
        var builder = TaskGraph.builder().name(graphName);
        for (String id : structure.taskIds()) {
            builder.node(id);
        }
        wire(structure, builder);
        return builder.build();
    }

    /** Entry and exit tasks of a wired sub-structure. */
    private record Ends(List<String> sources, List<String> sinks) {}

    private static Ends wire(Structure structure, TaskGraph.Builder builder) {
        if (structure instanceof Structure.Leaf leaf) {
            return new Ends(List.of(leaf.id()), List.of(leaf.id()));
        }
        if (structure instanceof Structure.Sequence sequence) {
            Ends first = null;
            Ends previous = null;
            for (Structure child : sequence.children()) {
                Ends current = wire(child, builder);
                if (previous == null) {
                    first = current;
                } else {
                    for (String from : previous.sinks()) {
                        for (String to : current.sources()) {
                            builder.edge(from, to);
                        }
                    }
                }
                previous = current;
            }
            return new Ends(first.sources(), previous.sinks());
        }
        if (structure instanceof Structure.Parallel parallel) {
            var sources = new ArrayList<String>();
            var sinks = new ArrayList<String>();
            for (Structure child : parallel.children()) {
                Ends ends = wire(child, builder);
                sources.addAll(ends.sources());
                sinks.addAll(ends.sinks());
            }
            return new Ends(sources, sinks);
        }
        throw new IllegalStateException("Unknown structure: " + structure);
    }
}
