package dev.execgraph.engine;

import dev.execgraph.model.Edge;
import dev.execgraph.model.TaskGraph;
import org.junit.jupiter.api.Test;

import static dev.execgraph.model.Structure.leaf;
import static dev.execgraph.model.Structure.parallel;
import static dev.execgraph.model.Structure.sequence;
import static org.assertj.core.api.Assertions.assertThat;

class StructureFlattenerTest {

    @Test
    void sequenceChainsConsecutiveTasks() {
        TaskGraph graph = StructureFlattener.toGraph(
            sequence(leaf("q0"), leaf("q1"), leaf("q2"), leaf("q3")), "G");

        assertThat(graph.name()).isEqualTo("G");
        assertThat(graph.edges()).containsExactly(
            new Edge("q0", "q1"), new Edge("q1", "q2"), new Edge("q2", "q3"));
    }

    @Test
    void parallelFansOutAndIn() {
        TaskGraph graph = StructureFlattener.toGraph(
            sequence(leaf("q0"), parallel(leaf("q1"), leaf("q2")), leaf("q3")), "G");

        assertThat(graph.nodeIds()).containsExactly("q0", "q1", "q2", "q3");
        assertThat(graph.edges()).containsExactly(
            new Edge("q0", "q1"), new Edge("q0", "q2"), new Edge("q1", "q3"), new Edge("q2", "q3"));
    }

    @Test
    void nestedSequenceExposesOnlyItsEnds() {
        TaskGraph graph = StructureFlattener.toGraph(
            sequence(
                leaf("q1"),
                parallel(sequence(leaf("q2"), leaf("q4")), leaf("q3")),
                leaf("q5")),
            "G");

        assertThat(graph.edges()).containsExactlyInAnyOrder(
            new Edge("q1", "q2"), new Edge("q2", "q4"), new Edge("q1", "q3"),
            new Edge("q4", "q5"), new Edge("q3", "q5"));
    }

    @Test
    void consecutiveParallelsAreFullyConnected() {
        TaskGraph graph = StructureFlattener.toGraph(
            sequence(parallel(leaf("a"), leaf("b")), parallel(leaf("c"), leaf("d"))), "G");

        assertThat(graph.edges()).containsExactlyInAnyOrder(
            new Edge("a", "c"), new Edge("a", "d"), new Edge("b", "c"), new Edge("b", "d"));
    }

    @Test
    void topLevelParallelHasNoEdges() {
        TaskGraph graph = StructureFlattener.toGraph(parallel(leaf("a"), leaf("b")), "G");

        assertThat(graph.nodeIds()).containsExactly("a", "b");
        assertThat(graph.edges()).isEmpty();
    }
}
