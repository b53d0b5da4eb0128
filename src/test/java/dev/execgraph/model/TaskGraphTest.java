package dev.execgraph.model;

import dev.execgraph.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskGraphTest {

    @Test
    void keepsFirstSeenOrderAndCollapsesDuplicateEdges() {
        TaskGraph graph = TaskGraph.builder()
            .edge("b", "c")
            .node("a")
            .edge("b", "c")
            .node("b")
            .build();

        assertThat(graph.nodeIds()).containsExactly("b", "c", "a");
        assertThat(graph.edges()).containsExactly(new Edge("b", "c"));
        assertThat(graph.successors("b")).containsExactly("c");
        assertThat(graph.predecessors("c")).containsExactly("b");
        assertThat(graph.predecessors("a")).isEmpty();
    }

    @Test
    void laterLabelReplacesEarlierOneInPlace() {
        TaskGraph graph = TaskGraph.builder()
            .node("a", "first")
            .node("b")
            .node("a", "second")
            .build();

        assertThat(graph.nodeIds()).containsExactly("a", "b");
        assertThat(graph.node("a").label()).isEqualTo("second");
        assertThat(graph.node("b").hasCustomLabel()).isFalse();
    }

    @Test
    void rejectsSelfLoopsAndInvalidIdentifiers() {
        assertThatThrownBy(() -> TaskGraph.builder().edge("a", "a"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Self-loop");
        assertThatThrownBy(() -> TaskGraph.builder().node("has space"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Invalid task identifier");
        assertThatThrownBy(() -> TaskGraph.builder().node(""))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void sortsEdgesBySourceThenTargetPosition() {
        TaskGraph graph = TaskGraph.builder()
            .node("x").node("y").node("z")
            .edge("y", "z")
            .edge("x", "z")
            .edge("x", "y")
            .build();

        assertThat(graph.sortedEdges())
            .containsExactly(new Edge("x", "y"), new Edge("x", "z"), new Edge("y", "z"));
    }

    @Test
    void sameTopologyIgnoresNameLabelsAndOrder() {
        TaskGraph first = TaskGraph.builder().name("one").edge("a", "b").node("c", "C").build();
        TaskGraph second = TaskGraph.builder().name("two").node("c").edge("a", "b").build();
        TaskGraph third = TaskGraph.builder().edge("b", "a").node("c").build();

        assertThat(first.sameTopology(second)).isTrue();
        assertThat(first.sameTopology(third)).isFalse();
    }
}
