package dev.execgraph.model;

import java.util.Set;

/**
 * Knobs for a conversion: resource bounds plus the presentation choices that the
 * text writers need.
 */
public record ConversionOptions(
    int maxNestingDepth,
    int maxTasks,
    String graphName,
    String flowchartDirection
) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;
    /** Upper bound for {@link #maxNestingDepth}; readers and writers recurse once per level. */
    public static final int NESTING_DEPTH_CEILING = 1_000;
    public static final int DEFAULT_MAX_TASKS = 10_000;
    public static final String DEFAULT_GRAPH_NAME = TaskGraph.DEFAULT_NAME;
    public static final String DEFAULT_FLOWCHART_DIRECTION = "TD";

    public static final Set<String> FLOWCHART_DIRECTIONS = Set.of("TD", "TB", "BT", "LR", "RL");

    public ConversionOptions {
        if (maxNestingDepth < 1 || maxNestingDepth > NESTING_DEPTH_CEILING) {
            throw new IllegalArgumentException("maxNestingDepth must be between 1 and %d: %d"
                .formatted(NESTING_DEPTH_CEILING, maxNestingDepth));
        }
        if (maxTasks < 1) {
            throw new IllegalArgumentException("maxTasks must be positive: " + maxTasks);
        }
        if (!TaskGraph.isValidIdentifier(graphName)) {
            throw new IllegalArgumentException("Invalid graph name: " + graphName);
        }
        if (!FLOWCHART_DIRECTIONS.contains(flowchartDirection)) {
            throw new IllegalArgumentException("Invalid flowchart direction '%s'. Valid directions: %s"
                .formatted(flowchartDirection, FLOWCHART_DIRECTIONS));
        }
    }

    public static ConversionOptions defaults() {
        return new ConversionOptions(DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_TASKS,
            DEFAULT_GRAPH_NAME, DEFAULT_FLOWCHART_DIRECTION);
    }

    public ConversionOptions withMaxNestingDepth(int value) {
        return new ConversionOptions(value, maxTasks, graphName, flowchartDirection);
    }

    public ConversionOptions withMaxTasks(int value) {
        return new ConversionOptions(maxNestingDepth, value, graphName, flowchartDirection);
    }

    public ConversionOptions withGraphName(String value) {
        return new ConversionOptions(maxNestingDepth, maxTasks, value, flowchartDirection);
    }

    public ConversionOptions withFlowchartDirection(String value) {
        return new ConversionOptions(maxNestingDepth, maxTasks, graphName, value);
    }
}
