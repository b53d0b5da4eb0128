package dev.execgraph.engine;

import dev.execgraph.error.ConversionException;
import dev.execgraph.format.CustomFormatParser;
import dev.execgraph.format.CustomFormatWriter;
import dev.execgraph.format.DotParser;
import dev.execgraph.format.DotWriter;
import dev.execgraph.format.MermaidParser;
import dev.execgraph.format.MermaidWriter;
import dev.execgraph.model.ConversionBundle;
import dev.execgraph.model.ConversionOptions;
import dev.execgraph.model.ConversionResult;
import dev.execgraph.model.GraphFormat;
import dev.execgraph.model.Structure;
import dev.execgraph.model.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts text in one notation into the other two. Every target is produced
 * independently, so a graph that is not series-parallel still gets its DOT and
 * Mermaid renditions. Instances hold only immutable options and may be shared
 * between threads.
 */
public final class GraphConverter {

    private static final Logger log = LoggerFactory.getLogger(GraphConverter.class);

    private final ConversionOptions options;

    public GraphConverter() {
        this(ConversionOptions.defaults());
    }

    public GraphConverter(ConversionOptions options) {
        this.options = Objects.requireNonNull(options);
    }

    public ConversionOptions options() {
        return options;
    }

    /**
     * Convert {@code text} written in {@code source} into every notation. The source slot
     * echoes the input; blank input produces empty text in every slot.
     */
    public ConversionBundle convert(GraphFormat source, String text) {
        Objects.requireNonNull(source);
        Objects.requireNonNull(text);
        log.debug("Converting {} input ({} chars)", source, text.length());

        Map<GraphFormat, ConversionResult> results = new EnumMap<>(GraphFormat.class);
        results.put(source, new ConversionResult.Success(text));

        if (text.isBlank()) {
            for (GraphFormat target : GraphFormat.values()) {
                results.putIfAbsent(target, new ConversionResult.Success(""));
            }
            return new ConversionBundle(source, results);
        }

        TaskGraph graph;
        try {
            graph = parse(source, text);
        } catch (ConversionException e) {
            log.debug("Parsing {} input failed: {}", source, e.getMessage());
            var failure = new ConversionResult.Failure(e.kind(), e.getMessage());
            for (GraphFormat target : GraphFormat.values()) {
                results.putIfAbsent(target, failure);
            }
            return new ConversionBundle(source, results);
        }

        for (GraphFormat target : GraphFormat.values()) {
            if (target != source) {
                results.put(target, produce(target, graph));
            }
        }
        return new ConversionBundle(source, results);
    }

    /**
     * Parse text in any notation into the shared graph model.
     *
     * @throws ConversionException if the text is malformed
     */
    public TaskGraph parse(GraphFormat format, String text) {
        return switch (format) {
            case CUSTOM -> StructureFlattener.toGraph(
                CustomFormatParser.parse(text, options), options.graphName());
            case DOT -> DotParser.parse(text);
            case MERMAID -> MermaidParser.parse(text, options);
        };
    }

    /**
     * Write a graph in the given notation. Custom output requires an acyclic
     * series-parallel graph.
     *
     * @throws ConversionException if the graph cannot be written in that notation
     */
    public String write(GraphFormat format, TaskGraph graph) {
        return switch (format) {
            case CUSTOM -> CustomFormatWriter.write(decompose(graph));
            case DOT -> DotWriter.write(graph);
            case MERMAID -> MermaidWriter.write(graph, options.flowchartDirection());
        };
    }

    public Structure decompose(TaskGraph graph) {
        return SeriesParallelDecomposer.decompose(graph, options);
    }

    private ConversionResult produce(GraphFormat target, TaskGraph graph) {
        try {
            return new ConversionResult.Success(write(target, graph));
        } catch (ConversionException e) {
            log.debug("Writing {} failed ({}): {}", target, e.kind(), e.getMessage());
            return new ConversionResult.Failure(e.kind(), e.getMessage());
        }
    }
}
