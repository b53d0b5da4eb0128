package dev.execgraph.cli;

import dev.execgraph.engine.BundleJsonWriter;
import dev.execgraph.engine.GraphConverter;
import dev.execgraph.engine.OptionsLoader;
import dev.execgraph.model.ConversionBundle;
import dev.execgraph.model.ConversionOptions;
import dev.execgraph.model.ConversionResult;
import dev.execgraph.model.GraphFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point: reads one notation and prints the others.
 */
@Command(
    name = "execgraph",
    mixinStandardHelpOptions = true,
    description = "Convert execution graphs between Sequence/Parallel blocks, GraphViz DOT and Mermaid."
)
public class ExecGraphCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExecGraphCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONVERSION_FAILED = 1;
    static final int EXIT_BAD_INPUT = 2;

    @Parameters(index = "0", arity = "0..1", description = "Input file (default: stdin, also '-')")
    private Path input;

    @Option(names = "--from", required = true, converter = FormatConverter.class,
        description = "Input notation: custom, dot, mermaid")
    private GraphFormat from;

    @Option(names = "--to", converter = FormatConverter.class,
        description = "Print only this notation (default: every notation except the input one)")
    private GraphFormat to;

    @Option(names = "--json", description = "Print the result bundle as JSON, limited to --to when given")
    private boolean json;

    @Option(names = "--config", description = "JSON file with conversion options")
    private Path config;

    @Option(names = "--max-depth", description = "Override maxNestingDepth for block input")
    private Integer maxDepth;

    @Option(names = "--max-tasks", description = "Override maxTasks for decomposition")
    private Integer maxTasks;

    @Option(names = "--graph-name", description = "DOT graph name for custom and Mermaid input")
    private String graphName;

    @Option(names = "--direction", description = "Mermaid flowchart direction: TD, TB, BT, LR, RL")
    private String direction;

    // read by Main before the logging backend starts
    @Option(names = "--verbose", description = "Log parsing and decomposition steps to stderr")
    private boolean verbose;

    @Spec
    private CommandSpec spec;

    private final InputStream stdin;

    public ExecGraphCli() {
        this(System.in);
    }

    ExecGraphCli(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ConversionOptions options;
        String text;
        try {
            options = resolveOptions();
            text = readInput();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }

        log.debug("Options: {}", options);
        ConversionBundle bundle = new GraphConverter(options).convert(from, text);

        if (json) {
            List<GraphFormat> included = to != null ? List.of(to) : List.of(GraphFormat.values());
            out.println(BundleJsonWriter.toJson(bundle, included));
            boolean ok = included.stream().allMatch(format -> bundle.get(format).isSuccess());
            return ok ? EXIT_OK : EXIT_CONVERSION_FAILED;
        }

        List<GraphFormat> targets = to != null
            ? List.of(to)
            : Arrays.stream(GraphFormat.values()).filter(f -> f != from).toList();
        boolean ok = true;
        for (GraphFormat target : targets) {
            ConversionResult result = bundle.get(target);
            if (result instanceof ConversionResult.Success success) {
                if (targets.size() > 1) {
                    out.println("== " + target.key() + " ==");
                }
                out.print(success.text());
            } else if (result instanceof ConversionResult.Failure failure) {
                err.printf("%s: %s error: %s%n", target.key(), failure.kind(), failure.message());
                ok = false;
            }
        }
        out.flush();
        return ok ? EXIT_OK : EXIT_CONVERSION_FAILED;
    }

    private ConversionOptions resolveOptions() throws IOException {
        ConversionOptions options = config != null
            ? OptionsLoader.loadFromFile(config)
            : ConversionOptions.defaults();
        if (maxDepth != null) {
            options = options.withMaxNestingDepth(maxDepth);
        }
        if (maxTasks != null) {
            options = options.withMaxTasks(maxTasks);
        }
        if (graphName != null) {
            options = options.withGraphName(graphName);
        }
        if (direction != null) {
            options = options.withFlowchartDirection(direction);
        }
        return options;
    }

    private String readInput() throws IOException {
        if (input == null || "-".equals(input.toString())) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(input, StandardCharsets.UTF_8);
    }

    public static final class FormatConverter implements CommandLine.ITypeConverter<GraphFormat> {
        @Override
        public GraphFormat convert(String value) {
            return GraphFormat.fromKey(value);
        }
    }
}
