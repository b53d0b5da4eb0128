package dev.execgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.execgraph.model.ConversionOptions;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads {@link ConversionOptions} from a JSON file. Missing keys keep their defaults.
 *
 * <pre>
 * {
 *   "maxNestingDepth": 64,
 *   "maxTasks": 10000,
 *   "graphName": "ExecutionGraph",
 *   "flowchartDirection": "TD"
 * }
 * </pre>
 */
public final class OptionsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OptionsLoader() {}

    public static ConversionOptions loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseOptions(root);
    }

    public static ConversionOptions loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseOptions(root);
    }

    private static ConversionOptions parseOptions(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Options must be a JSON object");
        }
        int maxNestingDepth = root.has("maxNestingDepth")
            ? root.get("maxNestingDepth").asInt() : ConversionOptions.DEFAULT_MAX_NESTING_DEPTH;
        int maxTasks = root.has("maxTasks")
            ? root.get("maxTasks").asInt() : ConversionOptions.DEFAULT_MAX_TASKS;
        String graphName = root.has("graphName")
            ? root.get("graphName").asText() : ConversionOptions.DEFAULT_GRAPH_NAME;
        String direction = root.has("flowchartDirection")
            ? root.get("flowchartDirection").asText() : ConversionOptions.DEFAULT_FLOWCHART_DIRECTION;
        return new ConversionOptions(maxNestingDepth, maxTasks, graphName, direction);
    }
}
