package dev.execgraph.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.execgraph.model.ConversionBundle;
import dev.execgraph.model.ConversionResult;
import dev.execgraph.model.GraphFormat;

import java.util.Collection;
import java.util.List;

/**
 * Renders a {@link ConversionBundle} as JSON for editors and scripts that drive the CLI.
 */
public final class BundleJsonWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BundleJsonWriter() {}

    public static ObjectNode toTree(ConversionBundle bundle) {
        return toTree(bundle, List.of(GraphFormat.values()));
    }

    /** Only the given formats appear under {@code results}. */
    public static ObjectNode toTree(ConversionBundle bundle, Collection<GraphFormat> formats) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("source", bundle.source().key());
        ObjectNode results = root.putObject("results");
        for (GraphFormat format : formats) {
            ObjectNode slot = results.putObject(format.key());
            ConversionResult result = bundle.get(format);
            if (result instanceof ConversionResult.Success success) {
                slot.put("ok", true);
                slot.put("text", success.text());
            } else if (result instanceof ConversionResult.Failure failure) {
                slot.put("ok", false);
                slot.put("kind", failure.kind().name());
                slot.put("message", failure.message());
            }
        }
        bundle.renderInput().ifPresentOrElse(
            dot -> root.put("renderInput", dot),
            () -> root.putNull("renderInput"));
        return root;
    }

    public static String toJson(ConversionBundle bundle) {
        return toJson(bundle, List.of(GraphFormat.values()));
    }

    public static String toJson(ConversionBundle bundle, Collection<GraphFormat> formats) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(bundle, formats));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render conversion bundle", e);
        }
    }
}
