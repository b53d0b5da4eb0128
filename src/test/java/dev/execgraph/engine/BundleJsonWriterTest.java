package dev.execgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.execgraph.model.ConversionBundle;
import dev.execgraph.model.GraphFormat;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class BundleJsonWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void writesEverySlotWithStatus() throws IOException {
        ConversionBundle bundle = new GraphConverter()
            .convert(GraphFormat.DOT, "digraph G { A -> B; A -> C; B -> D; C -> D; B -> C; }");

        JsonNode root = MAPPER.readTree(BundleJsonWriter.toJson(bundle));

        assertThat(root.get("source").asText()).isEqualTo("dot");
        assertThat(root.at("/results/dot/ok").asBoolean()).isTrue();
        assertThat(root.at("/results/mermaid/ok").asBoolean()).isTrue();
        assertThat(root.at("/results/mermaid/text").asText()).startsWith("flowchart TD");
        assertThat(root.at("/results/custom/ok").asBoolean()).isFalse();
        assertThat(root.at("/results/custom/kind").asText()).isEqualTo("DECOMPOSITION");
        assertThat(root.at("/results/custom/message").asText()).contains("not series-parallel");
        assertThat(root.get("renderInput").asText()).startsWith("digraph G");
    }

    @Test
    void renderInputIsNullWhenDotFailed() {
        ConversionBundle bundle = new GraphConverter().convert(GraphFormat.CUSTOM, "Sequence { a b }");

        assertThat(BundleJsonWriter.toTree(bundle).get("renderInput").isNull()).isTrue();
    }
}
