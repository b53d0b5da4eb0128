package dev.execgraph.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One result per notation for a single conversion call. The source notation's slot
 * holds the input text unchanged.
 */
public record ConversionBundle(GraphFormat source, Map<GraphFormat, ConversionResult> results) {

    public ConversionBundle {
        var copy = new EnumMap<GraphFormat, ConversionResult>(GraphFormat.class);
        copy.putAll(results);
        for (GraphFormat format : GraphFormat.values()) {
            if (!copy.containsKey(format)) {
                throw new IllegalArgumentException("Missing result for " + format);
            }
        }
        results = Collections.unmodifiableMap(copy);
    }

    public ConversionResult get(GraphFormat format) {
        return results.get(format);
    }

    public boolean allSucceeded() {
        return results.values().stream().allMatch(ConversionResult::isSuccess);
    }

    /** DOT text to hand to an external layout engine, if the DOT slot succeeded. */
    public Optional<String> renderInput() {
        return get(GraphFormat.DOT) instanceof ConversionResult.Success success
            ? Optional.of(success.text())
            : Optional.empty();
    }
}
