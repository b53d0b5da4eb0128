package dev.execgraph.model;

import java.util.Locale;

/**
 * The three notations an execution graph can be written in.
 */
public enum GraphFormat {
    CUSTOM("custom"),
    DOT("dot"),
    MERMAID("mermaid");

    private final String key;

    GraphFormat(String key) {
        this.key = key;
    }

    public String key() { return key; }

    public static GraphFormat fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (GraphFormat format : values()) {
            if (format.key.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown format '%s'. Valid formats: custom, dot, mermaid".formatted(key));
    }

    @Override
    public String toString() {
        return key;
    }
}
