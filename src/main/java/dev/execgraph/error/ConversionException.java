package dev.execgraph.error;

/**
 * Base class for every failure raised while parsing, checking or decomposing a graph.
 * Callers of {@link dev.execgraph.engine.GraphConverter} never see these; they are
 * folded into per-format results.
 */
public abstract class ConversionException extends RuntimeException {

    protected ConversionException(String message) {
        super(message);
    }

    public abstract ErrorKind kind();
}
