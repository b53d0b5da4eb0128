package dev.execgraph.model;

import dev.execgraph.error.ErrorKind;

/**
 * Outcome of producing one target notation.
 */
public sealed interface ConversionResult {

    boolean isSuccess();

    record Success(String text) implements ConversionResult {
        @Override
        public boolean isSuccess() { return true; }
    }

    record Failure(ErrorKind kind, String message) implements ConversionResult {
        @Override
        public boolean isSuccess() { return false; }
    }
}
