package dev.execgraph.error;

public final class ValidationException extends ConversionException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
