package dev.execgraph.error;

/**
 * Malformed input text. Line and column are 1-based; 0 means the position is unknown.
 */
public final class SyntaxException extends ConversionException {

    private final int line;
    private final int column;

    public SyntaxException(String description, int line, int column) {
        super(line > 0
            ? "line %d, column %d: %s".formatted(line, column, description)
            : description);
        this.line = line;
        this.column = column;
    }

    public int line() { return line; }
    public int column() { return column; }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SYNTAX;
    }
}
