package dev.execgraph.format;

/**
 * A lexical token with its 1-based source position.
 */
record Token(Type type, String text, int line, int column) {

    enum Type {
        IDENTIFIER,
        QUOTED,
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        COMMA,
        SEMICOLON,
        EQUALS,
        ARROW,
        UNDIRECTED_EDGE,
        EOF
    }

    boolean is(Type expected) {
        return type == expected;
    }

    /** Human-readable form for error messages. */
    String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case QUOTED -> "\"" + text + "\"";
            default -> "'" + text + "'";
        };
    }
}
