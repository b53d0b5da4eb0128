package dev.execgraph.format;

import dev.execgraph.error.SyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits block and DOT text into tokens. Whitespace is insignificant. When
 * {@code allowComments} is set, C and C++ style comments and lines starting
 * with {@code #} are skipped.
 */
final class Lexer {

    private final String text;
    private final boolean allowComments;
    private int pos;
    private int line = 1;
    private int column = 1;

    private Lexer(String text, boolean allowComments) {
        this.text = text;
        this.allowComments = allowComments;
    }

    static List<Token> tokenize(String text, boolean allowComments) {
        return new Lexer(text, allowComments).run();
    }

    private List<Token> run() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipIgnored();
            if (pos >= text.length()) {
                tokens.add(new Token(Token.Type.EOF, "", line, column));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int startLine = line;
        int startColumn = column;
        char c = text.charAt(pos);

        if (isIdentifierChar(c)) {
            int start = pos;
            while (pos < text.length() && isIdentifierChar(text.charAt(pos))) {
                advance();
            }
            return new Token(Token.Type.IDENTIFIER, text.substring(start, pos), startLine, startColumn);
        }
        if (c == '"') {
            return quoted(startLine, startColumn);
        }
        if (c == '-') {
            char following = pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
            if (following == '>') {
                advance();
                advance();
                return new Token(Token.Type.ARROW, "->", startLine, startColumn);
            }
            if (following == '-') {
                advance();
                advance();
                return new Token(Token.Type.UNDIRECTED_EDGE, "--", startLine, startColumn);
            }
            throw new SyntaxException("malformed arrow, expected '->'", startLine, startColumn);
        }

        Token.Type type = switch (c) {
            case '{' -> Token.Type.LBRACE;
            case '}' -> Token.Type.RBRACE;
            case '[' -> Token.Type.LBRACKET;
            case ']' -> Token.Type.RBRACKET;
            case ',' -> Token.Type.COMMA;
            case ';' -> Token.Type.SEMICOLON;
            case '=' -> Token.Type.EQUALS;
            default -> throw new SyntaxException("unexpected character '%s'".formatted(c), startLine, startColumn);
        };
        advance();
        return new Token(type, String.valueOf(c), startLine, startColumn);
    }

    /** Only {@code \"} and {@code \\} are unescaped; other backslash pairs stay as written. */
    private Token quoted(int startLine, int startColumn) {
        advance();
        var sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '"') {
                advance();
                return new Token(Token.Type.QUOTED, sb.toString(), startLine, startColumn);
            }
            if (c == '\\' && pos + 1 < text.length()
                && (text.charAt(pos + 1) == '"' || text.charAt(pos + 1) == '\\')) {
                advance();
                c = text.charAt(pos);
            }
            sb.append(c);
            advance();
        }
        throw new SyntaxException("unterminated quoted string", startLine, startColumn);
    }

    private void skipIgnored() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (allowComments && c == '#' && column == 1) {
                skipLine();
            } else if (allowComments && text.startsWith("//", pos)) {
                skipLine();
            } else if (allowComments && text.startsWith("/*", pos)) {
                int end = text.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw new SyntaxException("unterminated comment", line, column);
                }
                while (pos < end + 2) {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private void skipLine() {
        while (pos < text.length() && text.charAt(pos) != '\n') {
            advance();
        }
    }

    private void advance() {
        if (text.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
