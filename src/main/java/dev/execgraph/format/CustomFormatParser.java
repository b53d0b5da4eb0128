package dev.execgraph.format;

import dev.execgraph.error.SyntaxException;
import dev.execgraph.error.ValidationException;
import dev.execgraph.model.ConversionOptions;
import dev.execgraph.model.Structure;
import dev.execgraph.model.TaskGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses nested {@code Sequence { ... }} / {@code Parallel { ... }} blocks.
 *
 * <pre>
 * Block := ('Sequence' | 'Parallel') '{' Item (',' Item)* ','? '}'
 * Item  := identifier | Block
 * </pre>
 *
 * The whole document is a single block. Task identifiers must be unique across the tree.
 */
public final class CustomFormatParser {

    static final String SEQUENCE = "Sequence";
    static final String PARALLEL = "Parallel";

    private final List<Token> tokens;
    private final int maxDepth;
    private final Set<String> seen = new HashSet<>();
    private int index;

    private CustomFormatParser(List<Token> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    public static Structure parse(String text) {
        return parse(text, ConversionOptions.defaults());
    }

    public static Structure parse(String text, ConversionOptions options) {
        var parser = new CustomFormatParser(Lexer.tokenize(text, false), options.maxNestingDepth());
        Structure root = parser.block(1);
        Token trailing = parser.peek();
        if (!trailing.is(Token.Type.EOF)) {
            throw error("unexpected %s after the closing '}'".formatted(trailing.describe()), trailing);
        }
        return root;
    }

    private Structure block(int depth) {
        Token keyword = next();
        if (!isBlockStart(keyword)) {
            throw error("expected 'Sequence' or 'Parallel' but found %s".formatted(keyword.describe()), keyword);
        }
        if (depth > maxDepth) {
            throw error("blocks nested deeper than %d levels".formatted(maxDepth), keyword);
        }
        Token open = next();
        if (!open.is(Token.Type.LBRACE)) {
            throw error("expected '{' after '%s' but found %s".formatted(keyword.text(), open.describe()), open);
        }

        var children = new ArrayList<Structure>();
        while (!peek().is(Token.Type.RBRACE)) {
            children.add(item(depth));
            Token separator = peek();
            if (separator.is(Token.Type.COMMA)) {
                next();
            } else if (!separator.is(Token.Type.RBRACE)) {
                throw error("expected ',' or '}' but found %s".formatted(separator.describe()), separator);
            }
        }
        next();

        if (children.isEmpty()) {
            throw new ValidationException("Empty %s block at line %d, column %d"
                .formatted(keyword.text(), keyword.line(), keyword.column()));
        }
        return SEQUENCE.equals(keyword.text())
            ? new Structure.Sequence(children)
            : new Structure.Parallel(children);
    }

    private Structure item(int depth) {
        Token token = peek();
        if (isBlockStart(token) && tokens.get(index + 1).is(Token.Type.LBRACE)) {
            return block(depth + 1);
        }
        if (token.is(Token.Type.EOF)) {
            throw error("unmatched '{', reached end of input", token);
        }
        if (!token.is(Token.Type.IDENTIFIER)) {
            throw error("expected a task identifier but found %s".formatted(token.describe()), token);
        }
        next();
        String id = token.text();
        if (!TaskGraph.isValidIdentifier(id)) {
            throw new ValidationException("Invalid task identifier '%s' at line %d, column %d"
                .formatted(id, token.line(), token.column()));
        }
        if (!seen.add(id)) {
            throw new ValidationException("Duplicate task identifier '%s' at line %d, column %d"
                .formatted(id, token.line(), token.column()));
        }
        return new Structure.Leaf(id);
    }

    private static boolean isBlockStart(Token token) {
        return token.is(Token.Type.IDENTIFIER)
            && (SEQUENCE.equals(token.text()) || PARALLEL.equals(token.text()));
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (!token.is(Token.Type.EOF)) {
            index++;
        }
        return token;
    }

    private static SyntaxException error(String description, Token at) {
        return new SyntaxException(description, at.line(), at.column());
    }
}
