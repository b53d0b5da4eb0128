package dev.execgraph.format;

import dev.execgraph.error.SyntaxException;
import dev.execgraph.model.TaskGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses the directed subset of the GraphViz DOT language used for execution graphs.
 *
 * <pre>
 * graph := 'strict'? 'digraph' id? '{' stmt* '}'
 * stmt  := id '=' id ';'
 *        | ('graph' | 'node' | 'edge') attrs ';'
 *        | id ('-&gt;' id)* attrs? ';'
 * attrs := '[' (id '=' id (',' | ';')?)* ']'
 * </pre>
 *
 * Only the {@code label} attribute of a node statement is kept.
 */
public final class DotParser {

    private static final Set<String> DEFAULT_ATTRIBUTE_TARGETS = Set.of("graph", "node", "edge");

    private final List<Token> tokens;
    private final TaskGraph.Builder builder = TaskGraph.builder();
    private int index;

    private DotParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static TaskGraph parse(String text) {
        var parser = new DotParser(Lexer.tokenize(text, true));
        parser.header();
        parser.body();
        return parser.builder.build();
    }

    private void header() {
        Token keyword = next();
        if (keyword.is(Token.Type.IDENTIFIER) && "strict".equalsIgnoreCase(keyword.text())) {
            keyword = next();
        }
        if (keyword.is(Token.Type.IDENTIFIER) && "graph".equalsIgnoreCase(keyword.text())) {
            throw error("undirected graphs are not supported, use 'digraph'", keyword);
        }
        if (!keyword.is(Token.Type.IDENTIFIER) || !"digraph".equalsIgnoreCase(keyword.text())) {
            throw error("expected 'digraph' header but found %s".formatted(keyword.describe()), keyword);
        }
        if (isId(peek())) {
            builder.name(next().text());
        }
        expect(Token.Type.LBRACE, "'{' after the graph header");
    }

    private void body() {
        while (true) {
            Token token = peek();
            if (token.is(Token.Type.RBRACE)) {
                next();
                break;
            }
            if (token.is(Token.Type.EOF)) {
                throw error("missing closing '}' of the graph body", token);
            }
            statement();
        }
        Token trailing = peek();
        if (!trailing.is(Token.Type.EOF)) {
            throw error("unexpected %s after the closing '}'".formatted(trailing.describe()), trailing);
        }
    }

    private void statement() {
        Token first = next();
        if (!isId(first)) {
            throw error("expected a node id but found %s".formatted(first.describe()), first);
        }
        if (first.is(Token.Type.IDENTIFIER) && "subgraph".equalsIgnoreCase(first.text())) {
            throw error("subgraphs are not supported", first);
        }

        if (peek().is(Token.Type.EQUALS)) {
            next();
            Token value = next();
            if (!isId(value)) {
                throw error("expected a value after '=' but found %s".formatted(value.describe()), value);
            }
            terminator();
            return;
        }

        if (first.is(Token.Type.IDENTIFIER) && DEFAULT_ATTRIBUTE_TARGETS.contains(first.text().toLowerCase(Locale.ROOT))
                && peek().is(Token.Type.LBRACKET)) {
            attributes();
            terminator();
            return;
        }

        var chain = new ArrayList<String>();
        chain.add(first.text());
        while (true) {
            Token link = peek();
            if (link.is(Token.Type.UNDIRECTED_EDGE)) {
                throw error("undirected edge '--' in a digraph, use '->'", link);
            }
            if (!link.is(Token.Type.ARROW)) {
                break;
            }
            next();
            Token target = next();
            if (!isId(target)) {
                throw error("malformed arrow, expected a node id after '->' but found %s"
                    .formatted(target.describe()), target);
            }
            chain.add(target.text());
        }

        Map<String, String> attributes = peek().is(Token.Type.LBRACKET) ? attributes() : Map.of();
        terminator();

        if (chain.size() == 1) {
            String label = attributes.get("label");
            if (label != null) {
                builder.node(chain.get(0), label);
            } else {
                builder.node(chain.get(0));
            }
        } else {
            for (int i = 0; i + 1 < chain.size(); i++) {
                builder.edge(chain.get(i), chain.get(i + 1));
            }
        }
    }

    private Map<String, String> attributes() {
        expect(Token.Type.LBRACKET, "'['");
        var attributes = new LinkedHashMap<String, String>();
        while (!peek().is(Token.Type.RBRACKET)) {
            Token key = next();
            if (!isId(key)) {
                throw error("expected an attribute name but found %s".formatted(key.describe()), key);
            }
            expect(Token.Type.EQUALS, "'=' after attribute '%s'".formatted(key.text()));
            Token value = next();
            if (!isId(value)) {
                throw error("expected a value for attribute '%s' but found %s"
                    .formatted(key.text(), value.describe()), value);
            }
            attributes.put(key.text(), value.text());
            if (peek().is(Token.Type.COMMA) || peek().is(Token.Type.SEMICOLON)) {
                next();
            }
        }
        next();
        return attributes;
    }

    private void terminator() {
        Token token = peek();
        if (!token.is(Token.Type.SEMICOLON)) {
            throw error("missing ';' at the end of the statement, found %s".formatted(token.describe()), token);
        }
        next();
    }

    private void expect(Token.Type type, String what) {
        Token token = next();
        if (!token.is(type)) {
            throw error("expected %s but found %s".formatted(what, token.describe()), token);
        }
    }

    private static boolean isId(Token token) {
        return token.is(Token.Type.IDENTIFIER) || token.is(Token.Type.QUOTED);
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
