package dev.execgraph.format;

import dev.execgraph.error.SyntaxException;
import dev.execgraph.model.ConversionOptions;
import dev.execgraph.model.TaskGraph;

import java.util.ArrayList;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Mermaid flowcharts written as arrow chains.
 *
 * <pre>
 * flowchart TD
 *     q0[Fetch] --&gt; q1 --&gt; q2
 *     q0 --&gt; q3
 *     lonely["Not connected"]
 * </pre>
 *
 * Statements are separated by newlines or {@code ;}. Node shapes {@code [..]}, {@code (..)}
 * and {@code {..}} all carry a label; the shape itself is dropped. Styling statements
 * ({@code style}, {@code classDef}, ...) and subgraph boundaries are skipped. A keyword
 * only starts such a statement when it is followed by arguments and the line has no
 * arrow ({@code end} when it stands alone), so tasks may still be called {@code style}
 * or {@code class}.
 */
public final class MermaidParser {

    private static final Pattern HEADER = Pattern.compile("(flowchart|graph)(?:\\s+(\\w+))?\\s*;?");
    static final String END = "end";
    static final Set<String> DIRECTIVE_KEYWORDS =
        Set.of("style", "classDef", "class", "linkStyle", "click", "subgraph", "direction");
    private static final String ARROW = "-->";

    private final TaskGraph.Builder builder;
    private String line;
    private int lineNumber;
    private int pos;

    private MermaidParser(TaskGraph.Builder builder) {
        this.builder = builder;
    }

    public static TaskGraph parse(String text) {
        return parse(text, ConversionOptions.defaults());
    }

    public static TaskGraph parse(String text, ConversionOptions options) {
        var parser = new MermaidParser(TaskGraph.builder().name(options.graphName()));
        parser.run(text.split("\\R", -1));
        return parser.builder.build();
    }

    private void run(String[] lines) {
        boolean headerSeen = false;
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].strip();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")) {
                continue;
            }
            if (!headerSeen) {
                header(trimmed, i + 1);
                headerSeen = true;
                continue;
            }
            if (isDirective(trimmed)) {
                continue;
            }
            line = lines[i];
            lineNumber = i + 1;
            pos = 0;
            statements();
        }
        if (!headerSeen) {
            throw new SyntaxException("missing 'flowchart <direction>' header", 1, 1);
        }
    }

    private static boolean isDirective(String trimmed) {
        if (trimmed.contains(ARROW)) {
            return false;
        }
        String[] words = trimmed.replaceFirst(";$", "").strip().split("\\s+", 2);
        if (END.equals(words[0])) {
            return words.length == 1;
        }
        return words.length == 2 && DIRECTIVE_KEYWORDS.contains(words[0]);
    }

    private void header(String trimmed, int number) {
        Matcher m = HEADER.matcher(trimmed);
        if (!m.matches()) {
            throw new SyntaxException("expected 'flowchart <direction>' header", number, 1);
        }
        String direction = m.group(2);
        if (direction != null && !ConversionOptions.FLOWCHART_DIRECTIONS.contains(direction)) {
            throw new SyntaxException("unknown flowchart direction '%s'".formatted(direction), number, 1);
        }
    }

    private void statements() {
        while (true) {
            skipSpaces();
            if (atEnd()) {
                return;
            }
            if (peek() == ';') {
                pos++;
                continue;
            }
            chain();
        }
    }

    private void chain() {
        var ids = new ArrayList<String>();
        ids.add(reference("left"));
        while (true) {
            skipSpaces();
            if (atEnd() || peek() == ';') {
                break;
            }
            if (line.startsWith(ARROW, pos) && !line.startsWith(ARROW + ">", pos)) {
                pos += ARROW.length();
                skipEdgeText();
                skipSpaces();
                if (atEnd() || peek() == ';') {
                    throw error("arrow with missing right operand");
                }
                ids.add(reference("right"));
            } else if (peek() == '-' || peek() == '=' || peek() == '.' || peek() == '<') {
                throw error("unsupported link operator, only '-->' is allowed");
            } else {
                throw error("unexpected character '%s'".formatted(peek()));
            }
        }

        if (ids.size() == 1) {
            return;
        }
        for (int i = 0; i + 1 < ids.size(); i++) {
            builder.edge(ids.get(i), ids.get(i + 1));
        }
    }

    /** Reads {@code id} with an optional shape label and declares the node. */
    private String reference(String side) {
        int start = pos;
        while (!atEnd() && isIdChar(peek())) {
            pos++;
        }
        if (start == pos) {
            if (line.startsWith(ARROW, pos)) {
                throw error("arrow with missing %s operand".formatted(side));
            }
            throw error("expected a node id but found '%s'".formatted(peek()));
        }
        String id = line.substring(start, pos);

        String label = null;
        if (!atEnd() && (peek() == '[' || peek() == '(' || peek() == '{')) {
            label = shapeLabel();
        }
        if (label != null) {
            builder.node(id, label);
        } else {
            builder.node(id);
        }
        return id;
    }

    private String shapeLabel() {
        int openedAt = pos;
        char open = line.charAt(pos);
        char close = open == '[' ? ']' : open == '(' ? ')' : '}';
        int depth = 0;
        while (!atEnd() && line.charAt(pos) == open) {
            depth++;
            pos++;
        }
        String label;
        if (!atEnd() && peek() == '"') {
            int end = line.indexOf('"', pos + 1);
            if (end < 0) {
                throw errorAt("unterminated quoted label", openedAt);
            }
            label = line.substring(pos + 1, end).replace("#quot;", "\"");
            pos = end + 1;
        } else {
            int end = line.indexOf(close, pos);
            if (end < 0) {
                throw errorAt("unterminated '%s' in node shape".formatted(open), openedAt);
            }
            label = line.substring(pos, end).strip();
            pos = end;
        }
        for (int i = 0; i < depth; i++) {
            if (atEnd() || peek() != close) {
                throw errorAt("unterminated '%s' in node shape".formatted(open), openedAt);
            }
            pos++;
        }
        return label;
    }

    /** Drops an edge label written as {@code -->|text|}. */
    private void skipEdgeText() {
        if (!atEnd() && peek() == '|') {
            int end = line.indexOf('|', pos + 1);
            if (end < 0) {
                throw error("unterminated edge label");
            }
            pos = end + 1;
        }
    }

    private void skipSpaces() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= line.length();
    }

    private char peek() {
        return line.charAt(pos);
    }

    private SyntaxException error(String description) {
        return errorAt(description, pos);
    }

    private SyntaxException errorAt(String description, int at) {
        return new SyntaxException(description, lineNumber, at + 1);
    }

    private static boolean isIdChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
