package dev.execgraph.format;

import dev.execgraph.model.Structure;

import java.util.List;

/**
 * Writes a {@link Structure} as nested blocks: two spaces per level, one item per line,
 * a trailing comma after every item.
 */
public final class CustomFormatWriter {

    private static final String INDENT = "  ";

    private CustomFormatWriter() {}

    public static String write(Structure structure) {
        var sb = new StringBuilder();
        if (structure instanceof Structure.Leaf leaf) {
            // a bare task is still written as a block so the output parses back
            writeBlock(sb, CustomFormatParser.SEQUENCE, List.of(leaf), 0);
        } else {
            writeItem(sb, structure, 0);
        }
        // drop the separator written after the outermost block
        sb.setLength(sb.length() - 2);
        sb.append('\n');
        return sb.toString();
    }

    private static void writeItem(StringBuilder sb, Structure structure, int level) {
        if (structure instanceof Structure.Leaf leaf) {
            sb.append(INDENT.repeat(level)).append(leaf.id()).append(",\n");
        } else if (structure instanceof Structure.Sequence sequence) {
            writeBlock(sb, CustomFormatParser.SEQUENCE, sequence.children(), level);
        } else if (structure instanceof Structure.Parallel parallel) {
            writeBlock(sb, CustomFormatParser.PARALLEL, parallel.children(), level);
        } else {
            throw new IllegalStateException("Unknown structure: " + structure);
        }
    }

    private static void writeBlock(StringBuilder sb, String keyword,
                                   List<Structure> children, int level) {
        String indent = INDENT.repeat(level);
        sb.append(indent).append(keyword).append(" {\n");
        for (Structure child : children) {
            writeItem(sb, child, level + 1);
        }
        sb.append(indent).append("},\n");
    }
}
