package com.treeq.output;

import com.treeq.analytics.GraphMetrics;
import com.treeq.match.Match;
import com.treeq.tree.SyntaxNode;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Renders nodes, matches and graph metrics as JSON text, pretty-printed or compact.
 * Node output uses the same layout {@link com.treeq.tree.SyntaxTreeReader} reads.
 */
public class OutputFormatter {
    private final boolean prettyPrint;
    private final boolean includeChildren;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint) {
        this(prettyPrint, true);
    }

    public OutputFormatter(boolean prettyPrint, boolean includeChildren) {
        this.prettyPrint = prettyPrint;
        this.includeChildren = includeChildren;
    }

    public String format(SyntaxNode node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);
        formatNode(node, 0, sb);
        return sb.toString();
    }

    /**
     * One line per node: type, position and a shortened text.
     */
    public String summary(SyntaxNode node, int maxText) {
        String text = node.text().strip().replace("\n", " ");
        if (text.length() > maxText) {
            text = text.substring(0, maxText) + "...";
        }
        return node.type() + " " + node.startPoint().row() + ":" + node.startPoint().column() + " " + text;
    }

    public String format(GraphMetrics metrics) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);
        open(sb, '{');
        field(sb, 1, "nodeCount", Integer.toString(metrics.nodeCount()), true);
        field(sb, 1, "edgeCount", Integer.toString(metrics.edgeCount()), false);
        field(sb, 1, "density", Double.toString(metrics.density()), false);
        field(sb, 1, "componentCount", Integer.toString(metrics.componentCount()), false);
        field(sb, 1, "connected", Boolean.toString(metrics.connected()), false);
        field(sb, 1, "acyclic", Boolean.toString(metrics.acyclic()), false);
        close(sb, 0, '}');
        return sb.toString();
    }

    /**
     * A match as an object from pattern index to target index.
     */
    public String format(Match match) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);
        if (match.size() == 0) {
            return "{}";
        }
        open(sb, '{');
        for (int p = 0; p < match.size(); p++) {
            field(sb, 1, Integer.toString(p), Integer.toString(match.target(p)), p == 0);
        }
        close(sb, 0, '}');
        return sb.toString();
    }

    private void formatNode(SyntaxNode node, int indent, StringBuilder sb) {
        open(sb, '{');
        field(sb, indent + 1, "type", quote(node.type()), true);
        field(sb, indent + 1, "startByte", Integer.toString(node.startByte()), false);
        field(sb, indent + 1, "endByte", Integer.toString(node.endByte()), false);
        field(sb, indent + 1, "startPoint", point(node.startPoint().row(), node.startPoint().column()), false);
        field(sb, indent + 1, "endPoint", point(node.endPoint().row(), node.endPoint().column()), false);
        field(sb, indent + 1, "text", quote(node.text()), false);
        field(sb, indent + 1, "named", Boolean.toString(node.named()), false);
        if (node.fieldName().isPresent()) {
            field(sb, indent + 1, "field", quote(node.fieldName().get()), false);
        }
        ImmutableList<SyntaxNode> children = node.children();
        if (includeChildren && children.notEmpty()) {
            sb.append(',');
            newline(sb, indent + 1);
            sb.append("\"children\":");
            if (prettyPrint) {
                sb.append(' ');
            }
            sb.append('[');
            boolean first = true;
            for (SyntaxNode child : children) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                newline(sb, indent + 2);
                formatNode(child, indent + 2, sb);
            }
            newline(sb, indent + 1);
            sb.append(']');
        }
        close(sb, indent, '}');
    }

    private String point(int row, int column) {
        return prettyPrint
            ? "{\"row\": " + row + ", \"column\": " + column + "}"
            : "{\"row\":" + row + ",\"column\":" + column + "}";
    }

    private void open(StringBuilder sb, char bracket) {
        sb.append(bracket);
    }

    private void close(StringBuilder sb, int indent, char bracket) {
        newline(sb, indent);
        sb.append(bracket);
    }

    private void field(StringBuilder sb, int indent, String name, String value, boolean first) {
        if (!first) {
            sb.append(',');
        }
        newline(sb, indent);
        sb.append('"').append(escapeString(name)).append("\":");
        if (prettyPrint) {
            sb.append(' ');
        }
        sb.append(value);
    }

    private void newline(StringBuilder sb, int indent) {
        if (prettyPrint) {
            sb.append('\n').append("  ".repeat(indent));
        }
    }

    private String quote(String s) {
        return "\"" + escapeString(s) + "\"";
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"' -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
