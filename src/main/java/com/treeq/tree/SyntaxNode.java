package com.treeq.tree;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable node of a parsed syntax tree.
 *
 * <p>Equality is structural: two nodes are equal when their grammar type, byte range,
 * text and children are equal, regardless of the tree they were read from. The named
 * flag, field name and kind are descriptive and do not take part in equality.
 */
public final class SyntaxNode {
    private final String type;
    private final int startByte;
    private final int endByte;
    private final Point startPoint;
    private final Point endPoint;
    private final String text;
    private final ImmutableList<SyntaxNode> children;
    private final boolean named;
    private final String fieldName;
    private final NodeKind kind;
    private final int hash;

    public SyntaxNode(String type, int startByte, int endByte, Point startPoint, Point endPoint,
                      String text, ImmutableList<SyntaxNode> children, boolean named,
                      String fieldName, NodeKind kind) {
        if (type == null || type.isEmpty()) {
            throw new IllegalArgumentException("Node type must not be empty");
        }
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException(
                "Invalid byte range [" + startByte + "," + endByte + ") for " + type);
        }
        this.type = type;
        this.startByte = startByte;
        this.endByte = endByte;
        this.startPoint = Objects.requireNonNull(startPoint, "startPoint");
        this.endPoint = Objects.requireNonNull(endPoint, "endPoint");
        this.text = text == null ? "" : text;
        this.children = children == null ? Lists.immutable.empty() : children;
        this.named = named;
        this.fieldName = fieldName;
        this.kind = kind == null ? NodeKind.of(type) : kind;
        checkChildren();
        this.hash = Objects.hash(type, startByte, endByte, this.text, this.children);
    }

    /**
     * Single-line node whose points are derived from its byte offsets.
     */
    public static SyntaxNode of(String type, int startByte, int endByte, String text, SyntaxNode... children) {
        return new SyntaxNode(type, startByte, endByte, new Point(0, startByte), new Point(0, endByte),
            text, Lists.immutable.with(children), true, null, null);
    }

    private void checkChildren() {
        int previousStart = startByte;
        for (SyntaxNode child : children) {
            if (child.startByte < startByte || child.endByte > endByte) {
                throw new IllegalArgumentException("Child " + child.type + " [" + child.startByte + ","
                    + child.endByte + ") is not nested in " + type + " [" + startByte + "," + endByte + ")");
            }
            if (child.startByte < previousStart) {
                throw new IllegalArgumentException("Children of " + type + " are not ordered by start byte");
            }
            previousStart = child.startByte;
        }
    }

    public String type() {
        return type;
    }

    public int startByte() {
        return startByte;
    }

    public int endByte() {
        return endByte;
    }

    public Point startPoint() {
        return startPoint;
    }

    public Point endPoint() {
        return endPoint;
    }

    public String text() {
        return text;
    }

    public ImmutableList<SyntaxNode> children() {
        return children;
    }

    public ImmutableList<SyntaxNode> namedChildren() {
        return children.select(SyntaxNode::named);
    }

    public boolean named() {
        return named;
    }

    public Optional<String> fieldName() {
        return Optional.ofNullable(fieldName);
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public Optional<SyntaxNode> childByField(String field) {
        return Optional.ofNullable(children.detect(child -> field.equals(child.fieldName)));
    }

    public SyntaxNode withKind(NodeKind newKind) {
        return new SyntaxNode(type, startByte, endByte, startPoint, endPoint, text, children, named, fieldName, newKind);
    }

    public SyntaxNode withFieldName(String newFieldName) {
        return new SyntaxNode(type, startByte, endByte, startPoint, endPoint, text, children, named, newFieldName, kind);
    }

    public SyntaxNode withNamed(boolean newNamed) {
        return new SyntaxNode(type, startByte, endByte, startPoint, endPoint, text, children, newNamed, fieldName, kind);
    }

    /**
     * Renders the subtree as nested constructor-like calls, one node per line.
     */
    public String pretty(int maxText) {
        StringBuilder sb = new StringBuilder();
        appendPretty(sb, 0, maxText);
        return sb.toString();
    }

    private void appendPretty(StringBuilder sb, int indent, int maxText) {
        String pad = "  ".repeat(indent);
        String shown = text.length() > maxText ? text.substring(0, maxText) + "..." : text;
        sb.append(pad).append(type)
          .append(' ').append(startPoint).append('-').append(endPoint);
        fieldName().ifPresent(f -> sb.append(" field=").append(f));
        if (isLeaf()) {
            sb.append(" '").append(shown.replace("\n", "\\n")).append('\'');
        }
        sb.append('\n');
        for (SyntaxNode child : children) {
            child.appendPretty(sb, indent + 1, maxText);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxNode other)) {
            return false;
        }
        return hash == other.hash
            && startByte == other.startByte
            && endByte == other.endByte
            && type.equals(other.type)
            && text.equals(other.text)
            && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return type + "[" + startByte + "," + endByte + ")";
    }
}
