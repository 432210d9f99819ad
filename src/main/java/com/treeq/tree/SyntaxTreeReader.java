package com.treeq.tree;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a syntax tree dumped as JSON by an external parser:
 * <pre>
 * {"type": "call", "startByte": 0, "endByte": 7,
 *  "startPoint": {"row": 0, "column": 0}, "endPoint": {"row": 0, "column": 7},
 *  "text": "f(a, b)", "named": true, "field": "value", "children": [ ... ]}
 * </pre>
 * Only {@code type}, {@code startByte} and {@code endByte} are required. Missing points
 * default to row 0 at the byte offset; unknown fields are skipped.
 */
public class SyntaxTreeReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(SyntaxTreeReader.class);

    private final JsonFactory factory = new JsonFactory();
    private final NodeKindRegistry registry;

    public SyntaxTreeReader() {
        this(NodeKindRegistry.empty());
    }

    public SyntaxTreeReader(NodeKindRegistry registry) {
        this.registry = registry;
    }

    public SyntaxTree read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw new IOException("Expected a node object but found " + token);
            }
            SyntaxTree tree = new SyntaxTree(readNode(parser));
            JsonToken trailing = parser.nextToken();
            if (trailing != null) {
                throw new IOException("Unexpected " + trailing + " after the root node at " + parser.currentLocation());
            }
            LOGGER.debug("Read syntax tree with {} nodes", tree.size());
            return tree;
        }
    }

    private SyntaxNode readNode(JsonParser parser) throws IOException {
        String type = null;
        Integer startByte = null;
        Integer endByte = null;
        Point startPoint = null;
        Point endPoint = null;
        String text = "";
        boolean named = true;
        String field = null;
        MutableList<SyntaxNode> children = Lists.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String name = parser.currentName();
            JsonToken value = parser.nextToken();
            switch (name) {
                case "type" -> type = readString(parser, value, name, false);
                case "startByte" -> startByte = readInt(parser, value, name);
                case "endByte" -> endByte = readInt(parser, value, name);
                case "startPoint" -> startPoint = readPoint(parser, value);
                case "endPoint" -> endPoint = readPoint(parser, value);
                case "text" -> {
                    String read = readString(parser, value, name, true);
                    text = read == null ? "" : read;
                }
                case "named" -> named = readBoolean(parser, value, name);
                case "field" -> field = readString(parser, value, name, true);
                case "children" -> readChildren(parser, value, children);
                default -> parser.skipChildren();
            }
        }

        if (type == null || startByte == null || endByte == null) {
            throw new IOException("Node at " + parser.currentLocation()
                + " is missing one of type, startByte, endByte");
        }
        SyntaxNode node;
        try {
            node = new SyntaxNode(type, startByte, endByte,
                startPoint != null ? startPoint : new Point(0, startByte),
                endPoint != null ? endPoint : new Point(0, endByte),
                text, children.toImmutable(), named, field, null);
            return node.withKind(registry.kindFor(node));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid node at " + parser.currentLocation() + ": " + e.getMessage(), e);
        }
    }

    private void readChildren(JsonParser parser, JsonToken token, MutableList<SyntaxNode> children) throws IOException {
        if (token != JsonToken.START_ARRAY) {
            throw new IOException("Expected children array but found " + token);
        }
        while (true) {
            JsonToken next = parser.nextToken();
            if (next == JsonToken.END_ARRAY) {
                break;
            }
            if (next != JsonToken.START_OBJECT) {
                throw new IOException("Unexpected token in children: " + next);
            }
            children.add(readNode(parser));
        }
    }

    private Point readPoint(JsonParser parser, JsonToken token) throws IOException {
        if (token != JsonToken.START_OBJECT) {
            throw new IOException("Expected point object but found " + token);
        }
        int row = 0;
        int column = 0;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String name = parser.currentName();
            JsonToken value = parser.nextToken();
            switch (name) {
                case "row" -> row = readInt(parser, value, name);
                case "column" -> column = readInt(parser, value, name);
                default -> parser.skipChildren();
            }
        }
        if (row < 0 || column < 0) {
            throw new IOException("Negative point (" + row + "," + column + ") at " + parser.currentLocation());
        }
        return new Point(row, column);
    }

    private static String readString(JsonParser parser, JsonToken token, String name, boolean nullable) throws IOException {
        if (token == JsonToken.VALUE_STRING) {
            return parser.getText();
        }
        if (nullable && token == JsonToken.VALUE_NULL) {
            return null;
        }
        throw mismatch(parser, token, "a string", name);
    }

    private static int readInt(JsonParser parser, JsonToken token, String name) throws IOException {
        if (token != JsonToken.VALUE_NUMBER_INT) {
            throw mismatch(parser, token, "an integer", name);
        }
        return parser.getIntValue();
    }

    private static boolean readBoolean(JsonParser parser, JsonToken token, String name) throws IOException {
        if (token != JsonToken.VALUE_TRUE && token != JsonToken.VALUE_FALSE) {
            throw mismatch(parser, token, "a boolean", name);
        }
        return token == JsonToken.VALUE_TRUE;
    }

    private static IOException mismatch(JsonParser parser, JsonToken token, String expected, String name) {
        return new IOException("Expected " + expected + " for '" + name + "' but found " + token
            + " at " + parser.currentLocation());
    }
}
