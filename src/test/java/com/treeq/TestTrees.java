package com.treeq;

import com.treeq.tree.SyntaxNode;
import com.treeq.tree.SyntaxTree;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;

/**
 * Trees shared by the tests. {@link #call()} mirrors {@code trees/call.json}:
 * <pre>
 * 0 module            "print(a, b)"
 * 1   call            "print(a, b)"
 * 2     identifier    "print"
 * 3     argument_list "(a, b)"
 * 4       (
 * 5       identifier  "a"
 * 6       ,
 * 7       identifier  "b"
 * 8       )
 * </pre>
 */
public final class TestTrees {
    private TestTrees() {
    }

    public static SyntaxNode call() {
        SyntaxNode function = SyntaxNode.of("identifier", 0, 5, "print").withFieldName("function");
        SyntaxNode arguments = SyntaxNode.of("argument_list", 5, 11, "(a, b)",
            SyntaxNode.of("(", 5, 6, "(").withNamed(false),
            SyntaxNode.of("identifier", 6, 7, "a"),
            SyntaxNode.of(",", 7, 8, ",").withNamed(false),
            SyntaxNode.of("identifier", 9, 10, "b"),
            SyntaxNode.of(")", 10, 11, ")").withNamed(false)).withFieldName("arguments");
        SyntaxNode call = SyntaxNode.of("call", 0, 11, "print(a, b)", function, arguments);
        return SyntaxNode.of("module", 0, 11, "print(a, b)", call);
    }

    public static SyntaxTree callTree() {
        return new SyntaxTree(call());
    }

    public static File resource(String name) {
        URL url = TestTrees.class.getClassLoader().getResource(name);
        if (url == null) {
            throw new IllegalStateException("Missing test resource " + name);
        }
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
