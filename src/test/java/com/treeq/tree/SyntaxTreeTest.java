package com.treeq.tree;

import com.treeq.TestTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxTreeTest {

    @Test
    public void testPreOrder() {
        SyntaxTree tree = TestTrees.callTree();

        assertEquals(9, tree.size());
        assertEquals("module", tree.root().type());
        assertEquals("call", tree.node(1).type());
        assertEquals("print", tree.node(2).text());
        assertEquals("argument_list", tree.node(3).type());
        assertEquals("b", tree.node(7).text());
    }

    @Test
    public void testParentIndices() {
        SyntaxTree tree = TestTrees.callTree();

        assertEquals(-1, tree.parentIndex(0));
        assertEquals(0, tree.parentIndex(1));
        assertEquals(1, tree.parentIndex(3));
        assertEquals(3, tree.parentIndex(8));
        assertThrows(IndexOutOfBoundsException.class, () -> tree.parentIndex(9));
    }

    @Test
    public void testParentOfUsesStructuralIdentity() {
        SyntaxTree tree = TestTrees.callTree();
        SyntaxNode a = SyntaxNode.of("identifier", 6, 7, "a");

        assertEquals(5, tree.indexOf(a));
        assertEquals("argument_list", tree.parentOf(a).orElseThrow().type());
        assertTrue(tree.parentOf(tree.root()).isEmpty());
        assertEquals(-1, tree.indexOf(SyntaxNode.of("identifier", 20, 21, "z")));
    }

    @Test
    public void testParentIndexDepth() {
        ParentIndex parents = TestTrees.callTree().parentIndex();
        SyntaxTree tree = TestTrees.callTree();

        assertEquals(8, parents.size());
        assertEquals(0, parents.depthOf(tree.root()));
        assertEquals(1, parents.depthOf(tree.node(1)));
        assertEquals(3, parents.depthOf(tree.node(5)));
    }

    @Test
    public void testParentIndexMergePrefersReceiver() {
        SyntaxNode leaf = SyntaxNode.of("x", 1, 2, "x");
        SyntaxNode left = SyntaxNode.of("left", 0, 3, "axb", leaf);
        SyntaxNode right = SyntaxNode.of("right", 0, 3, "axb", leaf);

        ParentIndex merged = ParentIndex.of(List.of(left)).merge(ParentIndex.of(List.of(right)));

        assertEquals(1, merged.size());
        assertEquals(left, merged.parentOf(leaf).orElseThrow());
    }
}
