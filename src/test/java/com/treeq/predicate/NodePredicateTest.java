package com.treeq.predicate;

import com.treeq.error.QueryCallbackException;
import com.treeq.tree.NodeKind;
import com.treeq.tree.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class NodePredicateTest {
    private final SyntaxNode identifier = SyntaxNode.of("identifier", 0, 5, "print")
        .withFieldName("function")
        .withKind(NodeKind.of("name", "expression"));

    @Test
    public void testAttributePredicates() {
        assertTrue(NodePredicate.any().matches(identifier));
        assertTrue(NodePredicate.type("identifier").matches(identifier));
        assertFalse(NodePredicate.type("call").matches(identifier));
        assertTrue(NodePredicate.text("print").matches(identifier));
        assertFalse(NodePredicate.text("prin").matches(identifier));
        assertTrue(NodePredicate.textContains("rin").matches(identifier));
        assertTrue(NodePredicate.kind("name").matches(identifier));
        assertTrue(NodePredicate.capability("expression").matches(identifier));
        assertFalse(NodePredicate.capability("statement").matches(identifier));
        assertTrue(NodePredicate.named().matches(identifier));
        assertTrue(NodePredicate.field("function").matches(identifier));
        assertFalse(NodePredicate.field("function").matches(identifier.withFieldName(null)));
    }

    @Test
    public void testCombinators() {
        NodePredicate isIdentifier = NodePredicate.type("identifier");
        NodePredicate isPrint = NodePredicate.text("print");

        assertTrue(isIdentifier.and(isPrint).matches(identifier));
        assertFalse(isIdentifier.and(isPrint.not()).matches(identifier));
        assertTrue(NodePredicate.type("call").or(isPrint).matches(identifier));
        assertFalse(NodePredicate.type("call").or(isPrint.not()).matches(identifier));
    }

    @Test
    public void testAndShortCircuits() {
        AtomicInteger calls = new AtomicInteger();
        NodePredicate counting = NodePredicate.of(node -> calls.incrementAndGet() > 0);

        NodePredicate.type("call").and(counting).matches(identifier);
        NodePredicate.type("identifier").or(counting).matches(identifier);

        assertEquals(0, calls.get());
    }

    @Test
    public void testCustomFailureCarriesNode() {
        NodePredicate failing = NodePredicate.of("explodes", node -> {
            throw new IllegalStateException("boom");
        });

        QueryCallbackException error = assertThrows(QueryCallbackException.class, () -> failing.matches(identifier));
        assertSame(identifier, error.node());
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(error.getMessage().contains("explodes"));
    }

    @Test
    public void testPredicatesAreValues() {
        assertEquals(NodePredicate.type("call"), NodePredicate.type("call"));
        assertEquals(NodePredicate.type("a").and(NodePredicate.named()), NodePredicate.type("a").and(NodePredicate.named()));
    }
}
