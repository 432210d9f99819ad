package com.treeq.predicate;

import com.treeq.tree.SyntaxNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class PredicateParserTest {
    private final PredicateParser parser = new PredicateParser();
    private final SyntaxNode print = SyntaxNode.of("identifier", 0, 5, "print").withFieldName("function");
    private final SyntaxNode comma = SyntaxNode.of(",", 7, 8, ",").withNamed(false);

    @Test
    public void testBlankIsAny() {
        assertEquals(NodePredicate.any(), parser.parse(null));
        assertEquals(NodePredicate.any(), parser.parse("   "));
    }

    @Test
    public void testSingleTerms() {
        assertEquals(NodePredicate.type("call"), parser.parse("type(call)"));
        assertEquals(NodePredicate.textContains("a b"), parser.parse("contains(\"a b\")"));
        assertEquals(NodePredicate.named(), parser.parse("named"));
        assertEquals(NodePredicate.field("body"), parser.parse(" field( body ) "));
    }

    @Test
    public void testPrecedence() {
        NodePredicate parsed = parser.parse("type(call) | type(identifier) & text(print)");

        assertEquals(NodePredicate.type("call")
            .or(NodePredicate.type("identifier").and(NodePredicate.text("print"))), parsed);
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
        "type(identifier);                        true",
        "!type(identifier);                       false",
        "named & field(function);                 true",
        "(type(call) | contains(rin)) & named;    true",
        "!(type(call) | contains(rin));           false",
        "text(\"print\");                         true",
        "kind(identifier) & !capability(x);       true"
    })
    public void testEvaluation(String filter, boolean expected) {
        assertEquals(expected, parser.parse(filter).matches(print));
    }

    @Test
    public void testQuotedOperatorsAreLiteral() {
        assertTrue(parser.parse("text(\",\") & !named").matches(comma));
        assertFalse(parser.parse("contains(\"a|b\")").matches(print));
    }

    @ParameterizedTest
    @ValueSource(strings = {"type(call", "type(call) &", "| named", "unknown(x)", "type()", "text(\"abc)", "banana"})
    public void testInvalidFilters(String filter) {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(filter));
    }
}
