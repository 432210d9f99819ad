package com.treeq.output;

import com.treeq.TestTrees;
import com.treeq.analytics.GraphMetrics;
import com.treeq.match.Match;
import com.treeq.tree.SyntaxNode;
import com.treeq.tree.SyntaxTreeReader;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class OutputFormatterTest {

    @Test
    public void testCompactLeaf() {
        String json = new OutputFormatter(false).format(SyntaxNode.of("identifier", 6, 7, "a").withFieldName("value"));

        assertEquals("{\"type\":\"identifier\",\"startByte\":6,\"endByte\":7,"
            + "\"startPoint\":{\"row\":0,\"column\":6},\"endPoint\":{\"row\":0,\"column\":7},"
            + "\"text\":\"a\",\"named\":true,\"field\":\"value\"}", json);
    }

    @Test
    public void testOutputReadsBack() throws IOException {
        SyntaxNode call = TestTrees.call();
        String json = new OutputFormatter(true).format(call);

        SyntaxNode read = new SyntaxTreeReader()
            .read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))).root();

        assertEquals(call, read);
        assertTrue(json.contains("\n  \"children\": ["));
    }

    @Test
    public void testWithoutChildren() {
        String json = new OutputFormatter(false, false).format(TestTrees.call());

        assertFalse(json.contains("children"));
        assertTrue(json.startsWith("{\"type\":\"module\""));
    }

    @Test
    public void testEscaping() {
        String json = new OutputFormatter(false).format(SyntaxNode.of("string", 0, 6, "\"a\"\n\t\u0001"));

        assertTrue(json.contains("\"text\":\"\\\"a\\\"\\n\\t\\u0001\""), json);
    }

    @Test
    public void testSummary() {
        OutputFormatter formatter = new OutputFormatter(false);

        assertEquals("identifier 0:6 a", formatter.summary(SyntaxNode.of("identifier", 6, 7, "a"), 10));
        assertEquals("module 0:0 print(...", formatter.summary(TestTrees.call(), 6));
    }

    @Test
    public void testMatch() {
        OutputFormatter formatter = new OutputFormatter(false);

        assertEquals("{\"0\":1,\"1\":2}", formatter.format(new Match(IntLists.immutable.with(1, 2))));
        assertEquals("{}", formatter.format(new Match(IntLists.immutable.empty())));
    }

    @Test
    public void testMetrics() {
        GraphMetrics metrics = new GraphMetrics(3, 2, 1.0 / 3, 1, true, true);

        assertEquals("{\"nodeCount\":3,\"edgeCount\":2,\"density\":0.3333333333333333,"
            + "\"componentCount\":1,\"connected\":true,\"acyclic\":true}", new OutputFormatter(false).format(metrics));
        assertTrue(new OutputFormatter(true).format(metrics).startsWith("{\n  \"nodeCount\": 3,\n  \"edgeCount\": 2,"));
    }
}
