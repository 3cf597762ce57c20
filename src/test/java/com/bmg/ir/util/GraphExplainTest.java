package com.bmg.ir.util;

import com.bmg.ir.GraphFactory;
import com.bmg.ir.engine.Graph;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private static Graph coin() {
        GraphFactory f = GraphFactory.create("coin");
        int p = f.addConstant(0.5);
        int flip = f.sample(f.bernoulli(p));
        f.addQuery(flip);
        return f.build();
    }

    @Test
    public void testExplainNode() {
        String text = new GraphExplain(coin()).explainNode(2);
        assertTrue(text.contains("Node: %2"));
        assertTrue(text.contains("Operator: SAMPLE"));
        assertTrue(text.contains("Type: REAL"));
        assertTrue(text.contains("Variant: OperatorNode"));
        assertTrue(text.contains("Consumers (1): %3"));
    }

    @Test
    public void testExplainConstantAndQuery() {
        GraphExplain explain = new GraphExplain(coin());
        assertTrue(explain.explainNode(0).contains("Detail: CONSTANT 0.5"));
        assertTrue(explain.explainNode(3).contains("Detail: QUERY #0"));
        assertTrue(explain.explainNode(3).contains("Consumers (0)"));
    }

    @Test
    public void testDumpGraph() {
        String dump = new GraphExplain(coin()).dumpGraph();
        assertTrue(dump.startsWith("Graph coin (4 nodes, 1 queries):"));
        assertTrue(dump.contains("%1 = DISTRIBUTION_BERNOULLI(%0) : DISTRIBUTION  -> %2"));
        assertTrue(dump.contains("%3 = QUERY#0(%2) : NONE\n"));
    }

    @Test
    public void testMermaid() {
        String mermaid = new GraphExplain(coin()).toMermaid();
        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("n0[\"%0 CONSTANT 0.5 : REAL\"];"));
        assertTrue(mermaid.contains("n1 -- \"0\" --> n2;"));
        assertTrue(mermaid.contains("n2 -- \"0\" --> n3;"));
    }
}
