package com.logix.laad.passes;

import com.logix.laad.dsl.Parser;
import com.logix.laad.graph.Edge;
import com.logix.laad.graph.Endpoint;
import com.logix.laad.graph.Graph;
import com.logix.laad.graph.GraphBuilder;
import com.logix.laad.graph.PortKind;
import com.logix.laad.graph.Vertex;
import com.logix.laad.node.TemplateRegistry;
import com.logix.laad.types.PrimitiveType;
import com.logix.laad.types.TypeInferenceEngine;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class DesugarerTest {

    private static Graph desugar(String source) {
        TemplateRegistry registry = new TemplateRegistry();
        Graph g = new GraphBuilder(registry).build(Parser.parse(source), "test");
        new TypeInferenceEngine(AttributeRegistry.standard(), 1).infer(g);
        new Desugarer(registry).desugar(g);
        return g;
    }

    private static Vertex named(Graph g, String name) {
        for (Vertex v : g.vertices())
            if (v.name().equals(name))
                return v;
        fail("No vertex " + name);
        return null;
    }

    private static List<Vertex> ofTemplate(Graph g, String template) {
        List<Vertex> out = new ArrayList<>();
        for (Vertex v : g.vertices())
            if (v.template().equals(template))
                out.add(v);
        return out;
    }

    private static Vertex single(Graph g, String template) {
        List<Vertex> vs = ofTemplate(g, template);
        assertEquals("vertices of " + template, 1, vs.size());
        return vs.get(0);
    }

    private static boolean hasEdge(Graph g, Vertex from, String fromPort, Vertex to, String toPort) {
        for (Edge e : g.edges())
            if (e.srcVertex() == from.id() && e.srcPort().equals(fromPort) && e.dstVertex() == to.id()
                    && e.dstPort().equals(toPort))
                return true;
        return false;
    }

    private static Vertex sourceOf(Graph g, Vertex v, String port) {
        List<Edge> in = g.incoming(new Endpoint(v.id(), port));
        assertEquals(1, in.size());
        return g.vertex(in.get(0).srcVertex());
    }

    private static void assertNoSugarLeft(Graph g) {
        for (Vertex v : g.vertices())
            assertFalse(v.toString(), v.template().startsWith("sugar."));
        assertTrue(g.sugarSites().isEmpty());
    }

    @Test
    public void testConditionalExpression() {
        Graph g = desugar("c = true\nx = if c then 1 else 2\nx -> logix.io.display");
        assertNoSugarLeft(g);
        assertTrue(ofTemplate(g, TemplateRegistry.FLOW_IF).isEmpty());

        Vertex x = single(g, TemplateRegistry.CONDITIONAL);
        assertEquals("x", x.name());
        assertFalse(x.isSynthetic());
        assertEquals(PrimitiveType.INT, x.requirePort("result").type());
        assertEquals("c", sourceOf(g, x, "condition").name());
        assertEquals(1L, sourceOf(g, x, "onTrue").literal().value());
        assertEquals(2L, sourceOf(g, x, "onFalse").literal().value());

        Edge out = g.outgoing(new Endpoint(x.id(), "result")).get(0);
        assertEquals("display", g.vertex(out.dstVertex()).name());
        assertEquals(PrimitiveType.INT, out.type());
    }

    @Test
    public void testConditionalExpressionCastsNarrowBranch() {
        Graph g = desugar("c = true\nx = if c then 1 as short else 2\nx -> logix.io.display");
        List<Vertex> casts = ofTemplate(g, TemplateRegistry.CAST);
        assertEquals(2, casts.size());

        Vertex x = single(g, TemplateRegistry.CONDITIONAL);
        Vertex widening = sourceOf(g, x, "onTrue");
        assertEquals(TemplateRegistry.CAST, widening.template());
        assertTrue(widening.isSynthetic());
        assertEquals(PrimitiveType.SHORT, widening.requirePort("value").type());
        assertEquals(PrimitiveType.INT, widening.requirePort("result").type());
        assertEquals(TemplateRegistry.LITERAL, sourceOf(g, x, "onFalse").template());
    }

    @Test
    public void testElseIfExpressionNests() {
        Graph g = desugar("c = true\nd = false\nx = if c then 1 elseif d then 2 else 3\nx -> logix.io.display");
        List<Vertex> conds = ofTemplate(g, TemplateRegistry.CONDITIONAL);
        assertEquals(2, conds.size());
        Vertex outer = named(g, "x");
        Vertex inner = sourceOf(g, outer, "onFalse");
        assertEquals(TemplateRegistry.CONDITIONAL, inner.template());
        assertEquals("c", sourceOf(g, outer, "condition").name());
        assertEquals("d", sourceOf(g, inner, "condition").name());
        assertEquals(3L, sourceOf(g, inner, "onFalse").literal().value());
    }

    @Test
    public void testConditionalStatement() {
        Graph g = desugar("b = logix.input.button\nc = true\nl1 = logix.io.log\n\"a\" -> l1.message\n"
                + "l2 = logix.io.log\n\"b\" -> l2.message\nb -> if c then l1 else l2");
        assertNoSugarLeft(g);
        Vertex f = single(g, TemplateRegistry.FLOW_IF);
        assertTrue(ofTemplate(g, TemplateRegistry.FLOW_SEQUENCE).isEmpty());
        assertTrue(hasEdge(g, named(g, "b"), "pressed", f, "trigger"));
        assertEquals("c", sourceOf(g, f, "condition").name());
        assertTrue(hasEdge(g, f, "onTrue", named(g, "l1"), "trigger"));
        assertTrue(hasEdge(g, f, "onFalse", named(g, "l2"), "trigger"));
    }

    @Test
    public void testConditionalStatementLevels() {
        Graph g = desugar("b = logix.input.button\nc = true\nd = false\nl1 = logix.io.log\n\"a\" -> l1.message\n"
                + "l2 = logix.io.log\n\"b\" -> l2.message\nb -> if c then l1 elseif d then l2");
        List<Vertex> ifs = ofTemplate(g, TemplateRegistry.FLOW_IF);
        assertEquals(2, ifs.size());
        Vertex first = ifs.get(0);
        Vertex second = ifs.get(1);
        assertTrue(hasEdge(g, first, "onFalse", second, "trigger"));
        assertTrue(hasEdge(g, second, "onTrue", named(g, "l2"), "trigger"));
        assertTrue(g.outgoing(new Endpoint(second.id(), "onFalse")).isEmpty());
    }

    @Test
    public void testConditionalStatementContinuesAfterwards() {
        Graph g = desugar("b = logix.input.button\nc = true\nl1 = logix.io.log\n\"a\" -> l1.message\n"
                + "l3 = logix.io.log\n\"z\" -> l3.message\nb -> if c then l1 -> l3");
        Vertex f = single(g, TemplateRegistry.FLOW_IF);
        Vertex seq = single(g, TemplateRegistry.FLOW_SEQUENCE);
        assertTrue(hasEdge(g, named(g, "b"), "pressed", seq, "trigger"));
        assertTrue(hasEdge(g, seq, "first", f, "trigger"));
        assertTrue(hasEdge(g, seq, "then", named(g, "l3"), "trigger"));
        assertTrue(hasEdge(g, f, "onTrue", named(g, "l1"), "trigger"));
    }

    @Test
    public void testWhileLoop() {
        Graph g = desugar("b = logix.input.button\ngo = true\nb -> while (go) {\n  l = logix.io.log\n"
                + "  \"x\" -> l.message\n}");
        assertNoSugarLeft(g);
        Vertex w = single(g, TemplateRegistry.FLOW_WHILE);
        Vertex l = named(g, "l");
        assertTrue(hasEdge(g, named(g, "b"), "pressed", w, "trigger"));
        assertEquals("go", sourceOf(g, w, "condition").name());
        assertTrue(hasEdge(g, w, "loopIteration", l, "trigger"));
        assertTrue(hasEdge(g, l, "onDone", w, "trigger"));
    }

    @Test
    public void testLoopBodyWithoutImpulseOutputRunsUnderSequence() {
        Graph g = desugar("b = logix.input.button\ngo = true\nb -> while (go) {\n  k = class { in run: impulse }\n}");
        Vertex w = single(g, TemplateRegistry.FLOW_WHILE);
        Vertex seq = single(g, TemplateRegistry.FLOW_SEQUENCE);
        assertTrue(hasEdge(g, w, "loopIteration", seq, "trigger"));
        assertTrue(hasEdge(g, seq, "first", named(g, "k"), "run"));
        assertTrue(hasEdge(g, seq, "then", w, "trigger"));
    }

    @Test
    public void testRangeFor() {
        Graph g = desugar("button = logix.input.button\nbutton -> for (i in 0..5) {\n  l = logix.io.log\n"
                + "  i -> l.message\n}");
        assertNoSugarLeft(g);

        Vertex w = single(g, TemplateRegistry.FLOW_WHILE);
        Vertex i = named(g, "i");
        assertEquals(TemplateRegistry.VARIABLE, i.template());
        List<Vertex> writes = ofTemplate(g, TemplateRegistry.WRITE);
        assertEquals(2, writes.size());
        Vertex less = single(g, "logix.operators.less");
        Vertex add = single(g, "logix.operators.add");

        Vertex init = null;
        Vertex step = null;
        for (Vertex v : writes) {
            if (g.isBound(new Endpoint(v.id(), "trigger")) && sourceOf(g, v, "value") == add)
                step = v;
            else
                init = v;
        }
        assertNotNull(init);
        assertNotNull(step);

        assertTrue(hasEdge(g, named(g, "button"), "pressed", init, "trigger"));
        assertEquals(0L, sourceOf(g, init, "value").literal().value());
        assertTrue(hasEdge(g, i, "ref", init, "target"));
        assertTrue(hasEdge(g, init, "onDone", w, "trigger"));

        assertTrue(hasEdge(g, i, "value", less, "a"));
        assertEquals(5L, sourceOf(g, less, "b").literal().value());
        assertTrue(hasEdge(g, less, "result", w, "condition"));

        Vertex one = sourceOf(g, add, "b");
        assertEquals(1L, one.literal().value());
        assertEquals(PrimitiveType.INT, one.requirePort("value").type());
        assertTrue(hasEdge(g, i, "value", add, "a"));
        assertTrue(hasEdge(g, i, "ref", step, "target"));
        assertTrue(hasEdge(g, step, "onDone", w, "trigger"));

        Vertex l = named(g, "l");
        assertTrue(hasEdge(g, w, "loopIteration", l, "trigger"));
        assertTrue(hasEdge(g, l, "onDone", step, "trigger"));
        assertTrue(hasEdge(g, i, "value", l, "message"));
        assertEquals(PrimitiveType.INT, less.requirePort("a").type());
    }

    @Test
    public void testGenericFor() {
        Graph g = desugar("b = logix.input.button\ngo = true\ns = logix.io.log\nst = logix.io.log\n"
                + "b -> for (s, go, st) {\n  l = logix.io.log\n}");
        assertNoSugarLeft(g);
        Vertex w = single(g, TemplateRegistry.FLOW_WHILE);
        Vertex s = named(g, "s");
        Vertex st = named(g, "st");
        Vertex l = named(g, "l");
        assertTrue(hasEdge(g, named(g, "b"), "pressed", s, "trigger"));
        assertTrue(hasEdge(g, s, "onDone", w, "trigger"));
        assertEquals("go", sourceOf(g, w, "condition").name());
        assertTrue(hasEdge(g, w, "loopIteration", l, "trigger"));
        assertTrue(hasEdge(g, l, "onDone", st, "trigger"));
        assertTrue(hasEdge(g, st, "onDone", w, "trigger"));
    }

    @Test
    public void testNestedLoopsLowerOuterFirst() {
        Graph g = desugar("b = logix.input.button\ngo = true\nb -> while (go) {\n  c = true\n"
                + "  if c then logix.io.log\n  l = logix.io.log\n}");
        assertNoSugarLeft(g);
        Vertex w = single(g, TemplateRegistry.FLOW_WHILE);
        Vertex f = single(g, TemplateRegistry.FLOW_IF);
        Vertex seq = single(g, TemplateRegistry.FLOW_SEQUENCE);
        Vertex l = named(g, "l");
        // the conditional runs first, then the rest of the body
        assertTrue(hasEdge(g, w, "loopIteration", seq, "trigger"));
        assertTrue(hasEdge(g, seq, "first", f, "trigger"));
        assertTrue(hasEdge(g, seq, "then", l, "trigger"));
        assertTrue(hasEdge(g, f, "onTrue", named(g, "log"), "trigger"));
        assertTrue(hasEdge(g, l, "onDone", w, "trigger"));
        for (Edge e : g.incoming(new Endpoint(l.id(), "trigger")))
            assertEquals(PortKind.IMPULSE, e.kind());
    }
}
