package com.logix.laad.graph;

import com.logix.laad.dsl.Parser;
import com.logix.laad.error.PortBindingException;
import com.logix.laad.error.ScopeException;
import com.logix.laad.error.TypeCheckException;
import com.logix.laad.node.SugarTemplates;
import com.logix.laad.node.TemplateRegistry;
import com.logix.laad.types.PrimitiveType;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphBuilderTest {

    private static Graph build(String source) {
        return new GraphBuilder(new TemplateRegistry()).build(Parser.parse(source), "test");
    }

    private static Vertex named(Graph g, String name) {
        for (Vertex v : g.vertices())
            if (v.name().equals(name))
                return v;
        fail("No vertex " + name);
        return null;
    }

    private static Vertex ofTemplate(Graph g, String template) {
        for (Vertex v : g.vertices())
            if (v.template().equals(template))
                return v;
        fail("No vertex of " + template);
        return null;
    }

    private static boolean hasEdge(Graph g, Vertex from, String fromPort, Vertex to, String toPort) {
        for (Edge e : g.edges())
            if (e.srcVertex() == from.id() && e.srcPort().equals(fromPort) && e.dstVertex() == to.id()
                    && e.dstPort().equals(toPort))
                return true;
        return false;
    }

    @Test
    public void testHelloWorld() {
        Graph g = build("\"Hello, World!\" -> logix.io.display");
        assertEquals(2, g.vertexCount());
        assertEquals(1, g.edges().size());

        Vertex lit = ofTemplate(g, TemplateRegistry.LITERAL);
        Vertex display = named(g, "display");
        assertTrue(lit.isSynthetic());
        assertFalse(display.isSynthetic());
        assertEquals("Hello, World!", lit.literal().value());
        assertTrue(hasEdge(g, lit, "value", display, "value"));
        assertEquals(PortKind.DATA, g.edges().get(0).kind());
    }

    @Test
    public void testDefinitionAdoptsSyntheticVertex() {
        Graph g = build("x = 1 + 2");
        Vertex x = named(g, "x");
        assertEquals("logix.operators.add", x.template());
        assertFalse(x.isSynthetic());
        assertEquals(3, g.vertexCount());
    }

    @Test
    public void testImpulseChainPrefersImpulsePorts() {
        Graph g = build("b = logix.input.button\nl = logix.io.log\nb -> l\n\"x\" -> l.message");
        Vertex b = named(g, "b");
        Vertex l = named(g, "l");
        assertTrue(hasEdge(g, b, "pressed", l, "trigger"));
        Edge message = g.incoming(new Endpoint(l.id(), "message")).get(0);
        assertEquals(PortKind.DATA, message.kind());
        assertEquals(TemplateRegistry.LITERAL, g.vertex(message.srcVertex()).template());
    }

    @Test
    public void testImportAlias() {
        Graph g = build("import logix.io.display as show\n1 -> show");
        Vertex show = named(g, "show");
        assertEquals("logix.io.display", show.template());
    }

    @Test
    public void testInlineClass() {
        Graph g = build("c = class Counter { in tick: impulse, in step: int, out total: long }\n1 -> c.step");
        Vertex c = named(g, "c");
        assertEquals("Counter", c.template());
        assertEquals(3, c.ports().size());
        assertTrue(c.requirePort("tick").isImpulse());
        assertEquals(PrimitiveType.LONG, c.requirePort("total").declaredType());
        assertTrue(g.isBound(new Endpoint(c.id(), "step")));
    }

    @Test
    public void testAnnotationRecorded() {
        Graph g = build("x: long = 5");
        assertEquals(1, g.annotations().size());
        PortAnnotation a = g.annotations().get(0);
        assertEquals(PrimitiveType.LONG, a.type());
        assertEquals(named(g, "x").id(), a.port().vertex());
    }

    @Test
    public void testAttributesAttached() {
        Graph g = build("#[no_remove]\n#[meta(label = \"x\")]\nd = logix.io.display");
        Vertex d = named(g, "d");
        assertTrue(d.hasAttribute("no_remove"));
        assertEquals("x", d.attributes().get(1).args().get("label"));
    }

    @Test(expected = ScopeException.class)
    public void testDuplicateDefinition() {
        build("a = logix.io.display\na = logix.io.display");
    }

    @Test(expected = ScopeException.class)
    public void testUndeclaredIdentifier() {
        build("foo -> logix.io.display");
    }

    @Test(expected = ScopeException.class)
    public void testUnknownTemplate() {
        build("x = logix.nope.thing");
    }

    @Test(expected = ScopeException.class)
    public void testUnknownPort() {
        build("d = logix.io.display\n1 -> d.missing");
    }

    @Test(expected = TypeCheckException.class)
    public void testUnknownTypeName() {
        build("x: widget = 5");
    }

    @Test(expected = PortBindingException.class)
    public void testInputAlreadyConnected() {
        build("w = logix.world.slot_name\nr = logix.world.root_slot\nr -> w\nr -> w");
    }

    @Test(expected = PortBindingException.class)
    public void testImpulseIntoDataInput() {
        build("b = logix.input.button\nw = logix.world.slot_name\nb.pressed -> w.slot");
    }

    @Test
    public void testDummyInputAcceptsManyEdges() {
        Graph g = build("d = logix.io.display\n1 -> d\n\"a\" -> d");
        assertEquals(2, g.incoming(new Endpoint(named(g, "d").id(), "value")).size());
    }

    @Test
    public void testBlockStatementsAreChained() {
        Graph g = build("b = logix.input.button\nb -> while (true) {\n  l1 = logix.io.log\n  l2 = logix.io.log\n}");
        Vertex l1 = named(g, "l1");
        Vertex l2 = named(g, "l2");
        assertTrue(hasEdge(g, l1, "onDone", l2, "trigger"));

        Vertex loop = ofTemplate(g, SugarTemplates.WHILE);
        SugarSite.WhileSite site = (SugarSite.WhileSite) g.sugarSite(loop.id());
        assertEquals(new Endpoint(l1.id(), "trigger"), site.body().entry());
        assertEquals(new Endpoint(l2.id(), "onDone"), site.body().impulseOut());
        assertTrue(hasEdge(g, named(g, "b"), "pressed", loop, "trigger"));
    }

    @Test
    public void testBlockScopeIsLocal() {
        try {
            build("b = logix.input.button\nb -> while (true) {\n  l = logix.io.log\n}\nl -> logix.io.display");
            fail("Expected a scope error");
        } catch (ScopeException e) {
            assertTrue(e.getMessage().contains("'l'"));
        }
    }

    @Test
    public void testConditionalSite() {
        Graph g = build("c = true\nx = if c then 1 else 2");
        Vertex x = named(g, "x");
        assertEquals(SugarTemplates.IF, x.template());
        IfSite site = (IfSite) g.sugarSite(x.id());
        assertTrue(site.isValueCandidate());
        assertEquals(IfSite.Mode.UNDECIDED, site.mode());
        assertEquals(1, site.levels());
        assertTrue(g.isBound(new Endpoint(x.id(), "branch0")));
        assertTrue(g.isBound(new Endpoint(x.id(), "else")));
    }

    @Test
    public void testConditionalWithoutElseIsStatement() {
        Graph g = build("b = logix.input.button\nc = true\nl = logix.io.log\n\"m\" -> l.message\nb -> if c then l");
        IfSite site = (IfSite) g.sugarSite(ofTemplate(g, SugarTemplates.IF).id());
        assertFalse(site.isValueCandidate());
        assertEquals(IfSite.Mode.STATEMENT, site.mode());
        assertEquals(new Endpoint(named(g, "l").id(), "trigger"), site.branches().get(0).entry());
    }

    @Test
    public void testRangeForCreatesCounter() {
        Graph g = build("b = logix.input.button\nb -> for (i in 0..5) {\n  l = logix.io.log\n  i -> l.message\n}");
        Vertex i = named(g, "i");
        assertEquals(TemplateRegistry.VARIABLE, i.template());
        assertEquals(1, g.equations().size());

        Vertex loop = ofTemplate(g, SugarTemplates.RANGE_FOR);
        SugarSite.RangeForSite site = (SugarSite.RangeForSite) g.sugarSite(loop.id());
        assertEquals(i.id(), site.variable());
        assertTrue(hasEdge(g, i, "value", named(g, "l"), "message"));
    }

    @Test
    public void testSugarSitesInCreationOrder() {
        Graph g = build("b = logix.input.button\nb -> while (true) {\n  c = true\n  x = if c then 1 else 2\n"
                + "  l = logix.io.log\n  x -> l.message\n}");
        List<SugarSite> sites = g.sugarSites();
        assertEquals(2, sites.size());
        assertTrue(sites.get(0) instanceof IfSite);
        assertTrue(sites.get(1) instanceof SugarSite.WhileSite);
    }

    @Test
    public void testBuilderIsReusable() {
        GraphBuilder builder = new GraphBuilder(new TemplateRegistry());
        Graph first = builder.build(Parser.parse("x = 1"), "a");
        Graph second = builder.build(Parser.parse("x = 1"), "b");
        assertEquals(1, first.vertexCount());
        assertEquals(1, second.vertexCount());
        assertEquals("b", second.name());
    }

    @Test
    public void testPortAliasDefinition() {
        Graph g = build("s = logix.world.root_slot\nx = s.slot\nx -> logix.world.slot_name");
        assertEquals(2, g.vertexCount());
        Vertex s = named(g, "s");
        assertTrue(hasEdge(g, s, "slot", named(g, "slot_name"), "slot"));
    }

    @Test
    public void testPortAliasCarriesAnnotation() {
        Graph g = build("s = logix.world.root_slot\nx: Slot = s.slot");
        assertEquals(1, g.vertexCount());
        assertEquals(1, g.annotations().size());
        assertEquals(new Endpoint(named(g, "s").id(), "slot"), g.annotations().get(0).port());
    }

    @Test(expected = ScopeException.class)
    public void testPortAliasUnknownPort() {
        build("s = logix.world.root_slot\nx = s.nope");
    }
}
