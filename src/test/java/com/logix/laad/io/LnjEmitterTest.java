package com.logix.laad.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.logix.laad.CompilerOptions;
import com.logix.laad.LaadCompiler;
import com.logix.laad.dsl.Parser;
import com.logix.laad.graph.Graph;
import com.logix.laad.node.TemplateRegistry;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class LnjEmitterTest {

    private static Graph lower(String source) {
        return new LaadCompiler(CompilerOptions.defaults()).lower(Parser.parse(source), "unit");
    }

    @Test
    public void testHelloWorldDocument() {
        LnjDocument doc = new LnjEmitter(true).toDocument(lower("\"Hello, World!\" -> logix.io.display"));
        LnjDocument.UnitInfo unit = doc.getLnj();
        assertEquals(LnjEmitter.FORMAT_VERSION, unit.getVersion());
        assertEquals("unit", unit.getName());
        assertEquals(2, unit.getVertices().size());
        assertEquals(1, unit.getEdges().size());

        LnjDocument.VertexDef lit = unit.getVertices().get(0);
        assertEquals(0, lit.getId());
        assertEquals(TemplateRegistry.LITERAL, lit.getTemplate());
        assertTrue(lit.isSynthetic());
        assertEquals("string", lit.getLiteral());
        assertEquals("Hello, World!", lit.getValue());
        assertEquals("string", lit.getPorts().get(0).getType());

        LnjDocument.VertexDef display = unit.getVertices().get(1);
        assertEquals("display", display.getName());
        LnjDocument.PortDef value = display.getPorts().get(0);
        assertEquals("in", value.getDirection());
        assertEquals("data", value.getKind());
        assertEquals("dummy", value.getType());
        assertTrue(value.isRequired());

        LnjDocument.EdgeDef edge = unit.getEdges().get(0);
        assertEquals(0, edge.getFrom());
        assertEquals("value", edge.getFromPort());
        assertEquals(1, edge.getTo());
        assertEquals("value", edge.getToPort());
        assertEquals("data", edge.getKind());
        assertEquals("string", edge.getType());
    }

    @Test
    public void testIdsAreDenseAfterRemoval() {
        Graph g = lower("d = logix.io.display\n\"a\" -> logix.io.display");
        LnjDocument doc = new LnjEmitter(true).toDocument(g);
        List<LnjDocument.VertexDef> vertices = doc.getLnj().getVertices();
        assertEquals(2, vertices.size());
        for (int i = 0; i < vertices.size(); i++)
            assertEquals(i, vertices.get(i).getId());
        LnjDocument.EdgeDef edge = doc.getLnj().getEdges().get(0);
        assertEquals(0, edge.getFrom());
        assertEquals(1, edge.getTo());
    }

    @Test
    public void testImpulseEdgesHaveNoType() {
        LnjDocument doc = new LnjEmitter(true).toDocument(
                lower("b = logix.input.button\nl = logix.io.log\n\"m\" -> l.message\nb -> l"));
        LnjDocument.EdgeDef impulse = null;
        for (LnjDocument.EdgeDef e : doc.getLnj().getEdges())
            if (e.getKind().equals("impulse"))
                impulse = e;
        assertNotNull(impulse);
        assertEquals("pressed", impulse.getFromPort());
        assertEquals("trigger", impulse.getToPort());
        assertNull(impulse.getType());
    }

    @Test
    public void testAttributesEmitted() {
        LnjDocument doc = new LnjEmitter(true).toDocument(lower("#[no_remove]\n#[label(text = \"v\")]\n"
                + "v = logix.data.variable"));
        LnjDocument.VertexDef v = doc.getLnj().getVertices().get(0);
        assertEquals(2, v.getAttributes().size());
        assertEquals("no_remove", v.getAttributes().get(0).getKey());
        assertEquals("v", v.getAttributes().get(1).getArgs().get("text"));
        assertEquals("'t", v.getPorts().get(0).getType().substring(0, 2));
    }

    @Test
    public void testRenderedJson() throws Exception {
        LnjEmitter emitter = new LnjEmitter(false);
        String json = emitter.render(emitter.toDocument(lower("x = 42\nx -> logix.io.display")));
        assertFalse(json.contains("\n"));

        JsonNode root = LnjReader.tree(json);
        JsonNode unit = root.get("lnj");
        assertEquals("1", unit.get("version").asText());
        JsonNode x = unit.get("vertices").get(0);
        assertEquals("x", x.get("name").asText());
        assertEquals("int", x.get("literal").asText());
        assertEquals(42, x.get("value").asInt());
        assertFalse(x.path("synthetic").asBoolean());
        assertNull(x.get("attributes"));
    }

    @Test
    public void testPrettyRenderingIndents() {
        LnjEmitter emitter = new LnjEmitter(true);
        String json = emitter.render(emitter.toDocument(lower("1 -> logix.io.display")));
        assertTrue(json.contains("\n"));
    }

    @Test
    public void testSameSourceSameText() {
        String source = "c = true\nx = if c then 1 else 2.5\nx -> logix.io.display";
        LnjEmitter emitter = new LnjEmitter(true);
        assertEquals(emitter.render(emitter.toDocument(lower(source))),
                emitter.render(emitter.toDocument(lower(source))));
    }

    @Test(expected = IllegalStateException.class)
    public void testGraphFrozenAfterEmission() {
        Graph g = lower("1 -> logix.io.display");
        new LnjEmitter(true).toDocument(g);
        assertTrue(g.isFrozen());
        g.removeVertex(0);
    }
}
