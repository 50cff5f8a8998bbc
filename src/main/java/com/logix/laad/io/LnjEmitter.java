package com.logix.laad.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logix.laad.error.CompilationException;
import com.logix.laad.error.Stage;
import com.logix.laad.graph.Attribute;
import com.logix.laad.graph.Edge;
import com.logix.laad.graph.Graph;
import com.logix.laad.graph.LiteralValue;
import com.logix.laad.graph.Port;
import com.logix.laad.graph.PortKind;
import com.logix.laad.graph.Vertex;
import com.logix.laad.types.Type;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Serializes a fully lowered graph as LNJ.
 *
 * <p>
 * The graph is frozen first. Vertices are numbered densely in id order, edges keep
 * their creation order, so the same graph always yields the same text.
 */
@Log4j2
public final class LnjEmitter {
    public static final String FORMAT_VERSION = "1";

    private final ObjectMapper mapper = new ObjectMapper();
    private final boolean prettyPrint;

    public LnjEmitter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public LnjDocument toDocument(Graph graph) {
        graph.freeze();
        Map<Integer, Integer> dense = new HashMap<>();
        List<LnjDocument.VertexDef> vertices = new ArrayList<>(graph.vertexCount());
        for (Vertex v : graph.vertices()) {
            dense.put(v.id(), vertices.size());
            vertices.add(vertex(v, vertices.size()));
        }

        List<LnjDocument.EdgeDef> edges = new ArrayList<>(graph.edges().size());
        for (Edge e : graph.edges()) {
            LnjDocument.EdgeDef d = new LnjDocument.EdgeDef();
            d.setFrom(dense.get(e.srcVertex()));
            d.setFromPort(e.srcPort());
            d.setTo(dense.get(e.dstVertex()));
            d.setToPort(e.dstPort());
            d.setKind(e.kind() == PortKind.DATA ? "data" : "impulse");
            d.setType(typeName(e.type()));
            edges.add(d);
        }

        LnjDocument.UnitInfo info = new LnjDocument.UnitInfo();
        info.setVersion(FORMAT_VERSION);
        info.setName(graph.name());
        info.setVertices(vertices);
        info.setEdges(edges);
        LnjDocument doc = new LnjDocument();
        doc.setLnj(info);
        log.debug("Emitting '{}': {} vertices, {} edges", graph.name(), vertices.size(), edges.size());
        return doc;
    }

    private static LnjDocument.VertexDef vertex(Vertex v, int id) {
        LnjDocument.VertexDef d = new LnjDocument.VertexDef();
        d.setId(id);
        d.setName(v.name());
        d.setTemplate(v.template());
        d.setSynthetic(v.isSynthetic());

        List<LnjDocument.PortDef> ports = new ArrayList<>();
        for (Port p : v.ports()) {
            LnjDocument.PortDef pd = new LnjDocument.PortDef();
            pd.setName(p.name());
            pd.setDirection(p.direction().label());
            pd.setKind(p.kind().label());
            pd.setType(typeName(p.type()));
            pd.setRequired(p.isRequired());
            ports.add(pd);
        }
        d.setPorts(ports);

        LiteralValue lit = v.literal();
        if (lit != null) {
            d.setLiteral(lit.kind().name().toLowerCase(Locale.ROOT));
            d.setValue(lit.value());
        }

        List<LnjDocument.AttributeDef> attributes = new ArrayList<>();
        for (Attribute a : v.attributes()) {
            LnjDocument.AttributeDef ad = new LnjDocument.AttributeDef();
            ad.setKey(a.key());
            ad.setArgs(a.args());
            attributes.add(ad);
        }
        d.setAttributes(attributes);
        return d;
    }

    private static String typeName(Type t) {
        return t == null ? null : t.toString();
    }

    public String render(LnjDocument doc) {
        try {
            return prettyPrint ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(doc)
                    : mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new CompilationException(Stage.EMIT, "Failed to serialize LNJ: " + e.getOriginalMessage(), null);
        }
    }
}
