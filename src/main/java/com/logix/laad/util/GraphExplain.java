package com.logix.laad.util;

import com.logix.laad.graph.Adjacency;
import com.logix.laad.graph.Edge;
import com.logix.laad.graph.Endpoint;
import com.logix.laad.graph.Graph;
import com.logix.laad.graph.Port;
import com.logix.laad.graph.PortKind;
import com.logix.laad.graph.Vertex;

/**
 * Diagnostic utility for inspecting a compiled graph.
 *
 * <p>
 * Generates human-readable string representations of the graph structure and of
 * single vertices, plus a Mermaid diagram for embedding in Markdown.
 */
public final class GraphExplain {
    private final Graph graph;
    private final Adjacency adjacency;

    public GraphExplain(Graph graph) {
        this.graph = graph;
        this.adjacency = Adjacency.of(graph);
    }

    /**
     * Dumps the ports and connections of a single vertex.
     */
    public String explainVertex(String vertexName) {
        Vertex v = find(vertexName);
        if (v == null)
            throw new IllegalArgumentException("No vertex named " + vertexName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Vertex: ").append(v.name()).append('\n')
                .append("  Id: ").append(v.id()).append('\n')
                .append("  Template: ").append(v.template()).append('\n')
                .append("  Synthetic: ").append(v.isSynthetic()).append('\n');
        if (v.literal() != null)
            sb.append("  Value: ").append(v.literal().value()).append('\n');
        for (Port p : v.ports()) {
            sb.append("  ").append(p.direction().label()).append(' ').append(p.name()).append(": ")
                    .append(p.kind() == PortKind.IMPULSE ? "impulse" : p.type());
            Endpoint at = new Endpoint(v.id(), p.name());
            var edges = p.isInput() ? graph.incoming(at) : graph.outgoing(at);
            for (Edge e : edges) {
                Endpoint other = p.isInput() ? e.source() : e.target();
                sb.append(p.isInput() ? " <- " : " -> ").append(graph.vertex(other.vertex()).name()).append('.')
                        .append(other.port());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps the entire graph in dot-like text format.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(graph.vertexCount()).append(" vertices, ")
                .append(graph.edges().size()).append(" edges):\n");
        for (Vertex v : graph.vertices()) {
            int i = v.id();
            sb.append("  [").append(i).append("] ").append(v.name()).append(" : ").append(v.template());
            if (!v.hasInputs())
                sb.append(" (ROOT)");
            int cc = adjacency.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(graph.vertex(adjacency.child(i, j)).name());
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid graph diagram. Impulse edges are drawn thick, data edges are
     * labelled with their type.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare vertices in id order
        for (Vertex v : graph.vertices()) {
            String label = v.literal() != null ? v.name() + " = " + v.literal().value() : v.name();
            sb.append("  ").append(nodeId(v)).append("[\"").append(escape(label)).append("<br/><i>")
                    .append(v.template()).append("</i>\"];\n");
        }

        // 2. Declare all edges afterwards
        for (Edge e : graph.edges()) {
            String from = nodeId(graph.vertex(e.srcVertex()));
            String to = nodeId(graph.vertex(e.dstVertex()));
            if (e.kind() == PortKind.IMPULSE) {
                sb.append("  ").append(from).append(" ==> ").append(to).append(";\n");
            } else {
                String label = e.srcPort() + " : " + e.type();
                sb.append("  ").append(from).append(" -- \"").append(escape(label)).append("\" --> ").append(to)
                        .append(";\n");
            }
        }
        return sb.toString();
    }

    private Vertex find(String name) {
        for (Vertex v : graph.vertices())
            if (v.name().equals(name))
                return v;
        return null;
    }

    private static String nodeId(Vertex v) {
        return "v" + v.id() + "_" + sanitize(v.name());
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
