package com.logix.laad.graph;

import com.logix.laad.dsl.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable property graph of one compilation unit.
 *
 * <p>
 * Vertices live in an arena indexed by their integer id; a removed vertex leaves a
 * {@code null} slot so ids stay stable while passes run. Edges are a flat table of
 * {@code (srcId, srcPort, dstId, dstPort, kind)} tuples in creation order. Cycles
 * need no special handling.
 *
 * <p>
 * {@link #freeze()} is called before emission; every mutator fails afterwards.
 */
public final class Graph {
    private final String name;
    private final List<Vertex> arena = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<Integer, SugarSite> sugarSites = new LinkedHashMap<>();
    private final List<PortEquation> equations = new ArrayList<>();
    private final List<PortAnnotation> annotations = new ArrayList<>();
    private int liveVertices;
    private boolean frozen;

    public Graph(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    // ── Vertices ────────────────────────────────────────────────────

    public Vertex addVertex(String vertexName, String template, List<Port> ports, SourceSpan span,
            boolean synthetic) {
        checkMutable();
        Vertex v = new Vertex(arena.size(), vertexName, template, ports, span, synthetic);
        arena.add(v);
        liveVertices++;
        return v;
    }

    public boolean contains(int id) {
        return id >= 0 && id < arena.size() && arena.get(id) != null;
    }

    public Vertex vertex(int id) {
        if (!contains(id))
            throw new IllegalArgumentException("Unknown vertex id: " + id);
        return arena.get(id);
    }

    public Port port(Endpoint e) {
        return vertex(e.vertex()).requirePort(e.port());
    }

    /** Live vertices in id order. */
    public List<Vertex> vertices() {
        List<Vertex> out = new ArrayList<>(liveVertices);
        for (Vertex v : arena)
            if (v != null)
                out.add(v);
        return out;
    }

    public int vertexCount() {
        return liveVertices;
    }

    /** One past the largest id ever handed out. */
    public int capacity() {
        return arena.size();
    }

    /** Removes a vertex together with every edge touching it and its sugar entry. */
    public void removeVertex(int id) {
        checkMutable();
        vertex(id);
        edges.removeIf(e -> e.srcVertex() == id || e.dstVertex() == id);
        sugarSites.remove(id);
        arena.set(id, null);
        liveVertices--;
    }

    // ── Edges ───────────────────────────────────────────────────────

    public Edge connect(Endpoint from, Endpoint to) {
        checkMutable();
        Port src = port(from);
        Port dst = port(to);
        if (src.isInput() || !dst.isInput())
            throw new IllegalArgumentException("Edge must run from an output to an input: " + from + " -> " + to);
        if (src.kind() != dst.kind())
            throw new IllegalArgumentException("Port kinds differ: " + from + " -> " + to);
        Edge e = new Edge(from.vertex(), from.port(), to.vertex(), to.port(), src.kind());
        edges.add(e);
        return e;
    }

    public void removeEdge(Edge e) {
        checkMutable();
        if (!edges.remove(e))
            throw new IllegalArgumentException("Edge not in graph: " + e);
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Edge> incoming(Endpoint port) {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges)
            if (e.dstVertex() == port.vertex() && e.dstPort().equals(port.port()))
                out.add(e);
        return out;
    }

    public List<Edge> outgoing(Endpoint port) {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges)
            if (e.srcVertex() == port.vertex() && e.srcPort().equals(port.port()))
                out.add(e);
        return out;
    }

    public boolean isBound(Endpoint input) {
        for (Edge e : edges)
            if (e.dstVertex() == input.vertex() && e.dstPort().equals(input.port()))
                return true;
        return false;
    }

    /** Moves every edge ending at {@code from} so it ends at {@code to}. Returns how many moved. */
    public int moveIncoming(Endpoint from, Endpoint to) {
        int moved = 0;
        for (Edge e : incoming(from)) {
            removeEdge(e);
            connect(e.source(), to).setType(e.type());
            moved++;
        }
        return moved;
    }

    /** Moves every edge starting at {@code from} so it starts at {@code to}. Returns how many moved. */
    public int moveOutgoing(Endpoint from, Endpoint to) {
        int moved = 0;
        for (Edge e : outgoing(from)) {
            removeEdge(e);
            connect(to, e.target()).setType(e.type());
            moved++;
        }
        return moved;
    }

    // ── Side tables ─────────────────────────────────────────────────

    public void addSugarSite(SugarSite site) {
        checkMutable();
        sugarSites.put(site.vertex(), site);
    }

    public SugarSite sugarSite(int vertex) {
        return sugarSites.get(vertex);
    }

    /** Sugar sites in creation order. */
    public List<SugarSite> sugarSites() {
        return List.copyOf(sugarSites.values());
    }

    public void addEquation(PortEquation equation) {
        equations.add(equation);
    }

    public List<PortEquation> equations() {
        return Collections.unmodifiableList(equations);
    }

    public void addAnnotation(PortAnnotation annotation) {
        annotations.add(annotation);
    }

    public List<PortAnnotation> annotations() {
        return Collections.unmodifiableList(annotations);
    }

    /** Drops equations and annotations that mention removed vertices. */
    public void pruneSideTables() {
        checkMutable();
        for (Iterator<PortEquation> it = equations.iterator(); it.hasNext();) {
            PortEquation eq = it.next();
            if (!contains(eq.left().vertex()) || !contains(eq.right().vertex()))
                it.remove();
        }
        annotations.removeIf(a -> !contains(a.port().vertex()));
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkMutable() {
        if (frozen)
            throw new IllegalStateException("Graph " + name + " is frozen");
    }
}
