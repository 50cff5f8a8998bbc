package com.logix.laad.types;

import com.logix.laad.dsl.Ast.LiteralKind;
import com.logix.laad.graph.Edge;
import com.logix.laad.graph.Endpoint;
import com.logix.laad.graph.Graph;
import com.logix.laad.graph.LiteralValue;
import com.logix.laad.graph.Port;
import com.logix.laad.graph.PortKind;
import com.logix.laad.graph.Vertex;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Type terms for every data port and edge endpoint of one graph.
 *
 * <p>
 * Built sequentially before components are split off so variable ids are stable.
 * Template parameters get one fresh variable per vertex; dummy ports get none here,
 * instead each data edge touching one gets its own variable for that endpoint.
 */
final class TermTable {
    private final Map<Endpoint, Type> ports = new HashMap<>();
    private final List<Edge> edges;
    private final Type[] edgeSource;
    private final Type[] edgeTarget;
    private int nextVar;

    TermTable(Graph graph) {
        for (Vertex v : graph.vertices())
            instantiate(v);
        edges = new ArrayList<>(graph.edges());
        edgeSource = new Type[edges.size()];
        edgeTarget = new Type[edges.size()];
        for (int i = 0; i < edges.size(); i++) {
            Edge e = edges.get(i);
            if (e.kind() == PortKind.IMPULSE)
                continue;
            edgeSource[i] = endpointTerm(graph, e.source());
            edgeTarget[i] = endpointTerm(graph, e.target());
        }
    }

    private void instantiate(Vertex v) {
        Map<String, TypeVar> params = new HashMap<>();
        for (Port p : v.ports()) {
            if (p.isImpulse() || p.isDummy())
                continue;
            ports.put(new Endpoint(v.id(), p.name()), instantiate(p.declaredType(), params));
        }
        LiteralValue lit = v.literal();
        if (lit != null)
            seed((TypeVar) ports.get(new Endpoint(v.id(), "value")), lit.kind());
    }

    private Type instantiate(Type declared, Map<String, TypeVar> params) {
        if (declared instanceof TypeParam p)
            return params.computeIfAbsent(p.name(), k -> fresh(p.constraint()));
        if (declared instanceof RefIdType r)
            return new RefIdType(instantiate(r.target(), params));
        return declared;
    }

    /** Literal typing: {@code 1} is numeric defaulting to int, {@code 1.0} fractional defaulting to float. */
    private static void seed(TypeVar var, LiteralKind kind) {
        switch (kind) {
            case INT -> {
                var.restrict(TypeClass.NUMERIC);
                var.setFallback(PrimitiveType.INT);
            }
            case FLOAT -> {
                var.restrict(TypeClass.FRACTIONAL);
                var.setFallback(PrimitiveType.FLOAT);
            }
            case STRING -> var.ref = PrimitiveType.STRING;
            case BOOL -> var.ref = PrimitiveType.BOOL;
            case NULL -> {
                var.restrict(TypeClass.REFERENCE);
                var.setFallback(NullType.INSTANCE);
            }
        }
    }

    private Type endpointTerm(Graph graph, Endpoint e) {
        Port p = graph.port(e);
        return p.isDummy() ? fresh(TypeClass.ANY) : ports.get(e);
    }

    TypeVar fresh(TypeClass constraint) {
        return new TypeVar(nextVar++, constraint);
    }

    Type port(Endpoint e) {
        return ports.get(e);
    }

    Type port(int vertex, String name) {
        return ports.get(new Endpoint(vertex, name));
    }

    List<Edge> edges() {
        return edges;
    }

    Type edgeSource(int index) {
        return edgeSource[index];
    }

    Type edgeTarget(int index) {
        return edgeTarget[index];
    }

    int variableCount() {
        return nextVar;
    }
}
