package com.logix.laad.graph;

import com.logix.laad.types.Type;

/**
 * Directed connection {@code (srcVertex, srcPort) -> (dstVertex, dstPort)}.
 *
 * <p>
 * Impulse edges order their endpoints (source before destination). The type of a
 * data edge is set by inference; for a dummy endpoint it is the only record of the
 * type that flows over that particular connection.
 */
public final class Edge {
    private final int srcVertex;
    private final String srcPort;
    private final int dstVertex;
    private final String dstPort;
    private final PortKind kind;
    private Type type;

    public Edge(int srcVertex, String srcPort, int dstVertex, String dstPort, PortKind kind) {
        this.srcVertex = srcVertex;
        this.srcPort = srcPort;
        this.dstVertex = dstVertex;
        this.dstPort = dstPort;
        this.kind = kind;
    }

    public int srcVertex() {
        return srcVertex;
    }

    public String srcPort() {
        return srcPort;
    }

    public int dstVertex() {
        return dstVertex;
    }

    public String dstPort() {
        return dstPort;
    }

    public PortKind kind() {
        return kind;
    }

    public Endpoint source() {
        return new Endpoint(srcVertex, srcPort);
    }

    public Endpoint target() {
        return new Endpoint(dstVertex, dstPort);
    }

    public Type type() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    @Override
    public String toString() {
        return source() + " -> " + target() + (kind == PortKind.IMPULSE ? " (impulse)" : "");
    }
}
