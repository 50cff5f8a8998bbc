package com.logix.laad.graph;

/** A named port on a vertex. */
public record Endpoint(int vertex, String port) {

    @Override
    public String toString() {
        return "#" + vertex + "." + port;
    }
}
