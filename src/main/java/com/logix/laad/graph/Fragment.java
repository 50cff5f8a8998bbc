package com.logix.laad.graph;

/**
 * What a built expression exposes to the connections around it.
 *
 * <p>
 * {@code entry} is the impulse input that starts it, {@code impulseOut} the impulse
 * output that fires once it has run and {@code valueOut} the data output carrying its
 * value. Any of the three may be {@code null}.
 */
public record Fragment(int vertex, Endpoint entry, Endpoint impulseOut, Endpoint valueOut) {
}
