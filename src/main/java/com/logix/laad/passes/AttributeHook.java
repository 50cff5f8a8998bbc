package com.logix.laad.passes;

import com.logix.laad.graph.Attribute;
import com.logix.laad.graph.Vertex;

/**
 * Behaviour attached to one attribute key. Passes consult the {@link AttributeRegistry}
 * at fixed points instead of testing attribute names themselves.
 */
public interface AttributeHook {

    String key();

    /** Asked by the reachability pass: keep {@code vertex} even when unreachable. */
    default boolean retains(Vertex vertex, Attribute attribute) {
        return false;
    }

    /** Asked by type inference: may a {@code null} literal flow into {@code vertex}. */
    default boolean acceptsNull(Vertex vertex, Attribute attribute) {
        return false;
    }
}
