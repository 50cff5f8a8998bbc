package com.logix.laad.passes;

import com.logix.laad.error.PortBindingException;
import com.logix.laad.error.Stage;
import com.logix.laad.graph.Adjacency;
import com.logix.laad.graph.Endpoint;
import com.logix.laad.graph.Graph;
import com.logix.laad.graph.Port;
import com.logix.laad.graph.Vertex;

import java.util.BitSet;

import lombok.extern.log4j.Log4j2;

/**
 * Mark and sweep over the lowered graph.
 *
 * <p>
 * Roots are vertices without input ports that feed at least one edge; a vertex
 * survives when some path leads to it from a root, or when an attribute hook pins it
 * (see {@link AttributeRegistry#retains(Vertex)}). Afterwards every required input of
 * a survivor must still be bound.
 */
@Log4j2
public final class ReachabilityPass {
    private final AttributeRegistry attributes;

    public ReachabilityPass(AttributeRegistry attributes) {
        this.attributes = attributes;
    }

    /** Returns the number of vertices removed. */
    public int sweep(Graph graph) {
        Adjacency adjacency = Adjacency.of(graph);
        BitSet roots = new BitSet(graph.capacity());
        BitSet pinned = new BitSet(graph.capacity());
        for (Vertex v : graph.vertices()) {
            if (!v.hasInputs() && adjacency.childCount(v.id()) > 0)
                roots.set(v.id());
            if (attributes.retains(v))
                pinned.set(v.id());
        }
        BitSet keep = adjacency.reachableFrom(roots);
        keep.or(pinned);

        int removed = 0;
        for (Vertex v : graph.vertices()) {
            if (!keep.get(v.id())) {
                log.debug("Removing unreachable {}", v);
                graph.removeVertex(v.id());
                removed++;
            }
        }
        graph.pruneSideTables();
        checkRequiredInputs(graph);
        log.debug("Reachability on '{}': {} roots, {} pinned, {} removed, {} left", graph.name(),
                roots.cardinality(), pinned.cardinality(), removed, graph.vertexCount());
        return removed;
    }

    private static void checkRequiredInputs(Graph graph) {
        for (Vertex v : graph.vertices())
            for (Port p : v.ports())
                if (p.isInput() && p.isRequired() && !graph.isBound(new Endpoint(v.id(), p.name())))
                    throw new PortBindingException(Stage.REACHABILITY,
                            "Required input " + v.name() + "." + p.name() + " is not connected", v.span());
    }
}
