package com.logix.laad.node;

import com.logix.laad.graph.Direction;
import com.logix.laad.graph.Port;
import com.logix.laad.graph.PortKind;
import com.logix.laad.types.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape of a node kind: its dotted path and ordered port list.
 *
 * <p>
 * Data inputs are required unless declared optional; impulse inputs never are.
 * Port types may mention {@link com.logix.laad.types.TypeParam template parameters},
 * which are instantiated afresh for every vertex.
 */
public final class NodeTemplate {
    private final String path;
    private final List<PortSpec> ports;

    private NodeTemplate(String path, List<PortSpec> ports) {
        this.path = path;
        this.ports = List.copyOf(ports);
    }

    public String path() {
        return path;
    }

    public List<PortSpec> ports() {
        return ports;
    }

    public PortSpec port(String name) {
        for (PortSpec p : ports)
            if (p.name().equals(name))
                return p;
        return null;
    }

    /** Fresh ports for a new vertex of this template. */
    public List<Port> instantiate() {
        List<Port> out = new ArrayList<>(ports.size());
        for (PortSpec p : ports)
            out.add(p.instantiate());
        return out;
    }

    @Override
    public String toString() {
        return path + ports;
    }

    public static Builder builder(String path) {
        return new Builder(path);
    }

    public static final class Builder {
        private final String path;
        private final List<PortSpec> ports = new ArrayList<>();

        private Builder(String path) {
            this.path = path;
        }

        public Builder in(String name, Type type) {
            return add(new PortSpec(name, Direction.IN, PortKind.DATA, type, true));
        }

        public Builder optionalIn(String name, Type type) {
            return add(new PortSpec(name, Direction.IN, PortKind.DATA, type, false));
        }

        public Builder impulseIn(String name) {
            return add(new PortSpec(name, Direction.IN, PortKind.IMPULSE, null, false));
        }

        public Builder out(String name, Type type) {
            return add(new PortSpec(name, Direction.OUT, PortKind.DATA, type, false));
        }

        public Builder impulseOut(String name) {
            return add(new PortSpec(name, Direction.OUT, PortKind.IMPULSE, null, false));
        }

        public Builder add(PortSpec spec) {
            for (PortSpec p : ports)
                if (p.name().equals(spec.name()))
                    throw new IllegalArgumentException("Duplicate port '" + spec.name() + "' in " + path);
            ports.add(spec);
            return this;
        }

        public NodeTemplate build() {
            return new NodeTemplate(path, ports);
        }
    }
}
