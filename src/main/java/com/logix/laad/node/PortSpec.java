package com.logix.laad.node;

import com.logix.laad.graph.Direction;
import com.logix.laad.graph.Port;
import com.logix.laad.graph.PortKind;
import com.logix.laad.types.Type;

/** Port declaration of a node template; {@code type} is {@code null} for impulse ports. */
public record PortSpec(String name, Direction direction, PortKind kind, Type type, boolean required) {

    public Port instantiate() {
        return new Port(name, direction, kind, type, required);
    }
}
