package com.logix.laad.graph;

import com.logix.laad.types.DummyType;
import com.logix.laad.types.Type;

/**
 * A port of one vertex. The declared type comes from the template and may mention
 * template parameters; the resolved type is filled in by type inference (or by the
 * desugaring pass for the vertices it creates).
 */
public final class Port {
    private final String name;
    private final Direction direction;
    private final PortKind kind;
    private final boolean required;
    private Type declaredType;
    private Type type;

    public Port(String name, Direction direction, PortKind kind, Type declaredType, boolean required) {
        this.name = name;
        this.direction = direction;
        this.kind = kind;
        this.declaredType = declaredType;
        this.required = required;
    }

    public String name() {
        return name;
    }

    public Direction direction() {
        return direction;
    }

    public PortKind kind() {
        return kind;
    }

    public boolean isInput() {
        return direction == Direction.IN;
    }

    public boolean isImpulse() {
        return kind == PortKind.IMPULSE;
    }

    public boolean isRequired() {
        return required;
    }

    /** Dummy ports and impulse inputs accept any number of incoming edges. */
    public boolean acceptsManyEdges() {
        return isImpulse() || isDummy();
    }

    public boolean isDummy() {
        return declaredType == DummyType.INSTANCE;
    }

    public Type declaredType() {
        return declaredType;
    }

    public void setDeclaredType(Type declaredType) {
        this.declaredType = declaredType;
    }

    /** Resolved type, or {@code null} for impulse ports and before inference. */
    public Type type() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    @Override
    public String toString() {
        return direction.label() + " " + name + ": " + (kind == PortKind.IMPULSE ? "impulse" : declaredType);
    }
}
