package com.logix.laad.graph;

import com.logix.laad.dsl.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node instance in the graph.
 *
 * <p>
 * Synthetic vertices are introduced by the compiler (literals, operators, lowered
 * control flow) and have names starting with {@code __}. A synthetic vertex that a
 * definition such as {@code x = 5} names directly takes over the user's name.
 */
public final class Vertex {
    private final int id;
    private final String template;
    private final Map<String, Port> ports = new LinkedHashMap<>();
    private final List<Attribute> attributes = new ArrayList<>();
    private final SourceSpan span;
    private String name;
    private boolean synthetic;
    private LiteralValue literal;

    Vertex(int id, String name, String template, List<Port> ports, SourceSpan span, boolean synthetic) {
        this.id = id;
        this.name = name;
        this.template = template;
        this.span = span;
        this.synthetic = synthetic;
        for (Port p : ports)
            if (this.ports.put(p.name(), p) != null)
                throw new IllegalArgumentException("Duplicate port '" + p.name() + "' on " + template);
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String template() {
        return template;
    }

    public SourceSpan span() {
        return span;
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    /** Gives a synthetic vertex the name of the definition that binds it. */
    public void adoptName(String userName) {
        this.name = userName;
        this.synthetic = false;
    }

    public List<Port> ports() {
        return List.copyOf(ports.values());
    }

    /** Returns the named port or {@code null}. */
    public Port port(String portName) {
        return ports.get(portName);
    }

    public Port requirePort(String portName) {
        Port p = ports.get(portName);
        if (p == null)
            throw new IllegalArgumentException("Vertex " + name + " (" + template + ") has no port '" + portName + "'");
        return p;
    }

    public boolean hasInputs() {
        for (Port p : ports.values())
            if (p.isInput())
                return true;
        return false;
    }

    public List<Attribute> attributes() {
        return Collections.unmodifiableList(attributes);
    }

    public void addAttribute(Attribute attribute) {
        attributes.add(attribute);
    }

    public boolean hasAttribute(String key) {
        for (Attribute a : attributes)
            if (a.key().equals(key))
                return true;
        return false;
    }

    public LiteralValue literal() {
        return literal;
    }

    public void setLiteral(LiteralValue literal) {
        this.literal = literal;
    }

    @Override
    public String toString() {
        return name + "#" + id + " (" + template + ")";
    }
}
