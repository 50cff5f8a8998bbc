package com.logix.laad.passes;

import com.logix.laad.graph.Attribute;
import com.logix.laad.graph.Vertex;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps attribute keys to {@link AttributeHook}s. Keys without a hook are kept on
 * their vertex as opaque metadata and emitted unchanged.
 */
public final class AttributeRegistry {
    public static final String NO_REMOVE = "no_remove";
    public static final String NULLABLE = "nullable";

    private final Map<String, AttributeHook> hooks = new LinkedHashMap<>();

    /** Registry with the compiler's own keys: {@code no_remove} and {@code nullable}. */
    public static AttributeRegistry standard() {
        AttributeRegistry r = new AttributeRegistry();
        r.register(new AttributeHook() {
            @Override
            public String key() {
                return NO_REMOVE;
            }

            @Override
            public boolean retains(Vertex vertex, Attribute attribute) {
                return true;
            }
        });
        r.register(new AttributeHook() {
            @Override
            public String key() {
                return NULLABLE;
            }

            @Override
            public boolean acceptsNull(Vertex vertex, Attribute attribute) {
                return true;
            }
        });
        return r;
    }

    public AttributeRegistry register(AttributeHook hook) {
        if (hooks.putIfAbsent(hook.key(), hook) != null)
            throw new IllegalArgumentException("Hook already registered for #[" + hook.key() + "]");
        return this;
    }

    public boolean retains(Vertex vertex) {
        for (Attribute a : vertex.attributes()) {
            AttributeHook h = hooks.get(a.key());
            if (h != null && h.retains(vertex, a))
                return true;
        }
        return false;
    }

    public boolean acceptsNull(Vertex vertex) {
        for (Attribute a : vertex.attributes()) {
            AttributeHook h = hooks.get(a.key());
            if (h != null && h.acceptsNull(vertex, a))
                return true;
        }
        return false;
    }
}
