package com.logix.laad.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** {@code #[key(name = literal, ...)]} attached to a vertex. */
public record Attribute(String key, Map<String, Object> args) {

    public Attribute {
        // null argument values are allowed
        args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public static Attribute of(String key) {
        return new Attribute(key, Map.of());
    }
}
