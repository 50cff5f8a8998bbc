package com.logix.laad.types;

/**
 * Marker for a port that is generic per connection. Inference gives every edge
 * endpoint on such a port its own fresh variable, so two connections to the same
 * port never constrain each other.
 */
public enum DummyType implements Type {
    INSTANCE;

    @Override
    public String toString() {
        return "dummy";
    }
}
