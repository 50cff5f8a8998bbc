package com.logix.laad.graph;

/** Data ports carry values; impulse ports carry control flow (happens-before). */
public enum PortKind {
    DATA,
    IMPULSE;

    public String label() {
        return this == DATA ? "data" : "impulse";
    }
}
