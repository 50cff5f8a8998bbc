package com.logix.laad.graph;

public enum Direction {
    IN,
    OUT;

    public String label() {
        return this == IN ? "in" : "out";
    }
}
