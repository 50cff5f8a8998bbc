package com.logix.laad.types;

/** The universal {@code object} type at the root of the lattice. */
public enum TopType implements Type {
    INSTANCE;

    @Override
    public Category category() {
        return Category.TOP;
    }

    @Override
    public String toString() {
        return "object";
    }
}
