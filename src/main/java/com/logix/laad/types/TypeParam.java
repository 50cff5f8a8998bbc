package com.logix.laad.types;

/**
 * Generic parameter of a node template, e.g. the {@code T} of
 * {@code logix.operators.add}. Each vertex gets its own instantiation.
 */
public record TypeParam(String name, TypeClass constraint) implements Type {

    @Override
    public String toString() {
        return name;
    }
}
