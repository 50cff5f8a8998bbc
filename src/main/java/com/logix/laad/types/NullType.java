package com.logix.laad.types;

/** Type of the {@code null} literal; a subtype of every reference type. */
public enum NullType implements Type {
    INSTANCE;

    @Override
    public Category category() {
        return Category.NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
