package com.logix.laad.types;

/** Reference to an engine object class such as {@code Slot} or {@code User}. */
public record ObjectRefType(String className) implements Type {

    @Override
    public Category category() {
        return Category.OBJECT;
    }

    @Override
    public String toString() {
        return className;
    }
}
