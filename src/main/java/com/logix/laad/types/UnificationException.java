package com.logix.laad.types;

/**
 * Raised by {@link Unifier} when two types cannot be made equal. The caller knows
 * which edge or vertex was involved and turns it into a
 * {@link com.logix.laad.error.TypeCheckException}.
 */
public class UnificationException extends Exception {
    private final Type left;
    private final Type right;

    public UnificationException(String message, Type left, Type right) {
        super(message);
        this.left = left;
        this.right = right;
    }

    public Type getLeft() {
        return left;
    }

    public Type getRight() {
        return right;
    }
}
