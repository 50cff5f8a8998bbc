package com.logix.laad.dsl;

/**
 * Location of a token or syntax element in the source text.
 *
 * <p>
 * Lines and columns are 1-based, {@code offset} is the 0-based character index.
 */
public record SourceSpan(int line, int column, int offset, int length) {

    /** Returns the smallest span covering both {@code this} and {@code other}. */
    public SourceSpan to(SourceSpan other) {
        if (other == null)
            return this;
        int end = Math.max(offset + length, other.offset + other.length);
        return new SourceSpan(line, column, offset, end - offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
