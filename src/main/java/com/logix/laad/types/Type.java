package com.logix.laad.types;

/**
 * A LaaD type term.
 *
 * <p>
 * Concrete types report a {@link Category}; unification variables and template
 * parameters report {@code null}. {@link #toString()} is the rendering used in
 * diagnostics and in emitted LNJ.
 */
public interface Type {

    default Category category() {
        return null;
    }
}
