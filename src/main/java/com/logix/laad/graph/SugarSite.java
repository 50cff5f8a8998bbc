package com.logix.laad.graph;

/**
 * Side-table entry for a {@code sugar.*} vertex: the fragments its lowering needs
 * that are not visible from the vertex's own ports.
 */
public interface SugarSite {

    int vertex();

    /** {@code while (cond) { body }}. */
    record WhileSite(int vertex, Fragment body) implements SugarSite {
    }

    /** {@code for (i in from..to) { body }}; {@code variable} is the induction variable vertex. */
    record RangeForSite(int vertex, int variable, Fragment body) implements SugarSite {
    }

    /** {@code for (start, cond, step) { body }}. */
    record GenericForSite(int vertex, Fragment start, Fragment step, Fragment body) implements SugarSite {
    }
}
