package com.logix.laad.graph;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Adjacency -- CSR-encoded snapshot of the graph's successor relation.
 *
 * <p>
 * Built once per pass from the flat edge table so traversals do not rescan every
 * edge per vertex. Indices are vertex ids; a removed vertex simply has no children.
 * Unlike a topological order the snapshot tolerates cycles, which loop lowering
 * creates on purpose.
 *
 * <p>
 * Data layout:
 * <ul>
 * <li>{@code childrenOffset[v]} .. {@code childrenOffset[v + 1]} (exclusive) is the
 * slice of {@code childrenList} holding the successors of {@code v}, in edge order,
 * one entry per edge.</li>
 * <li>{@code parentCount[v]} is the number of edges ending at {@code v}.</li>
 * </ul>
 */
@Log4j2
public final class Adjacency {
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;

    private Adjacency(int[] childrenOffset, int[] childrenList, int[] parentCount) {
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
    }

    /** Snapshots every edge of {@code graph}, impulse and data alike. */
    public static Adjacency of(Graph graph) {
        Builder b = builder(graph.capacity());
        for (Edge e : graph.edges())
            b.addEdge(e.srcVertex(), e.dstVertex());
        return b.build();
    }

    public int size() {
        return parentCount.length;
    }

    public int childCount(int v) {
        return childrenOffset[v + 1] - childrenOffset[v];
    }

    public int child(int v, int i) {
        return childrenList[childrenOffset[v] + i];
    }

    public int parentCount(int v) {
        return parentCount[v];
    }

    /** Every vertex reachable from {@code seeds} along edge direction, seeds included. */
    public BitSet reachableFrom(BitSet seeds) {
        BitSet seen = (BitSet) seeds.clone();
        int[] stack = new int[size()];
        int top = 0;
        for (int s = seeds.nextSetBit(0); s >= 0; s = seeds.nextSetBit(s + 1))
            stack[top++] = s;
        while (top > 0) {
            int v = stack[--top];
            for (int i = childrenOffset[v], end = childrenOffset[v + 1]; i < end; i++) {
                int c = childrenList[i];
                if (!seen.get(c)) {
                    seen.set(c);
                    stack[top++] = c;
                }
            }
        }
        log.debug("Reached {} of {} slots from {} seeds", seen.cardinality(), size(), seeds.cardinality());
        return seen;
    }

    public static Builder builder(int size) {
        return new Builder(size);
    }

    public static final class Builder {
        private final int size;
        private final List<int[]> pairs = new ArrayList<>();

        private Builder(int size) {
            this.size = size;
        }

        public Builder addEdge(int from, int to) {
            if (from < 0 || from >= size || to < 0 || to >= size)
                throw new IllegalArgumentException("Edge out of range: " + from + " -> " + to);
            pairs.add(new int[] { from, to });
            return this;
        }

        public Adjacency build() {
            int[] offsets = new int[size + 1];
            int[] parents = new int[size];
            for (int[] p : pairs) {
                offsets[p[0] + 1]++;
                parents[p[1]]++;
            }
            for (int v = 0; v < size; v++)
                offsets[v + 1] += offsets[v];

            int[] fill = new int[size];
            int[] flat = new int[pairs.size()];
            for (int[] p : pairs)
                flat[offsets[p[0]] + fill[p[0]]++] = p[1];
            return new Adjacency(offsets, flat, parents);
        }
    }
}
