package com.logix.laad.graph;

import java.util.List;

/**
 * Side-table entry for a {@code sugar.if} vertex.
 *
 * <p>
 * The vertex has ports {@code cond0..condN}, {@code branch0..branchN}, {@code else},
 * {@code trigger}, {@code after} and {@code result}. Whether it lowers to a value
 * ({@link Mode#EXPRESSION}) or to flow branching ({@link Mode#STATEMENT}) is decided
 * by type inference.
 */
public final class IfSite implements SugarSite {

    public enum Mode {
        UNDECIDED,
        EXPRESSION,
        STATEMENT
    }

    private final int vertex;
    private final List<Fragment> branches;
    private final Fragment elseBranch;
    private final boolean valueCandidate;
    private Mode mode;

    public IfSite(int vertex, List<Fragment> branches, Fragment elseBranch, boolean valueCandidate) {
        this.vertex = vertex;
        this.branches = List.copyOf(branches);
        this.elseBranch = elseBranch;
        this.valueCandidate = valueCandidate;
        this.mode = valueCandidate ? Mode.UNDECIDED : Mode.STATEMENT;
    }

    @Override
    public int vertex() {
        return vertex;
    }

    public List<Fragment> branches() {
        return branches;
    }

    /** The {@code else} fragment, or {@code null}. */
    public Fragment elseBranch() {
        return elseBranch;
    }

    /** True when every branch, including {@code else}, produces a value. */
    public boolean isValueCandidate() {
        return valueCandidate;
    }

    public int levels() {
        return branches.size();
    }

    public Mode mode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public static String conditionPort(int level) {
        return "cond" + level;
    }

    public static String branchPort(int level) {
        return "branch" + level;
    }
}
