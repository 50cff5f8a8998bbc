package com.logix.laad.types;

/**
 * Unification variable.
 *
 * <p>
 * A variable is either unbound or linked through {@link #ref} to another type,
 * possibly another variable; {@link Types#resolve} follows the links. Only the
 * representative at the end of a link chain carries a meaningful {@link #constraint}
 * and {@link #fallback}.
 *
 * <p>
 * Variables of different graph components never meet, so each component may be
 * solved on its own thread.
 */
public final class TypeVar implements Type {
    private final int id;
    Type ref;
    TypeClass constraint;
    Type fallback;

    public TypeVar(int id, TypeClass constraint) {
        this.id = id;
        this.constraint = constraint;
    }

    public int id() {
        return id;
    }

    public boolean isBound() {
        return ref != null;
    }

    public TypeClass constraint() {
        return constraint;
    }

    /** Type used when nothing else fixes this variable, e.g. {@code int} for {@code 1}. */
    public Type fallback() {
        return fallback;
    }

    public void setFallback(Type fallback) {
        this.fallback = fallback;
    }

    public void restrict(TypeClass cls) {
        TypeClass merged = constraint.intersect(cls);
        if (merged == null)
            throw new IllegalStateException("Incompatible classes " + constraint + " and " + cls);
        constraint = merged;
    }

    @Override
    public String toString() {
        return "'t" + id;
    }
}
