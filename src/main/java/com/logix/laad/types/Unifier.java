package com.logix.laad.types;

/**
 * First-order unification with an occurs check and class constraints.
 *
 * <p>
 * Binding a variable to a concrete type requires the type to be admitted by the
 * variable's class. Merging two variables intersects their classes and combines
 * their fallbacks: the least upper bound of both when the merged class admits it,
 * otherwise whichever one is still admitted.
 */
public final class Unifier {
    private Unifier() {
    }

    public static void unify(Type a, Type b) throws UnificationException {
        a = Types.deref(a);
        b = Types.deref(b);
        if (a == b)
            return;
        if (a instanceof TypeVar va) {
            if (b instanceof TypeVar vb)
                merge(va, vb);
            else
                bind(va, b);
            return;
        }
        if (b instanceof TypeVar vb) {
            bind(vb, a);
            return;
        }
        if (a instanceof RefIdType ra && b instanceof RefIdType rb) {
            unify(ra.target(), rb.target());
            return;
        }
        if (!a.equals(b))
            throw new UnificationException("Type mismatch", a, b);
    }

    /** Binds {@code var} to {@code type}, which must be concrete or a reference over variables. */
    static void bind(TypeVar var, Type type) throws UnificationException {
        occursCheck(type, var);
        if (!var.constraint.admits(type))
            throw new UnificationException("Type " + Types.resolve(type) + " is not " + var.constraint, var, type);
        var.ref = type;
    }

    private static void merge(TypeVar a, TypeVar b) throws UnificationException {
        TypeClass cls = a.constraint.intersect(b.constraint);
        if (cls == null)
            throw new UnificationException("No type is both " + a.constraint + " and " + b.constraint, a, b);
        b.constraint = cls;
        b.fallback = mergeFallback(a.fallback, b.fallback, cls);
        a.ref = b;
    }

    private static Type mergeFallback(Type x, Type y, TypeClass cls) {
        if (x == null)
            return y != null && cls.admits(y) ? y : null;
        if (y == null)
            return cls.admits(x) ? x : null;
        Type lub = TypeLattice.lub(x, y);
        if (cls.admits(lub))
            return lub;
        if (cls.admits(x))
            return x;
        return cls.admits(y) ? y : null;
    }

    static void occursCheck(Type type, TypeVar var) throws UnificationException {
        type = Types.deref(type);
        if (type == var)
            throw new UnificationException("Cyclic type", var, type);
        if (type instanceof RefIdType r)
            occursCheck(r.target(), var);
    }

    /** Binds an unbound variable to its fallback if it has one. Returns whether it did. */
    public static boolean applyFallback(Type t) throws UnificationException {
        t = Types.deref(t);
        if (t instanceof TypeVar v && v.fallback != null) {
            bind(v, v.fallback);
            return true;
        }
        return false;
    }
}
