package com.logix.laad.types;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed subtype lattice used for conditional expressions.
 *
 * <pre>
 *  sbyte, byte -> short -> int -> long -> float -> double -> object
 *  ushort -> int,  uint -> long,  ulong -> float
 *  null -> any reference type
 * </pre>
 *
 * Every other concrete type sits directly below {@code object}.
 */
public final class TypeLattice {
    private TypeLattice() {
    }

    /** Least upper bound of two concrete types; {@link TopType} when they only meet at the root. */
    public static Type lub(Type a, Type b) {
        a = Types.resolve(a);
        b = Types.resolve(b);
        if (a.equals(b))
            return a;
        if (a == NullType.INSTANCE && isReference(b))
            return b;
        if (b == NullType.INSTANCE && isReference(a))
            return a;
        List<Type> chain = ancestors(a);
        for (Type t = b; t != null; t = parent(t))
            if (chain.contains(t))
                return t;
        return TopType.INSTANCE;
    }

    public static Type lub(List<Type> types) {
        Type acc = types.get(0);
        for (int i = 1; i < types.size(); i++)
            acc = lub(acc, types.get(i));
        return acc;
    }

    /** True when {@code sub} widens to {@code sup} along the lattice. */
    public static boolean isSubtype(Type sub, Type sup) {
        return lub(sub, sup).equals(Types.resolve(sup));
    }

    static boolean isReference(Type t) {
        Category c = t.category();
        return c == Category.STRING || c == Category.OBJECT || c == Category.REFID || c == Category.NULL;
    }

    private static Type parent(Type t) {
        if (t instanceof PrimitiveType p)
            return p.parent();
        if (t == TopType.INSTANCE)
            return null;
        return TopType.INSTANCE;
    }

    private static List<Type> ancestors(Type t) {
        List<Type> out = new ArrayList<>();
        for (; t != null; t = parent(t))
            out.add(t);
        return out;
    }
}
