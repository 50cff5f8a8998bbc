package com.logix.laad.types;

/** Explicit cast viability. Anything not listed here is rejected at compile time. */
public final class Coercions {
    private Coercions() {
    }

    /**
     * Permitted casts: identity, numeric to numeric, {@code char} to and from integral
     * types, anything to {@code string} and {@code null} to any reference type.
     */
    public static boolean canCast(Type from, Type to) {
        from = Types.resolve(from);
        to = Types.resolve(to);
        if (from.equals(to))
            return true;
        if (to == PrimitiveType.STRING)
            return true;
        if (from == NullType.INSTANCE)
            return TypeLattice.isReference(to);
        if (from instanceof PrimitiveType f && to instanceof PrimitiveType t) {
            if (f.isNumeric() && t.isNumeric())
                return true;
            return (f == PrimitiveType.CHAR && t.category() == Category.INTEGRAL)
                    || (t == PrimitiveType.CHAR && f.category() == Category.INTEGRAL);
        }
        return false;
    }
}
