package com.logix.laad.types;

import java.util.Map;

/** Static helpers over type terms. */
public final class Types {
    private Types() {
    }

    /** Follows variable links to the representative, compressing the path. */
    public static Type deref(Type t) {
        if (!(t instanceof TypeVar v) || v.ref == null)
            return t;
        Type end = deref(v.ref);
        v.ref = end;
        return end;
    }

    /** Deep resolution: dereferences nested type arguments too. */
    public static Type resolve(Type t) {
        t = deref(t);
        if (t instanceof RefIdType r) {
            Type target = resolve(r.target());
            return target == r.target() ? r : new RefIdType(target);
        }
        return t;
    }

    public static boolean isGround(Type t) {
        t = deref(t);
        if (t instanceof TypeVar || t instanceof TypeParam)
            return false;
        return !(t instanceof RefIdType r) || isGround(r.target());
    }

    /** Replaces template parameters by their bindings; unknown parameters stay as they are. */
    public static Type substitute(Type declared, Map<String, ? extends Type> bindings) {
        if (declared instanceof TypeParam p) {
            Type bound = bindings.get(p.name());
            return bound != null ? bound : p;
        }
        if (declared instanceof RefIdType r)
            return new RefIdType(substitute(r.target(), bindings));
        return declared;
    }

    /**
     * Resolves a written type name. Returns {@code null} for names that denote no type;
     * {@code impulse} is not a type and is handled by port declarations.
     */
    public static Type fromName(String name, Type argument) {
        if (name.equals("ref"))
            return argument == null ? null : new RefIdType(argument);
        if (argument != null)
            return null;
        switch (name) {
            case "object":
                return TopType.INSTANCE;
            case "dummy":
                return DummyType.INSTANCE;
            case "null":
                return NullType.INSTANCE;
            default:
                break;
        }
        PrimitiveType p = PrimitiveType.byName(name);
        if (p != null)
            return p;
        if (Character.isUpperCase(name.charAt(0)))
            return new ObjectRefType(name);
        return null;
    }
}
