package com.logix.laad.types;

import java.util.HashMap;
import java.util.Map;

/** Built-in value types with their widening parents in the type lattice. */
public enum PrimitiveType implements Type {
    SBYTE("sbyte", Category.INTEGRAL, "i8"),
    BYTE("byte", Category.INTEGRAL, "u8"),
    SHORT("short", Category.INTEGRAL, "i16"),
    USHORT("ushort", Category.INTEGRAL, "u16"),
    INT("int", Category.INTEGRAL, "i32"),
    UINT("uint", Category.INTEGRAL, "u32"),
    LONG("long", Category.INTEGRAL, "i64"),
    ULONG("ulong", Category.INTEGRAL, "u64"),
    FLOAT("float", Category.FRACTIONAL, "f32"),
    DOUBLE("double", Category.FRACTIONAL, "f64"),
    DECIMAL("decimal", Category.FRACTIONAL, null),
    BOOL("bool", Category.BOOLEAN, null),
    STRING("string", Category.STRING, null),
    CHAR("char", Category.CHAR, null),
    COLOR("color", Category.OTHER, null),
    DATETIME("datetime", Category.OTHER, null);

    private static final Map<String, PrimitiveType> BY_NAME = new HashMap<>();

    static {
        for (PrimitiveType t : values()) {
            BY_NAME.put(t.keyword, t);
            if (t.alias != null)
                BY_NAME.put(t.alias, t);
        }
    }

    private final String keyword;
    private final Category category;
    private final String alias;

    PrimitiveType(String keyword, Category category, String alias) {
        this.keyword = keyword;
        this.category = category;
        this.alias = alias;
    }

    /** Looks up a type keyword or its sized alias ({@code i32}, {@code f64}, ...). */
    public static PrimitiveType byName(String name) {
        return BY_NAME.get(name);
    }

    @Override
    public Category category() {
        return category;
    }

    public boolean isNumeric() {
        return category == Category.INTEGRAL || category == Category.FRACTIONAL;
    }

    /** Whether an integer constant is representable; always true for non-integral types. */
    public boolean fits(long value) {
        return switch (this) {
            case SBYTE -> value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE;
            case BYTE -> value >= 0 && value <= 0xFF;
            case SHORT -> value >= Short.MIN_VALUE && value <= Short.MAX_VALUE;
            case USHORT -> value >= 0 && value <= 0xFFFF;
            case INT -> value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
            case UINT -> value >= 0 && value <= 0xFFFFFFFFL;
            case ULONG -> value >= 0;
            default -> true;
        };
    }

    /** Immediate supertype; {@link TopType} for the roots of each chain. */
    public Type parent() {
        return switch (this) {
            case SBYTE, BYTE -> SHORT;
            case SHORT, USHORT -> INT;
            case INT, UINT -> LONG;
            case LONG, ULONG -> FLOAT;
            case FLOAT -> DOUBLE;
            default -> TopType.INSTANCE;
        };
    }

    @Override
    public String toString() {
        return keyword;
    }
}
