package com.logix.laad.types;

import java.util.EnumSet;
import java.util.Set;

/**
 * Constraint on the concrete types a variable may be bound to, expressed as the set
 * of admitted {@link Category categories}. Unifying two variables intersects their
 * classes.
 */
public final class TypeClass {
    public static final TypeClass ANY = new TypeClass("any", EnumSet.allOf(Category.class));
    public static final TypeClass NUMERIC = new TypeClass("numeric",
            EnumSet.of(Category.INTEGRAL, Category.FRACTIONAL));
    public static final TypeClass INTEGRAL = new TypeClass("integral", EnumSet.of(Category.INTEGRAL));
    public static final TypeClass FRACTIONAL = new TypeClass("fractional", EnumSet.of(Category.FRACTIONAL));
    public static final TypeClass ADDABLE = new TypeClass("addable",
            EnumSet.of(Category.INTEGRAL, Category.FRACTIONAL, Category.STRING));
    public static final TypeClass COMPARABLE = new TypeClass("comparable",
            EnumSet.of(Category.INTEGRAL, Category.FRACTIONAL, Category.CHAR));
    public static final TypeClass BOOLEAN = new TypeClass("boolean", EnumSet.of(Category.BOOLEAN));
    public static final TypeClass BOOLEAN_OR_INTEGRAL = new TypeClass("boolean or integral",
            EnumSet.of(Category.BOOLEAN, Category.INTEGRAL));
    public static final TypeClass REFERENCE = new TypeClass("reference",
            EnumSet.of(Category.STRING, Category.OBJECT, Category.REFID, Category.NULL));

    private final String name;
    private final Set<Category> categories;

    private TypeClass(String name, Set<Category> categories) {
        this.name = name;
        this.categories = categories;
    }

    public boolean admits(Type concrete) {
        Category c = concrete.category();
        return c != null && categories.contains(c);
    }

    /** Returns the common refinement of both classes, or {@code null} when none exists. */
    public TypeClass intersect(TypeClass other) {
        if (this == other || other == ANY)
            return this;
        if (this == ANY)
            return other;
        EnumSet<Category> common = EnumSet.copyOf(categories);
        common.retainAll(other.categories);
        if (common.isEmpty())
            return null;
        if (common.equals(categories))
            return this;
        if (common.equals(other.categories))
            return other;
        return new TypeClass(name + " & " + other.name, common);
    }

    @Override
    public String toString() {
        return name;
    }
}
