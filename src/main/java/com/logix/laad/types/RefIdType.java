package com.logix.laad.types;

/**
 * {@code ref<T>}: an opaque handle to a value of type {@code T}.
 *
 * <p>
 * A handle carries no guarantee that its target still exists and may dangle. It
 * supports no arithmetic and cannot be dereferenced by any operator; only nodes that
 * declare a {@code ref<T>} input (such as {@code logix.actions.write}) consume it.
 */
public record RefIdType(Type target) implements Type {

    @Override
    public Category category() {
        return Category.REFID;
    }

    @Override
    public String toString() {
        return "ref<" + Types.resolve(target) + ">";
    }
}
