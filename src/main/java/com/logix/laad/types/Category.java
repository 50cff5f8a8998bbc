package com.logix.laad.types;

/** Coarse classification of concrete types, used by {@link TypeClass} constraints. */
public enum Category {
    INTEGRAL,
    FRACTIONAL,
    BOOLEAN,
    STRING,
    CHAR,
    OBJECT,
    REFID,
    NULL,
    OTHER,
    TOP
}
