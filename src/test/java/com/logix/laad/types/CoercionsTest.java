package com.logix.laad.types;

import org.junit.Test;

import static org.junit.Assert.*;

public class CoercionsTest {

    @Test
    public void testNumericCasts() {
        assertTrue(Coercions.canCast(PrimitiveType.DOUBLE, PrimitiveType.BYTE));
        assertTrue(Coercions.canCast(PrimitiveType.INT, PrimitiveType.DECIMAL));
    }

    @Test
    public void testCharAndIntegral() {
        assertTrue(Coercions.canCast(PrimitiveType.CHAR, PrimitiveType.INT));
        assertTrue(Coercions.canCast(PrimitiveType.USHORT, PrimitiveType.CHAR));
        assertFalse(Coercions.canCast(PrimitiveType.CHAR, PrimitiveType.FLOAT));
    }

    @Test
    public void testAnythingToString() {
        assertTrue(Coercions.canCast(new ObjectRefType("Slot"), PrimitiveType.STRING));
        assertTrue(Coercions.canCast(PrimitiveType.BOOL, PrimitiveType.STRING));
    }

    @Test
    public void testNullToReference() {
        assertTrue(Coercions.canCast(NullType.INSTANCE, new ObjectRefType("User")));
        assertFalse(Coercions.canCast(NullType.INSTANCE, PrimitiveType.INT));
    }

    @Test
    public void testRejected() {
        assertFalse(Coercions.canCast(new ObjectRefType("Slot"), PrimitiveType.INT));
        assertFalse(Coercions.canCast(PrimitiveType.STRING, PrimitiveType.INT));
        assertFalse(Coercions.canCast(PrimitiveType.BOOL, PrimitiveType.INT));
        assertFalse(Coercions.canCast(new RefIdType(PrimitiveType.INT), PrimitiveType.INT));
    }
}
