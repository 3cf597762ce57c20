package com.bmg.ir.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class OperatorTest {

    @Test
    public void testSignatureTable() {
        assertSignature(Operator.CONSTANT, Type.REAL);
        assertSignature(Operator.ADD, Type.REAL, Type.REAL, Type.REAL);
        assertSignature(Operator.MULTIPLY, Type.REAL, Type.REAL, Type.REAL);
        assertSignature(Operator.DISTRIBUTION_NORMAL, Type.DISTRIBUTION, Type.REAL, Type.REAL);
        assertSignature(Operator.DISTRIBUTION_BETA, Type.DISTRIBUTION, Type.REAL, Type.REAL);
        assertSignature(Operator.DISTRIBUTION_BERNOULLI, Type.DISTRIBUTION, Type.REAL);
        assertSignature(Operator.SAMPLE, Type.REAL, Type.DISTRIBUTION);
        assertSignature(Operator.OBSERVE, Type.NONE, Type.DISTRIBUTION, Type.REAL);
        assertSignature(Operator.QUERY, Type.NONE, Type.REAL);
    }

    private static void assertSignature(Operator op, Type result, Type... inputs) {
        assertEquals(op.name(), result, op.resultType());
        assertEquals(op.name(), inputs.length, op.arity());
        assertArrayEquals(op.name(), inputs, op.inputTypes());
    }

    @Test
    public void testCountBoundsOrdinals() {
        assertEquals(9, Operator.COUNT);
        for (int i = 0; i < Operator.COUNT; i++)
            assertEquals(i, Operator.values()[i].ordinal());
    }

    @Test
    public void testInputTypesIsACopy() {
        Type[] types = Operator.OBSERVE.inputTypes();
        types[0] = Type.NONE;
        assertEquals(Type.DISTRIBUTION, Operator.OBSERVE.inputType(0));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testInputTypeBeyondArity() {
        Operator.SAMPLE.inputType(1);
    }

    @Test
    public void testDistributions() {
        assertTrue(Operator.DISTRIBUTION_BETA.isDistribution());
        assertFalse(Operator.SAMPLE.isDistribution());
    }

    @Test
    public void testFromString() {
        assertEquals(Operator.DISTRIBUTION_NORMAL, Operator.fromString("distribution_normal"));
        assertEquals(Operator.ADD, Operator.fromString("ADD"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromStringUnknown() {
        Operator.fromString("DIVIDE");
    }
}
