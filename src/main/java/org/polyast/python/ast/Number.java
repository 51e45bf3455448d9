package org.polyast.python.ast;

import org.polyast.core.token.Wrap;

import java.math.BigInteger;

/**
 * Numeric literals. Plain integers are 64-bit, {@code long} literals are unbounded and
 * imaginary literals keep their source spelling.
 */
public sealed interface Number {

    record Int(Wrap<Long> value) implements Number {}

    /** Python 2 {@code long} literal such as {@code 10L}. */
    record LongInt(Wrap<BigInteger> value) implements Number {}

    record Float(Wrap<Double> value) implements Number {}

    record Imag(Wrap<String> value) implements Number {}
}
