package com.mwpbound.analyzer.semiring;

/**
 * Values of the mwp semiring, ordered 0 &lt; m &lt; w &lt; p &lt; ∞.
 *
 * Sum is the maximum. Product is the maximum too, except that 0 absorbs
 * every value (∞ included), which also makes m the unit.
 */
public enum Scalar {
    ZERO("0"),
    M("m"),
    W("w"),
    P("p"),
    INFINITY("i");

    private final String symbol;

    Scalar(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() { return symbol; }

    public Scalar sum(Scalar other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public Scalar times(Scalar other) {
        if (this == ZERO || other == ZERO) return ZERO;
        return sum(other);
    }

    public boolean isAtLeast(Scalar other) {
        return compareTo(other) >= 0;
    }

    public static Scalar fromSymbol(String symbol) {
        for (Scalar s : values()) {
            if (s.symbol.equals(symbol)) return s;
        }
        if ("∞".equals(symbol)) return INFINITY;
        throw new IllegalArgumentException("Not an mwp scalar: " + symbol);
    }

    @Override
    public String toString() { return symbol; }
}
