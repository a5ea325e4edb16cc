package com.mwpbound.analyzer.semiring;

/**
 * A derivation choice: at choice point {@code index} the rule variant {@code value} was taken.
 * Ordered by index first, then by value.
 */
public record Delta(int value, int index) implements Comparable<Delta> {

    public Delta {
        if (value < 0 || index < 0) {
            throw new IllegalArgumentException("Negative delta (" + value + ", " + index + ")");
        }
    }

    @Override
    public int compareTo(Delta other) {
        if (index != other.index) return Integer.compare(index, other.index);
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "delta(" + value + "," + index + ")";
    }
}
