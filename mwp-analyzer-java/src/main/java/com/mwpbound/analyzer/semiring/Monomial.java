package com.mwpbound.analyzer.semiring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A scalar guarded by a product of deltas, e.g. {@code w.delta(0,1).delta(2,3)}.
 * Immutable. Deltas are kept sorted by index with at most one delta per index.
 */
public final class Monomial {

    public static final Monomial ZERO = new Monomial(Scalar.ZERO, List.of());

    private final Scalar scalar;
    private final List<Delta> deltas;

    public Monomial(Scalar scalar) {
        this(scalar, List.of());
    }

    public Monomial(Scalar scalar, List<Delta> deltas) {
        this.scalar = Objects.requireNonNull(scalar, "scalar");
        List<Delta> sorted = new ArrayList<>(deltas);
        Collections.sort(sorted);
        for (int k = 1; k < sorted.size(); k++) {
            if (sorted.get(k - 1).index() == sorted.get(k).index()) {
                throw new IllegalArgumentException("Two deltas share index "
                        + sorted.get(k).index() + ": " + deltas);
            }
        }
        this.deltas = Collections.unmodifiableList(sorted);
    }

    public static Monomial of(Scalar scalar, Delta... deltas) {
        return new Monomial(scalar, List.of(deltas));
    }

    public Scalar scalar() { return scalar; }
    public List<Delta> deltas() { return deltas; }

    public boolean isZero() { return scalar == Scalar.ZERO; }

    public Monomial withScalar(Scalar newScalar) {
        return newScalar == scalar ? this : new Monomial(newScalar, deltas);
    }

    /**
     * Product of two monomials. Conflicting choices at the same index cancel the product.
     */
    public Monomial times(Monomial other) {
        Scalar product = scalar.times(other.scalar);
        if (product == Scalar.ZERO) return ZERO;

        List<Delta> merged = new ArrayList<>(deltas.size() + other.deltas.size());
        int i = 0;
        int j = 0;
        while (i < deltas.size() && j < other.deltas.size()) {
            Delta a = deltas.get(i);
            Delta b = other.deltas.get(j);
            if (a.index() < b.index()) {
                merged.add(a);
                i++;
            } else if (a.index() > b.index()) {
                merged.add(b);
                j++;
            } else {
                if (a.value() != b.value()) return ZERO;
                merged.add(a);
                i++;
                j++;
            }
        }
        merged.addAll(deltas.subList(i, deltas.size()));
        merged.addAll(other.deltas.subList(j, other.deltas.size()));
        return new Monomial(product, merged);
    }

    /**
     * Value of this monomial under a concrete choice vector.
     */
    public Scalar eval(int[] choice) {
        for (Delta d : deltas) {
            if (d.index() >= choice.length) {
                throw new IllegalArgumentException("Choice vector of length " + choice.length
                        + " does not cover index " + d.index());
            }
            if (choice[d.index()] != d.value()) return Scalar.ZERO;
        }
        return scalar;
    }

    /**
     * True if wherever {@code other} applies this monomial applies too with at least the same scalar,
     * which makes {@code other} redundant in a sum.
     */
    public boolean dominates(Monomial other) {
        return scalar.isAtLeast(other.scalar) && other.deltas.containsAll(deltas);
    }

    /**
     * Lexicographic order on delta lists; a proper prefix comes first.
     */
    public static int compareDeltas(List<Delta> first, List<Delta> second) {
        int common = Math.min(first.size(), second.size());
        for (int k = 0; k < common; k++) {
            int c = first.get(k).compareTo(second.get(k));
            if (c != 0) return c;
        }
        return Integer.compare(first.size(), second.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Monomial)) return false;
        Monomial other = (Monomial) o;
        return scalar == other.scalar && deltas.equals(other.deltas);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scalar, deltas);
    }

    @Override
    public String toString() {
        if (deltas.isEmpty()) return scalar.symbol();
        return scalar.symbol() + "." + deltas.stream().map(Delta::toString).collect(Collectors.joining("."));
    }
}
