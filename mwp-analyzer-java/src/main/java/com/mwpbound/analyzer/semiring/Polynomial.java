package com.mwpbound.analyzer.semiring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * A sum of monomials in canonical form.
 *
 * Canonical means: no zero monomials, at most one monomial per delta list (scalars of equal
 * delta lists are summed), no monomial dominated by another one, sorted by delta list.
 * The empty polynomial is zero. Instances are immutable.
 */
public final class Polynomial {

    public static final Polynomial ZERO = new Polynomial(List.of());
    public static final Polynomial UNIT = new Polynomial(List.of(new Monomial(Scalar.M)));

    private final List<Monomial> monomials;

    private Polynomial(List<Monomial> canonical) {
        this.monomials = Collections.unmodifiableList(canonical);
    }

    public static Polynomial of(Scalar scalar) {
        return of(List.of(new Monomial(scalar)));
    }

    public static Polynomial of(Monomial... monomials) {
        return of(List.of(monomials));
    }

    public static Polynomial of(Collection<Monomial> monomials) {
        return new Polynomial(normalize(monomials));
    }

    /**
     * Builds {@code s0.delta(0,index) + s1.delta(1,index) + ...}: one monomial per rule variant
     * of the choice point {@code index}.
     */
    public static Polynomial fromScalars(int index, Scalar... scalars) {
        List<Monomial> list = new ArrayList<>(scalars.length);
        for (int value = 0; value < scalars.length; value++) {
            list.add(Monomial.of(scalars[value], new Delta(value, index)));
        }
        return of(list);
    }

    public List<Monomial> monomials() { return monomials; }

    public boolean isZero() { return monomials.isEmpty(); }

    public Polynomial add(Polynomial other) {
        if (other.isZero()) return this;
        if (isZero()) return other;
        List<Monomial> all = new ArrayList<>(monomials.size() + other.monomials.size());
        all.addAll(monomials);
        all.addAll(other.monomials);
        return of(all);
    }

    public Polynomial times(Polynomial other) {
        if (isZero() || other.isZero()) return ZERO;
        if (this.equals(UNIT)) return other;
        if (other.equals(UNIT)) return this;
        List<Monomial> products = new ArrayList<>(monomials.size() * other.monomials.size());
        for (Monomial a : monomials) {
            for (Monomial b : other.monomials) {
                Monomial product = a.times(b);
                if (!product.isZero()) products.add(product);
            }
        }
        return of(products);
    }

    /**
     * Applies {@code fn} to every monomial and re-normalizes.
     */
    public Polynomial map(UnaryOperator<Monomial> fn) {
        if (isZero()) return this;
        return of(monomials.stream().map(fn).collect(Collectors.toList()));
    }

    /**
     * Value of this polynomial under a concrete choice vector.
     */
    public Scalar eval(int[] choice) {
        Scalar result = Scalar.ZERO;
        for (Monomial m : monomials) {
            result = result.sum(m.eval(choice));
            if (result == Scalar.INFINITY) break;
        }
        return result;
    }

    public boolean contains(Scalar scalar) {
        for (Monomial m : monomials) {
            if (m.scalar() == scalar) return true;
        }
        return false;
    }

    static List<Monomial> normalize(Collection<Monomial> input) {
        Map<List<Delta>, Scalar> byDeltas = new TreeMap<>(Monomial::compareDeltas);
        for (Monomial m : input) {
            if (m.isZero()) continue;
            byDeltas.merge(m.deltas(), m.scalar(), Scalar::sum);
        }
        List<Monomial> merged = new ArrayList<>(byDeltas.size());
        for (Map.Entry<List<Delta>, Scalar> e : byDeltas.entrySet()) {
            merged.add(new Monomial(e.getValue(), e.getKey()));
        }
        if (merged.size() < 2) return merged;

        // domination is transitive, so dropping every dominated monomial keeps the maximal ones
        List<Monomial> result = new ArrayList<>(merged.size());
        for (Monomial candidate : merged) {
            boolean dominated = false;
            for (Monomial other : merged) {
                if (other != candidate && other.dominates(candidate)) {
                    dominated = true;
                    break;
                }
            }
            if (!dominated) result.add(candidate);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Polynomial)) return false;
        return monomials.equals(((Polynomial) o).monomials);
    }

    @Override
    public int hashCode() {
        return monomials.hashCode();
    }

    @Override
    public String toString() {
        if (monomials.isEmpty()) return Scalar.ZERO.symbol();
        return monomials.stream().map(Monomial::toString).collect(Collectors.joining("+"));
    }
}
