package com.mwpbound.analyzer.relation;

import com.mwpbound.analyzer.semiring.Scalar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The mwp-bound of one variable: {@code max(x, poly1(z)) + poly2(y)} where x are the inputs
 * flowing with m, y those flowing with w and z those flowing with p.
 */
public final class Bound {

    private final List<String> x;
    private final List<String> y;
    private final List<String> z;

    public Bound(List<String> x, List<String> y, List<String> z) {
        this.x = List.copyOf(x);
        this.y = List.copyOf(y);
        this.z = List.copyOf(z);
    }

    /**
     * Bounds of every variable of {@code relation}, keyed by variable in relation order.
     *
     * @throws IllegalStateException if some flow of the relation is infinite
     */
    public static Map<String, Bound> of(SimpleRelation relation) {
        Map<String, Bound> bounds = new LinkedHashMap<>();
        for (String v : relation.variables()) bounds.put(v, of(relation, v));
        return bounds;
    }

    /**
     * Bound of a single variable of {@code relation}.
     *
     * @throws IllegalStateException if a flow into {@code variable} is infinite
     */
    public static Bound of(SimpleRelation relation, String variable) {
        List<String> vars = relation.variables();
        int j = relation.indexOf(variable);
        List<String> x = new ArrayList<>();
        List<String> y = new ArrayList<>();
        List<String> z = new ArrayList<>();
        for (int i = 0; i < vars.size(); i++) {
            Scalar s = relation.get(i, j);
            switch (s) {
                case M -> x.add(vars.get(i));
                case W -> y.add(vars.get(i));
                case P -> z.add(vars.get(i));
                case INFINITY -> throw new IllegalStateException(
                        "Infinite flow " + vars.get(i) + " -> " + variable + " under the chosen derivation");
                default -> { }
            }
        }
        return new Bound(x, y, z);
    }

    public List<String> maxVariables() { return Collections.unmodifiableList(x); }
    public List<String> weakVariables() { return Collections.unmodifiableList(y); }
    public List<String> polyVariables() { return Collections.unmodifiableList(z); }

    public boolean isZero() {
        return x.isEmpty() && y.isEmpty() && z.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bound)) return false;
        Bound other = (Bound) o;
        return x.equals(other.x) && y.equals(other.y) && z.equals(other.z);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * x.hashCode() + y.hashCode()) + z.hashCode();
    }

    @Override
    public String toString() {
        List<String> maxTerms = new ArrayList<>(x);
        if (!z.isEmpty()) maxTerms.add(String.join("*", z));
        String maxPart = maxTerms.size() > 1
                ? "max(" + String.join(",", maxTerms) + ")"
                : String.join("", maxTerms);
        String weakPart = String.join("+", y);

        if (maxPart.isEmpty() && weakPart.isEmpty()) return "0";
        if (maxPart.isEmpty()) return weakPart;
        if (weakPart.isEmpty()) return maxPart;
        return maxPart + "+" + weakPart;
    }
}
