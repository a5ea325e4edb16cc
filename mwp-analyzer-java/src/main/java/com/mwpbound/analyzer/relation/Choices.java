package com.mwpbound.analyzer.relation;

import com.mwpbound.analyzer.semiring.Delta;
import com.mwpbound.analyzer.semiring.Monomial;

import java.util.*;

/**
 * The derivation choices that avoid every infinite flow.
 *
 * A choice vector has one entry per choice point: the sorted list of rule variants allowed at
 * that point. A concrete choice (one variant per point) is valid if some vector admits it.
 * The vectors are kept minimal: no vector is contained element-wise in another.
 */
public class Choices {

    private final List<List<List<Integer>>> valid;

    private Choices(List<List<List<Integer>>> valid) {
        this.valid = valid;
    }

    /**
     * Computes the valid choice vectors over {@code index} choice points.
     *
     * @param domain   rule variants available at each choice point
     * @param index    number of choice points
     * @param infinity choice sequences that lead to an infinite flow
     */
    public static Choices generate(List<Integer> domain, int index, Collection<List<Delta>> infinity) {
        List<Integer> values = List.copyOf(new TreeSet<>(domain));
        List<List<Integer>> full = new ArrayList<>(index);
        for (int k = 0; k < index; k++) full.add(values);

        List<List<Delta>> paths = simplify(values, infinity);
        Set<List<List<Integer>>> vectors = new LinkedHashSet<>();
        vectors.add(List.copyOf(full));
        for (List<Delta> path : paths) {
            Set<List<List<Integer>>> next = new LinkedHashSet<>();
            for (List<List<Integer>> vector : vectors) {
                if (!admits(vector, path)) {
                    next.add(vector);
                    continue;
                }
                for (Delta d : path) {
                    List<Integer> allowed = new ArrayList<>(vector.get(d.index()));
                    allowed.remove(Integer.valueOf(d.value()));
                    if (allowed.isEmpty()) continue;
                    List<List<Integer>> split = new ArrayList<>(vector);
                    split.set(d.index(), List.copyOf(allowed));
                    next.add(List.copyOf(split));
                }
            }
            vectors = next;
            if (vectors.isEmpty()) break;
        }
        return new Choices(minimize(vectors));
    }

    /**
     * Intersects several choice sets: the concrete choices valid in all of them.
     */
    public static Choices reduce(Choices... choices) {
        return reduce(Arrays.asList(choices));
    }

    public static Choices reduce(Collection<Choices> choices) {
        if (choices.isEmpty()) {
            throw new IllegalArgumentException("Nothing to reduce");
        }
        Iterator<Choices> it = choices.iterator();
        Collection<List<List<Integer>>> current = it.next().valid;
        while (it.hasNext()) {
            Choices other = it.next();
            Set<List<List<Integer>>> next = new LinkedHashSet<>();
            for (List<List<Integer>> a : current) {
                for (List<List<Integer>> b : other.valid) {
                    List<List<Integer>> meet = intersect(a, b);
                    if (meet != null) next.add(meet);
                }
            }
            current = next;
        }
        return new Choices(minimize(current));
    }

    public boolean isInfinite() {
        return valid.isEmpty();
    }

    public List<List<List<Integer>>> valid() {
        return Collections.unmodifiableList(valid);
    }

    /**
     * The first valid concrete choice: the smallest allowed variant at each point of the first vector.
     */
    public int[] first() {
        if (valid.isEmpty()) {
            throw new IllegalStateException("No valid choice: every derivation is infinite");
        }
        List<List<Integer>> vector = valid.get(0);
        int[] choice = new int[vector.size()];
        for (int k = 0; k < choice.length; k++) {
            choice[k] = vector.get(k).get(0);
        }
        return choice;
    }

    public boolean isValid(int... choice) {
        for (List<List<Integer>> vector : valid) {
            if (vector.size() != choice.length) continue;
            boolean ok = true;
            for (int k = 0; k < choice.length && ok; k++) {
                ok = vector.get(k).contains(choice[k]);
            }
            if (ok) return true;
        }
        return false;
    }

    // Drops paths that contain a shorter path and fuses paths covering a full domain at one index.
    private static List<List<Delta>> simplify(List<Integer> domain, Collection<List<Delta>> infinity) {
        DeltaGraph graph = new DeltaGraph(domain);
        for (List<Delta> path : infinity) graph.insert(path);
        graph.fusion();
        List<List<Delta>> paths = new ArrayList<>(graph.sequences());
        paths.sort(Comparator.<List<Delta>>comparingInt(List::size).thenComparing(Monomial::compareDeltas));
        return paths;
    }

    private static boolean admits(List<List<Integer>> vector, List<Delta> path) {
        for (Delta d : path) {
            if (d.index() >= vector.size()) {
                throw new IllegalArgumentException("Choice index " + d.index()
                        + " outside of " + vector.size() + " choice points");
            }
            if (!vector.get(d.index()).contains(d.value())) return false;
        }
        return true;
    }

    private static List<List<Integer>> intersect(List<List<Integer>> a, List<List<Integer>> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("Choice vectors of different length: " + a + ", " + b);
        }
        List<List<Integer>> meet = new ArrayList<>(a.size());
        for (int k = 0; k < a.size(); k++) {
            List<Integer> common = new ArrayList<>(a.get(k));
            common.retainAll(b.get(k));
            if (common.isEmpty()) return null;
            meet.add(List.copyOf(common));
        }
        return List.copyOf(meet);
    }

    private static boolean contains(List<List<Integer>> outer, List<List<Integer>> inner) {
        for (int k = 0; k < outer.size(); k++) {
            if (!outer.get(k).containsAll(inner.get(k))) return false;
        }
        return true;
    }

    private static List<List<List<Integer>>> minimize(Collection<List<List<Integer>>> vectors) {
        List<List<List<Integer>>> candidates = new ArrayList<>(new LinkedHashSet<>(vectors));
        List<List<List<Integer>>> result = new ArrayList<>();
        for (List<List<Integer>> v : candidates) {
            boolean redundant = false;
            for (List<List<Integer>> w : candidates) {
                if (w != v && !w.equals(v) && contains(w, v)) {
                    redundant = true;
                    break;
                }
            }
            if (!redundant) result.add(v);
        }
        return result;
    }

    @Override
    public String toString() {
        return isInfinite() ? "Choices[infinite]" : "Choices" + valid;
    }
}
