package com.mwpbound.analyzer.relation;

import com.mwpbound.analyzer.semiring.Delta;
import com.mwpbound.analyzer.semiring.Monomial;

import java.util.*;

/**
 * Records the choice sequences known to lead to an infinite flow.
 *
 * A recorded sequence stands for every derivation that makes all of its choices. Sequences
 * that agree everywhere except at one index, and together cover the whole domain there, are
 * fused into the shorter sequence. Once the empty sequence is recorded every derivation is
 * infinite.
 */
public class DeltaGraph {

    private final Set<Integer> domain;
    private final Set<List<Delta>> sequences = new TreeSet<>(Monomial::compareDeltas);

    public DeltaGraph(Collection<Integer> domain) {
        if (domain.isEmpty()) {
            throw new IllegalArgumentException("Choice domain must not be empty");
        }
        this.domain = Set.copyOf(domain);
    }

    public void insert(Monomial monomial) {
        insert(monomial.deltas());
    }

    public void insert(List<Delta> deltas) {
        List<Delta> sequence = new ArrayList<>(deltas);
        Collections.sort(sequence);
        for (List<Delta> existing : sequences) {
            if (sequence.containsAll(existing)) return;
        }
        sequences.removeIf(existing -> existing.containsAll(sequence));
        sequences.add(List.copyOf(sequence));
    }

    /**
     * Fuses sequences until no further fusion applies.
     */
    public void fusion() {
        boolean changed = true;
        while (changed) {
            changed = false;
            // (sequence without the delta at some index, that index) -> values seen there
            Map<List<Delta>, Map<Integer, Set<Integer>>> seen = new TreeMap<>(Monomial::compareDeltas);
            for (List<Delta> sequence : sequences) {
                for (Delta d : sequence) {
                    List<Delta> rest = new ArrayList<>(sequence);
                    rest.remove(d);
                    seen.computeIfAbsent(rest, k -> new HashMap<>())
                        .computeIfAbsent(d.index(), k -> new HashSet<>())
                        .add(d.value());
                }
            }
            for (Map.Entry<List<Delta>, Map<Integer, Set<Integer>>> entry : seen.entrySet()) {
                for (Set<Integer> values : entry.getValue().values()) {
                    if (values.containsAll(domain)) {
                        insert(entry.getKey());
                        changed = true;
                        break;
                    }
                }
                if (changed) break;
            }
        }
    }

    /** True once every derivation is known to be infinite. */
    public boolean isFull() {
        return sequences.contains(List.of());
    }

    public boolean isEmpty() {
        return sequences.isEmpty();
    }

    public Set<List<Delta>> sequences() {
        return Collections.unmodifiableSet(sequences);
    }

    public int size() {
        return sequences.size();
    }

    @Override
    public String toString() {
        return "DeltaGraph" + sequences;
    }
}
