package com.mwpbound.analyzer.relation;

import com.mwpbound.analyzer.semiring.Polynomial;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * The alternative relations of a derivation, without duplicates.
 *
 * An empty relation list holds a single relation over no variables, which behaves as the
 * identity under composition and sum.
 */
public class RelationList {

    private List<Relation> relations;

    public RelationList(List<Relation> relations) {
        if (relations.isEmpty()) {
            throw new IllegalArgumentException("A relation list holds at least one relation");
        }
        this.relations = distinct(relations);
    }

    public static RelationList empty() {
        return new RelationList(List.of(new Relation(List.of())));
    }

    public static RelationList identity(List<String> variables) {
        return new RelationList(List.of(Relation.identity(variables)));
    }

    public static RelationList of(Relation... relations) {
        return new RelationList(List.of(relations));
    }

    public List<Relation> relations() { return List.copyOf(relations); }

    public Relation first() { return relations.get(0); }

    public int size() { return relations.size(); }

    /** Composes every relation of this list with every relation of {@code other}, in place. */
    public void composition(RelationList other) {
        List<Relation> next = new ArrayList<>(relations.size() * other.relations.size());
        for (Relation r1 : relations) {
            for (Relation r2 : other.relations) {
                next.add(r1.composition(r2));
            }
        }
        relations = distinct(next);
    }

    /** Pairwise join of two relation lists. */
    public RelationList sum(RelationList other) {
        List<Relation> sums = new ArrayList<>(relations.size() * other.relations.size());
        for (Relation r1 : relations) {
            for (Relation r2 : other.relations) {
                sums.add(r1.sum(r2));
            }
        }
        return new RelationList(sums);
    }

    public void replaceColumn(List<Polynomial> vector, String variable) {
        apply(r -> r.replaceColumn(vector, variable));
    }

    public void fixpoint() {
        apply(Relation::fixpoint);
    }

    public void whileCorrection(DeltaGraph graph) {
        apply(r -> r.whileCorrection(graph));
    }

    public void loopCorrection(String x, DeltaGraph graph) {
        apply(r -> r.loopCorrection(x, graph));
    }

    private void apply(UnaryOperator<Relation> op) {
        List<Relation> next = new ArrayList<>(relations.size());
        for (Relation r : relations) next.add(op.apply(r));
        relations = distinct(next);
    }

    private static List<Relation> distinct(List<Relation> input) {
        List<Relation> out = new ArrayList<>(input.size());
        for (Relation r : input) {
            if (!out.contains(r)) out.add(r);
        }
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < relations.size(); k++) {
            sb.append(k + 1).append(":\n").append(relations.get(k));
        }
        return sb.toString();
    }
}
