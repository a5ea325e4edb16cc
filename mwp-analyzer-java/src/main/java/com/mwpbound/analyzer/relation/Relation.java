package com.mwpbound.analyzer.relation;

import com.mwpbound.analyzer.semiring.Delta;
import com.mwpbound.analyzer.semiring.Monomial;
import com.mwpbound.analyzer.semiring.Polynomial;
import com.mwpbound.analyzer.semiring.Scalar;

import java.util.*;

/**
 * An mwp-relation: a square matrix of polynomials indexed by program variables.
 *
 * Entry {@code [i][j]} describes how the input value of {@code variables[i]} flows into the
 * output value of {@code variables[j]}. Relations over different variables are combined after
 * homogenisation, where missing variables are left unchanged (identity).
 *
 * Instances are immutable; every operation returns a new relation.
 */
public final class Relation {

    private final List<String> variables;
    private final Polynomial[][] matrix;

    /** The zero relation over {@code variables}: no output depends on any input. */
    public Relation(List<String> variables) {
        this(variables, zeroMatrix(variables.size()));
    }

    public Relation(List<String> variables, Polynomial[][] matrix) {
        if (new HashSet<>(variables).size() != variables.size()) {
            throw new IllegalArgumentException("Duplicate variables: " + variables);
        }
        if (matrix.length != variables.size()) {
            throw new IllegalArgumentException("Matrix has " + matrix.length
                    + " rows for " + variables.size() + " variables");
        }
        this.variables = List.copyOf(variables);
        this.matrix = new Polynomial[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            if (matrix[i].length != variables.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + matrix[i].length + " columns");
            }
            this.matrix[i] = matrix[i].clone();
        }
    }

    public static Relation identity(List<String> variables) {
        Polynomial[][] m = zeroMatrix(variables.size());
        for (int i = 0; i < m.length; i++) m[i][i] = Polynomial.UNIT;
        return new Relation(variables, m);
    }

    public List<String> variables() { return variables; }

    public int size() { return variables.size(); }

    public Polynomial get(int row, int column) {
        return matrix[row][column];
    }

    public Polynomial flow(String source, String target) {
        return matrix[indexOf(source)][indexOf(target)];
    }

    public int indexOf(String variable) {
        int idx = variables.indexOf(variable);
        if (idx < 0) throw new IllegalArgumentException("Unknown variable: " + variable);
        return idx;
    }

    /**
     * Copy whose column for {@code variable} is {@code vector}, given in variable order.
     */
    public Relation replaceColumn(List<Polynomial> vector, String variable) {
        if (vector.size() != size()) {
            throw new IllegalArgumentException("Vector of size " + vector.size()
                    + " for relation of size " + size());
        }
        int j = indexOf(variable);
        Polynomial[][] m = copyMatrix();
        for (int i = 0; i < m.length; i++) m[i][j] = vector.get(i);
        return new Relation(variables, m);
    }

    /**
     * Extends this relation to {@code target}, which must contain all of its variables.
     * New variables are mapped to themselves.
     */
    public Relation homogenise(List<String> target) {
        if (target.equals(variables)) return this;
        if (!target.containsAll(variables)) {
            throw new IllegalArgumentException(target + " does not extend " + variables);
        }
        int[] position = new int[target.size()];
        for (int k = 0; k < target.size(); k++) position[k] = variables.indexOf(target.get(k));

        Polynomial[][] m = zeroMatrix(target.size());
        for (int i = 0; i < target.size(); i++) {
            for (int j = 0; j < target.size(); j++) {
                if (position[i] >= 0 && position[j] >= 0) {
                    m[i][j] = matrix[position[i]][position[j]];
                } else if (i == j) {
                    m[i][j] = Polynomial.UNIT;
                }
            }
        }
        return new Relation(target, m);
    }

    /** Sequential composition: this relation, then {@code other}. */
    public Relation composition(Relation other) {
        List<String> union = union(variables, other.variables);
        Relation a = homogenise(union);
        Relation b = other.homogenise(union);
        int n = union.size();
        Polynomial[][] m = zeroMatrix(n);
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < n; k++) {
                Polynomial left = a.matrix[i][k];
                if (left.isZero()) continue;
                for (int j = 0; j < n; j++) {
                    Polynomial right = b.matrix[k][j];
                    if (right.isZero()) continue;
                    m[i][j] = m[i][j].add(left.times(right));
                }
            }
        }
        return new Relation(union, m);
    }

    /** Join of two alternative relations, e.g. the two branches of a conditional. */
    public Relation sum(Relation other) {
        List<String> union = union(variables, other.variables);
        Relation a = homogenise(union);
        Relation b = other.homogenise(union);
        Polynomial[][] m = zeroMatrix(union.size());
        for (int i = 0; i < m.length; i++) {
            for (int j = 0; j < m.length; j++) {
                m[i][j] = a.matrix[i][j].add(b.matrix[i][j]);
            }
        }
        return new Relation(union, m);
    }

    /**
     * Reflexive transitive closure {@code I + R + R^2 + ...}, iterated until stable.
     */
    public Relation fixpoint() {
        Relation fix = identity(variables);
        Relation power = identity(variables);
        while (true) {
            power = power.composition(this);
            Relation next = fix.sum(power);
            if (next.equals(fix)) return fix;
            fix = next;
        }
    }

    /**
     * Correction for unbounded loops: a p flow anywhere, or a w flow of a variable into itself,
     * becomes infinite. Every monomial turned infinite is recorded in {@code graph}.
     */
    public Relation whileCorrection(DeltaGraph graph) {
        Polynomial[][] m = copyMatrix();
        for (int i = 0; i < m.length; i++) {
            for (int j = 0; j < m.length; j++) {
                final boolean diagonal = i == j;
                m[i][j] = m[i][j].map(mono -> {
                    if (mono.scalar() == Scalar.P || (diagonal && mono.scalar() == Scalar.W)) {
                        graph.insert(mono);
                        return mono.withScalar(Scalar.INFINITY);
                    }
                    return mono;
                });
            }
        }
        return new Relation(variables, m);
    }

    /**
     * Correction for {@code loop x { C }}: a variable depending on itself with w or p becomes
     * infinite, and every p flow into a variable also flows from {@code x} with p.
     */
    public Relation loopCorrection(String x, DeltaGraph graph) {
        int xi = indexOf(x);
        Polynomial[][] m = copyMatrix();
        for (int i = 0; i < m.length; i++) {
            Polynomial p = m[i][i];
            m[i][i] = p.map(mono -> {
                if (mono.scalar() == Scalar.W || mono.scalar() == Scalar.P) {
                    graph.insert(mono);
                    return mono.withScalar(Scalar.INFINITY);
                }
                return mono;
            });
        }
        for (int j = 0; j < m.length; j++) {
            List<Monomial> extra = new ArrayList<>();
            for (int i = 0; i < m.length; i++) {
                for (Monomial mono : m[i][j].monomials()) {
                    if (mono.scalar() == Scalar.P) extra.add(mono);
                }
            }
            if (!extra.isEmpty()) m[xi][j] = m[xi][j].add(Polynomial.of(extra));
        }
        return new Relation(variables, m);
    }

    /**
     * Choices avoiding every infinite flow of this relation.
     */
    public Choices eval(List<Integer> domain, int index) {
        Set<List<Delta>> paths = new LinkedHashSet<>();
        for (int j = 0; j < size(); j++) collectPaths(j, EnumSet.of(Scalar.INFINITY), paths);
        return Choices.generate(domain, index, paths);
    }

    /**
     * Choices avoiding the infinite flows into {@code variable}. Flows whose scalar is one of
     * {@code failing} are treated as infinite too.
     */
    public Choices varEval(List<Integer> domain, int index, String variable, Scalar... failing) {
        EnumSet<Scalar> fail = EnumSet.of(Scalar.INFINITY);
        fail.addAll(Arrays.asList(failing));
        Set<List<Delta>> paths = new LinkedHashSet<>();
        collectPaths(indexOf(variable), fail, paths);
        return Choices.generate(domain, index, paths);
    }

    /**
     * Pairs {@code source ➔ target} with an infinite flow, for each of the given targets.
     */
    public List<String> infinityFlows(Collection<String> targets) {
        List<String> flows = new ArrayList<>();
        for (String target : targets) {
            int j = indexOf(target);
            for (int i = 0; i < size(); i++) {
                if (matrix[i][j].contains(Scalar.INFINITY)) {
                    flows.add(variables.get(i) + " ➔ " + target);
                }
            }
        }
        return flows;
    }

    public SimpleRelation applyChoice(int[] choice) {
        Scalar[][] m = new Scalar[size()][size()];
        for (int i = 0; i < m.length; i++) {
            for (int j = 0; j < m.length; j++) {
                m[i][j] = matrix[i][j].eval(choice);
            }
        }
        return new SimpleRelation(variables, m);
    }

    /** Rows of the matrix rendered as polynomial strings. */
    public List<List<String>> rows() {
        List<List<String>> rows = new ArrayList<>(size());
        for (Polynomial[] row : matrix) {
            List<String> r = new ArrayList<>(row.length);
            for (Polynomial p : row) r.add(p.toString());
            rows.add(r);
        }
        return rows;
    }

    private void collectPaths(int column, Set<Scalar> failing, Set<List<Delta>> paths) {
        for (Polynomial[] row : matrix) {
            for (Monomial mono : row[column].monomials()) {
                if (failing.contains(mono.scalar())) paths.add(mono.deltas());
            }
        }
    }

    private Polynomial[][] copyMatrix() {
        Polynomial[][] m = new Polynomial[matrix.length][];
        for (int i = 0; i < matrix.length; i++) m[i] = matrix[i].clone();
        return m;
    }

    private static Polynomial[][] zeroMatrix(int n) {
        Polynomial[][] m = new Polynomial[n][n];
        for (Polynomial[] row : m) Arrays.fill(row, Polynomial.ZERO);
        return m;
    }

    private static List<String> union(List<String> first, List<String> second) {
        if (first.equals(second)) return first;
        LinkedHashSet<String> all = new LinkedHashSet<>(first);
        all.addAll(second);
        return new ArrayList<>(all);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relation)) return false;
        Relation other = (Relation) o;
        return variables.equals(other.variables) && Arrays.deepEquals(matrix, other.matrix);
    }

    @Override
    public int hashCode() {
        return 31 * variables.hashCode() + Arrays.deepHashCode(matrix);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < matrix.length; i++) {
            sb.append(variables.get(i)).append(" |");
            for (Polynomial p : matrix[i]) sb.append("  ").append(p);
            sb.append('\n');
        }
        return sb.toString();
    }
}
