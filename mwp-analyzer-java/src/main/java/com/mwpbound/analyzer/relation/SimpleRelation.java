package com.mwpbound.analyzer.relation;

import com.mwpbound.analyzer.semiring.Scalar;

import java.util.List;

/**
 * A relation evaluated under one concrete choice: a matrix of scalars.
 */
public class SimpleRelation {

    private final List<String> variables;
    private final Scalar[][] matrix;

    SimpleRelation(List<String> variables, Scalar[][] matrix) {
        this.variables = List.copyOf(variables);
        this.matrix = matrix;
    }

    public List<String> variables() { return variables; }

    public Scalar get(int row, int column) {
        return matrix[row][column];
    }

    /** Scalar of the flow from the input value of {@code source} to the output value of {@code target}. */
    public Scalar flow(String source, String target) {
        return matrix[indexOf(source)][indexOf(target)];
    }

    public int indexOf(String variable) {
        int idx = variables.indexOf(variable);
        if (idx < 0) throw new IllegalArgumentException("Unknown variable: " + variable);
        return idx;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < matrix.length; i++) {
            sb.append(variables.get(i)).append(" |");
            for (Scalar s : matrix[i]) sb.append(' ').append(s.symbol());
            sb.append('\n');
        }
        return sb.toString();
    }
}
