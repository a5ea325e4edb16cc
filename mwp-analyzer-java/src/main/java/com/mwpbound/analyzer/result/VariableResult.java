package com.mwpbound.analyzer.result;

import com.mwpbound.analyzer.relation.Bound;
import com.mwpbound.analyzer.relation.Choices;
import com.mwpbound.analyzer.semiring.Scalar;

/**
 * Loop analysis outcome for one variable. {@code growth} is the least class among m, w and p
 * for which some derivation bounds the variable, or null if none does.
 */
public record VariableResult(String name, Scalar growth, Choices choices, Bound bound) {

    public static VariableResult unbounded(String name) {
        return new VariableResult(name, null, null, null);
    }

    public boolean isBounded() { return growth != null; }
}
