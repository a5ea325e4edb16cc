package com.mwpbound.analyzer.result;

import com.mwpbound.analyzer.relation.Bound;
import com.mwpbound.analyzer.relation.Choices;
import com.mwpbound.analyzer.relation.Relation;

import java.util.List;
import java.util.Map;

/**
 * Outcome of analysing one function.
 *
 * @param relation      final relation; null when the function is infinite and the analysis stopped early
 * @param choices       derivations without infinite flows; null when infinite
 * @param bounds        bound of each variable under the first valid choice; null when infinite
 * @param infinityFlows {@code "source ➔ target"} pairs; only filled for infinite functions run to completion
 */
public record FunctionResult(
        String name,
        List<String> variables,
        int index,
        boolean infinite,
        Relation relation,
        Choices choices,
        Map<String, Bound> bounds,
        List<String> infinityFlows,
        long timeMillis
) {
    public FunctionResult {
        variables = List.copyOf(variables);
        infinityFlows = infinityFlows == null ? List.of() : List.copyOf(infinityFlows);
    }
}
