package com.mwpbound.analyzer.result;

import java.util.Map;

/**
 * Outcome of analysing one loop in isolation.
 *
 * @param ordinal position of the loop among the loops of its function, outer loops first
 */
public record LoopResult(
        String function,
        String kind,
        int ordinal,
        Map<String, VariableResult> variables,
        long timeMillis
) {}
