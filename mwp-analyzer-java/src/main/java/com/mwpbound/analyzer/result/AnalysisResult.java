package com.mwpbound.analyzer.result;

import com.mwpbound.analyzer.config.AnalysisMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Program-level analysis result: the function or loop results in analysis order.
 */
public class AnalysisResult {

    private final AnalysisMode mode;
    private final List<FunctionResult> functions = new ArrayList<>();
    private final List<LoopResult> loops = new ArrayList<>();
    private long startNanos;
    private long endNanos;

    public AnalysisResult(AnalysisMode mode) {
        this.mode = mode;
    }

    public AnalysisResult onStart() {
        startNanos = System.nanoTime();
        return this;
    }

    public AnalysisResult onEnd() {
        endNanos = System.nanoTime();
        return this;
    }

    public void addFunction(FunctionResult result) { functions.add(result); }
    public void addLoop(LoopResult result)         { loops.add(result); }

    public AnalysisMode getMode()            { return mode; }
    public List<FunctionResult> getFunctions() { return Collections.unmodifiableList(functions); }
    public List<LoopResult> getLoops()       { return Collections.unmodifiableList(loops); }
    public long getTimeMillis()              { return Math.max(0, endNanos - startNanos) / 1_000_000; }

    /** Writes a short summary of every result to stderr. */
    public void logResult() {
        for (FunctionResult f : functions) {
            if (f.infinite()) {
                System.err.println("[mwp-analyzer] " + f.name() + ": no bound (infinite)");
                for (String flow : f.infinityFlows()) {
                    System.err.println("[mwp-analyzer]   " + flow);
                }
            } else {
                String bounds = f.bounds().entrySet().stream()
                        .map(e -> e.getKey() + "' <= " + e.getValue())
                        .collect(Collectors.joining(" ∧ "));
                System.err.println("[mwp-analyzer] " + f.name() + ": " + (bounds.isEmpty() ? "bounded" : bounds));
            }
        }
        for (LoopResult l : loops) {
            System.err.println("[mwp-analyzer] " + l.function() + " " + l.kind() + " #" + l.ordinal()
                    + ": " + describe(l.variables()));
        }
        System.err.println("[mwp-analyzer] Total time: " + getTimeMillis() + " ms");
    }

    private static String describe(Map<String, VariableResult> variables) {
        if (variables.isEmpty()) return "no variables";
        return variables.values().stream()
                .map(v -> v.isBounded() ? v.name() + ":" + v.growth().symbol() : v.name() + ":∞")
                .collect(Collectors.joining(", "));
    }
}
