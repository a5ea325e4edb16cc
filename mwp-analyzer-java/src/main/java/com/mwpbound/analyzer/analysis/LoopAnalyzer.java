package com.mwpbound.analyzer.analysis;

import com.mwpbound.analyzer.lang.FunctionDef;
import com.mwpbound.analyzer.lang.Stmt;
import com.mwpbound.analyzer.relation.Bound;
import com.mwpbound.analyzer.relation.Choices;
import com.mwpbound.analyzer.relation.Relation;
import com.mwpbound.analyzer.relation.RelationList;
import com.mwpbound.analyzer.relation.SimpleRelation;
import com.mwpbound.analyzer.result.LoopResult;
import com.mwpbound.analyzer.result.VariableResult;
import com.mwpbound.analyzer.semiring.Scalar;

import java.util.*;

/**
 * Analyses each loop of a function on its own and classifies the growth of every variable
 * of the loop as m (at most maximum of inputs), w (weak polynomial) or p (polynomial).
 */
public class LoopAnalyzer {

    // Least class first, with the scalars that count as failures when testing for it
    private static final Scalar[][] CLASSES = {
            {Scalar.M, Scalar.W, Scalar.P},
            {Scalar.W, Scalar.P},
            {Scalar.P},
    };

    private final Analyzer analyzer;

    public LoopAnalyzer(Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Results for every analysable loop of {@code function}, nested loops included.
     */
    public List<LoopResult> analyze(FunctionDef function, boolean strict) {
        System.err.println("[mwp-analyzer] Analyzing loops of " + function.name());
        List<LoopResult> results = new ArrayList<>();
        List<Stmt> loops = LoopFinder.find(function);
        for (int ordinal = 0; ordinal < loops.size(); ordinal++) {
            Stmt loop = loops.get(ordinal);
            String label = function.name() + " " + LoopFinder.kindOf(loop) + " #" + ordinal;
            Optional<Stmt> checked = analyzer.syntaxCheck(label, loop, strict);
            if (checked.isEmpty() || !LoopFinder.isLoop(checked.get())) continue;
            results.add(inspect(function.name(), ordinal, checked.get()));
        }
        return results;
    }

    /**
     * Analyses a single loop, always to completion.
     */
    public LoopResult inspect(String function, int ordinal, Stmt loop) {
        long start = System.nanoTime();
        List<String> variables = VariableCollector.of(loop);
        RelationList relations = RelationList.identity(variables);
        CommandResult cmds = analyzer.commands(relations, 0, List.of(loop), false);
        Relation relation = relations.first();

        Map<String, VariableResult> byVariable;
        if (!cmds.exit()) {
            byVariable = new LinkedHashMap<>();
            for (String v : relation.variables()) {
                byVariable.put(v, getResult(relation, cmds.index(), v));
            }
        } else {
            byVariable = maybeResult(relation, cmds.index());
        }
        return new LoopResult(function, LoopFinder.kindOf(loop), ordinal, byVariable,
                (System.nanoTime() - start) / 1_000_000);
    }

    /**
     * Least growth class of {@code variable}: the first class some derivation satisfies.
     */
    VariableResult getResult(Relation relation, int index, String variable) {
        List<Integer> domain = analyzer.getDomain();
        for (Scalar[] c : CLASSES) {
            Scalar[] failing = Arrays.copyOfRange(c, 1, c.length);
            Choices choices = relation.varEval(domain, index, variable, failing);
            if (!choices.isInfinite()) {
                Bound bound = Bound.of(relation.applyChoice(choices.first()), variable);
                return new VariableResult(variable, c[0], choices, bound);
            }
        }
        return VariableResult.unbounded(variable);
    }

    /**
     * Classification when some variables are known to grow unboundedly. A remaining variable is
     * classified only if, under a derivation that bounds all remaining variables, it does not
     * depend on any unbounded one.
     */
    Map<String, VariableResult> maybeResult(Relation relation, int index) {
        List<Integer> domain = analyzer.getDomain();
        Map<String, Choices> perVariable = new LinkedHashMap<>();
        List<String> failing = new ArrayList<>();
        for (String v : relation.variables()) {
            Choices c = relation.varEval(domain, index, v);
            perVariable.put(v, c);
            if (c.isInfinite()) failing.add(v);
        }

        Map<String, VariableResult> result = new LinkedHashMap<>();
        for (String v : relation.variables()) result.put(v, VariableResult.unbounded(v));

        List<Choices> rest = new ArrayList<>();
        for (Map.Entry<String, Choices> e : perVariable.entrySet()) {
            if (!failing.contains(e.getKey())) rest.add(e.getValue());
        }
        if (rest.isEmpty()) return result;

        Choices reduced = Choices.reduce(rest);
        if (reduced.isInfinite()) {
            System.err.println("[mwp-analyzer] WARNING: no derivation bounds all remaining variables");
            return result;
        }
        SimpleRelation simple = relation.applyChoice(reduced.first());
        for (String v : perVariable.keySet()) {
            if (failing.contains(v)) continue;
            boolean independent = true;
            for (String f : failing) {
                if (simple.flow(f, v) != Scalar.ZERO) {
                    independent = false;
                    break;
                }
            }
            if (independent) result.put(v, getResult(relation, index, v));
        }
        return result;
    }
}
