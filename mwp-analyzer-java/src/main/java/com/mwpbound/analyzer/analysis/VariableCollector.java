package com.mwpbound.analyzer.analysis;

import com.mwpbound.analyzer.lang.AstVisitor;
import com.mwpbound.analyzer.lang.Decl;
import com.mwpbound.analyzer.lang.FunctionDef;
import com.mwpbound.analyzer.lang.Loop;
import com.mwpbound.analyzer.lang.Stmt;
import com.mwpbound.analyzer.lang.Var;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * AstVisitor that collects the variables of a function or statement, each once, in the
 * order they first occur. Function parameters come first.
 */
public class VariableCollector extends AstVisitor {

    private final Set<String> variables = new LinkedHashSet<>();

    public static List<String> of(FunctionDef function) {
        VariableCollector collector = new VariableCollector();
        collector.variables.addAll(function.params());
        function.accept(collector);
        return collector.getVariables();
    }

    public static List<String> of(Stmt stmt) {
        VariableCollector collector = new VariableCollector();
        stmt.accept(collector);
        return collector.getVariables();
    }

    public List<String> getVariables() { return new ArrayList<>(variables); }

    @Override
    public boolean visit(Var node) {
        variables.add(node.name());
        return false;
    }

    @Override
    public boolean visit(Decl node) {
        variables.add(node.name());
        return true;
    }

    @Override
    public boolean visit(Loop node) {
        variables.add(node.bound());
        return true;
    }
}
