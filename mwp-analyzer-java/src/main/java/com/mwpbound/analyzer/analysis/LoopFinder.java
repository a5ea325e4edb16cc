package com.mwpbound.analyzer.analysis;

import com.mwpbound.analyzer.lang.AstVisitor;
import com.mwpbound.analyzer.lang.DoWhile;
import com.mwpbound.analyzer.lang.FunctionDef;
import com.mwpbound.analyzer.lang.Loop;
import com.mwpbound.analyzer.lang.Stmt;
import com.mwpbound.analyzer.lang.While;

import java.util.ArrayList;
import java.util.List;

/**
 * AstVisitor that lists every loop of a function. Nested loops are listed too, after the
 * loop that contains them.
 */
public class LoopFinder extends AstVisitor {

    private final List<Stmt> loops = new ArrayList<>();

    public static List<Stmt> find(FunctionDef function) {
        LoopFinder finder = new LoopFinder();
        function.accept(finder);
        return finder.getLoops();
    }

    public List<Stmt> getLoops() { return loops; }

    /** Short name of a loop statement's kind: {@code while}, {@code do_while} or {@code loop}. */
    public static String kindOf(Stmt loop) {
        if (loop instanceof While) return "while";
        if (loop instanceof DoWhile) return "do_while";
        if (loop instanceof Loop) return "loop";
        throw new IllegalArgumentException("Not a loop: " + loop);
    }

    public static boolean isLoop(Stmt stmt) {
        return stmt instanceof While || stmt instanceof DoWhile || stmt instanceof Loop;
    }

    @Override
    public boolean visit(While node) {
        loops.add(node);
        return true;
    }

    @Override
    public boolean visit(DoWhile node) {
        loops.add(node);
        return true;
    }

    @Override
    public boolean visit(Loop node) {
        loops.add(node);
        return true;
    }
}
