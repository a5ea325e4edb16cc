package com.mwpbound.analyzer.analysis;

import com.mwpbound.analyzer.lang.Assign;
import com.mwpbound.analyzer.lang.AstVisitor;
import com.mwpbound.analyzer.lang.Binary;
import com.mwpbound.analyzer.lang.Block;
import com.mwpbound.analyzer.lang.Call;
import com.mwpbound.analyzer.lang.Cast;
import com.mwpbound.analyzer.lang.Const;
import com.mwpbound.analyzer.lang.DoWhile;
import com.mwpbound.analyzer.lang.Expr;
import com.mwpbound.analyzer.lang.ExprStmt;
import com.mwpbound.analyzer.lang.If;
import com.mwpbound.analyzer.lang.Loop;
import com.mwpbound.analyzer.lang.Skip;
import com.mwpbound.analyzer.lang.Stmt;
import com.mwpbound.analyzer.lang.Unary;
import com.mwpbound.analyzer.lang.Var;
import com.mwpbound.analyzer.lang.While;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the statements of a program fragment that the analysis cannot handle, and removes them.
 *
 * Supported assignments have a variable on the left and, on the right, an atom (variable or
 * constant, possibly cast), a unary operation on an atom, or {@code + - *} between two atoms.
 * Expression statements must be unary operations on an atom or calls to {@code assert} or
 * {@code assume}. A {@code loop x} whose body assigns {@code x} is unsupported as a whole.
 */
public class Coverage {

    static final Set<String> BINARY_OPS = Set.of("+", "-", "*");
    static final Set<String> UNARY_OPS = Set.of("++", "--", "p++", "p--", "+", "-", "!", "sizeof");
    static final Set<String> IGNORED_CALLS = Set.of("assert", "assume");

    private final Stmt root;
    private final List<Stmt> unsupported;

    private Coverage(Stmt root, List<Stmt> unsupported) {
        this.root = root;
        this.unsupported = unsupported;
    }

    public static Coverage report(Stmt root) {
        Finder finder = new Finder();
        root.accept(finder);
        return new Coverage(root, finder.found);
    }

    public List<Stmt> unsupported() { return List.copyOf(unsupported); }

    public boolean isFull() { return unsupported.isEmpty(); }

    /** Copy of the analysed fragment with every unsupported statement replaced by a skip. */
    public Stmt strip() {
        return isFull() ? root : rewrite(root, new HashSet<>(unsupported));
    }

    // --- Support rules ---

    static boolean isAtom(Expr e) {
        Expr inner = Cast.unwrap(e);
        return inner instanceof Var || inner instanceof Const;
    }

    static boolean isSupported(Assign assign) {
        if (!(assign.target() instanceof Var)) return false;
        if (assign.isCompound()) return isAtom(assign.value());
        return "=".equals(assign.op()) && isSupportedValue(assign.value());
    }

    static boolean isSupportedValue(Expr value) {
        Expr e = Cast.unwrap(value);
        if (e instanceof Var || e instanceof Const) return true;
        if (e instanceof Unary u) return UNARY_OPS.contains(u.op()) && isAtom(u.expr());
        if (e instanceof Binary b) return BINARY_OPS.contains(b.op()) && isAtom(b.left()) && isAtom(b.right());
        return false;
    }

    static boolean isSupported(ExprStmt stmt) {
        Expr e = stmt.expr();
        if (e instanceof Unary u) {
            if (u.isIncOrDec()) return Cast.unwrap(u.expr()) instanceof Var;
            return UNARY_OPS.contains(u.op()) && isAtom(u.expr());
        }
        return e instanceof Call c && IGNORED_CALLS.contains(c.name());
    }

    static boolean assignsTo(Stmt body, String variable) {
        AssignmentFinder finder = new AssignmentFinder();
        body.accept(finder);
        return finder.assigned.contains(variable);
    }

    // --- Rewriting ---

    private static Stmt rewrite(Stmt stmt, Set<Stmt> drop) {
        if (drop.contains(stmt)) return new Skip();
        if (stmt instanceof Block b) {
            List<Stmt> stmts = new ArrayList<>(b.stmts().size());
            for (Stmt s : b.stmts()) stmts.add(rewrite(s, drop));
            return new Block(stmts);
        }
        if (stmt instanceof If i) {
            Stmt otherwise = i.elseBranch() == null ? null : rewrite(i.elseBranch(), drop);
            return new If(i.cond(), rewrite(i.thenBranch(), drop), otherwise);
        }
        if (stmt instanceof While w) return new While(w.cond(), rewrite(w.body(), drop));
        if (stmt instanceof DoWhile d) return new DoWhile(rewrite(d.body(), drop), d.cond());
        if (stmt instanceof Loop l) return new Loop(l.bound(), rewrite(l.body(), drop));
        return stmt;
    }

    private static class Finder extends AstVisitor {
        private final List<Stmt> found = new ArrayList<>();

        @Override
        public boolean visit(Assign node) {
            if (!isSupported(node)) found.add(node);
            return false;
        }

        @Override
        public boolean visit(ExprStmt node) {
            if (!isSupported(node)) found.add(node);
            return false;
        }

        @Override
        public boolean visit(Loop node) {
            if (assignsTo(node.body(), node.bound())) {
                found.add(node);
                return false;
            }
            return true;
        }
    }

    private static class AssignmentFinder extends AstVisitor {
        private final Set<String> assigned = new HashSet<>();

        @Override
        public boolean visit(Assign node) {
            if (node.target() instanceof Var v) assigned.add(v.name());
            return true;
        }

        @Override
        public boolean visit(Unary node) {
            if (node.isIncOrDec() && Cast.unwrap(node.expr()) instanceof Var v) assigned.add(v.name());
            return true;
        }
    }
}
