package com.mwpbound.analyzer.analysis;

import com.mwpbound.analyzer.config.AnalysisConfig;
import com.mwpbound.analyzer.lang.*;
import com.mwpbound.analyzer.relation.Bound;
import com.mwpbound.analyzer.relation.Choices;
import com.mwpbound.analyzer.relation.DeltaGraph;
import com.mwpbound.analyzer.relation.Relation;
import com.mwpbound.analyzer.relation.RelationList;
import com.mwpbound.analyzer.result.FunctionResult;
import com.mwpbound.analyzer.semiring.Polynomial;
import com.mwpbound.analyzer.semiring.Scalar;

import java.util.*;

/**
 * Computes mwp-relations of statements and analyses whole functions.
 *
 * Every arithmetic assignment is a choice point: it gets a fresh index and a polynomial whose
 * value depends on which of the three derivation rules is chosen there.
 */
public class Analyzer {

    private final List<Integer> domain;
    private final boolean verbose;

    public Analyzer(AnalysisConfig config) {
        this.domain = config.getDomain();
        this.verbose = config.isVerbose();
    }

    public List<Integer> getDomain() { return domain; }

    /**
     * Checks that a function only uses supported syntax.
     *
     * @return the function, with unsupported statements removed unless {@code strict};
     *         empty if {@code strict} and the function is not fully supported
     */
    public Optional<FunctionDef> syntaxCheck(FunctionDef function, boolean strict) {
        return syntaxCheck(function.name(), function.body(), strict)
                .map(body -> new FunctionDef(function.name(), function.params(), (Block) body));
    }

    public Optional<Stmt> syntaxCheck(String name, Stmt node, boolean strict) {
        Coverage coverage = Coverage.report(node);
        if (coverage.isFull()) return Optional.of(node);
        for (Stmt s : coverage.unsupported()) {
            unsupported(s);
        }
        if (strict) {
            System.err.println("[mwp-analyzer] WARNING: " + name + " syntax is not fully analyzable");
            return Optional.empty();
        }
        System.err.println("[mwp-analyzer] WARNING: " + name + " syntax was modified");
        return Optional.of(coverage.strip());
    }

    /**
     * Analyses a function body.
     *
     * @param stop stop as soon as the function is known to have no bound
     */
    public FunctionResult analyzeFunction(FunctionDef function, boolean stop) {
        long start = System.nanoTime();
        System.err.println("[mwp-analyzer] Analyzing " + function.name());

        List<String> variables = VariableCollector.of(function);
        RelationList relations = RelationList.identity(variables);
        List<Stmt> body = function.body().stmts();
        debug(function.name() + " variables: " + String.join(", ", variables));
        debug(body.size() + " top-level commands to analyze");

        CommandResult cmds = commands(relations, 0, body, stop);
        int index = cmds.index();
        Relation relation = relations.first();

        Choices choices = null;
        Map<String, Bound> bounds = null;
        boolean evaluated = false;
        if (!cmds.exit()) {
            choices = relation.eval(domain, index);
            if (!choices.isInfinite()) {
                bounds = Bound.of(relation.applyChoice(choices.first()));
            }
            evaluated = true;
        }
        boolean infinite = cmds.exit() || (evaluated && choices.isInfinite());

        List<String> flows = null;
        if (infinite && !stop) {
            List<String> failing = new ArrayList<>();
            for (String v : relation.variables()) {
                if (relation.varEval(domain, index, v).isInfinite()) failing.add(v);
            }
            flows = relation.infinityFlows(failing);
        }

        return new FunctionResult(
                function.name(),
                relation.variables(),
                index,
                infinite,
                infinite && stop ? null : relation,
                infinite ? null : choices,
                infinite ? null : bounds,
                flows,
                (System.nanoTime() - start) / 1_000_000);
    }

    /**
     * Composes the relations of {@code stmts} onto {@code relations}, in place.
     *
     * @return the next choice index and whether every derivation became infinite
     */
    public CommandResult commands(RelationList relations, int index, List<Stmt> stmts, boolean stop) {
        DeltaGraph graph = new DeltaGraph(domain);
        boolean exit = false;
        int total = stmts.size();
        for (int i = 0; i < total; i++) {
            debug("computing relation..." + i + " of " + total);
            CommandResult r = computeRelation(index, stmts.get(i), graph);
            index = r.index();
            exit = exit || r.exit();
            if (stop && exit) {
                debug("delta graph full, stopping");
                break;
            }
            debug("computing composition..." + i + " of " + total);
            relations.composition(r.relations());
        }
        return new CommandResult(index, relations, exit);
    }

    /**
     * Relations of a single statement.
     */
    public CommandResult computeRelation(int index, Stmt stmt, DeltaGraph graph) {
        if (stmt instanceof Return || stmt instanceof Break || stmt instanceof Continue
                || stmt instanceof Skip || stmt instanceof Decl) {
            return CommandResult.skip(index);
        }
        if (stmt instanceof Assign a) {
            if (a.target() instanceof Var x && (a.isCompound() || "=".equals(a.op()))) {
                return assign(index, x.name(), a.desugar().value(), stmt);
            }
            return unsupported(index, stmt);
        }
        if (stmt instanceof ExprStmt e) return expression(index, e);
        if (stmt instanceof If i) return conditional(index, i, graph);
        if (stmt instanceof While w) return whileLoop(index, w.body(), graph);
        if (stmt instanceof DoWhile d) return whileLoop(index, d.body(), graph);
        if (stmt instanceof Loop l) return boundedLoop(index, l, graph);
        if (stmt instanceof Block b) return block(index, b, graph);
        return unsupported(index, stmt);
    }

    // --- Assignments ---

    private CommandResult assign(int index, String x, Expr value, Stmt stmt) {
        Expr rhs = Cast.unwrap(value);
        if (rhs instanceof Binary b) return binary(index, x, b, stmt);
        if (rhs instanceof Const) return constant(index, x);
        if (rhs instanceof Unary u) return unaryAssign(index, x, u, stmt);
        if (rhs instanceof Var y) return copy(index, x, y.name());
        return unsupported(index, stmt);
    }

    /** {@code x = c}: the constant is an input, so x no longer depends on anything. */
    private CommandResult constant(int index, String x) {
        debug(x + " = constant");
        return new CommandResult(index, RelationList.of(new Relation(List.of(x))), false);
    }

    /** {@code x = y}. */
    private CommandResult copy(int index, String x, String y) {
        if (x.equals(y)) return CommandResult.skip(index);
        debug(x + " = " + y);
        RelationList relations = RelationList.identity(List.of(x, y));
        relations.replaceColumn(List.of(Polynomial.ZERO, Polynomial.UNIT), x);
        return new CommandResult(index, relations, false);
    }

    private CommandResult binary(int index, String x, Binary rhs, Stmt stmt) {
        Expr left = Cast.unwrap(rhs.left());
        Expr right = Cast.unwrap(rhs.right());
        if (!Coverage.BINARY_OPS.contains(rhs.op()) || !Coverage.isAtom(left) || !Coverage.isAtom(right)) {
            return unsupported(index, stmt);
        }
        String y = left instanceof Var v ? v.name() : null;
        String z = right instanceof Var v ? v.name() : null;
        debug(x + " = " + (y == null ? "c" : y) + " " + rhs.op() + " " + (z == null ? "c" : z));

        Map<String, Polynomial> vector = createVector(index, rhs.op(), x, y, z);
        List<String> variables = new ArrayList<>(vector.keySet());
        List<Polynomial> column = new ArrayList<>(variables.size());
        for (String v : variables) column.add(vector.get(v));

        RelationList relations = RelationList.identity(variables);
        relations.replaceColumn(column, x);
        return new CommandResult(index + 1, relations, false);
    }

    /**
     * Column of {@code x} for {@code x = y op z}, keyed by variable. {@code y} or {@code z} is null
     * for a constant operand.
     */
    static Map<String, Polynomial> createVector(int index, String op, String x, String y, String z) {
        Map<String, Polynomial> vector = new LinkedHashMap<>();
        vector.put(x, Polynomial.ZERO);
        if (y == null || z == null) {
            String operand = y != null ? y : z;
            if (operand != null) {
                vector.put(operand, Polynomial.fromScalars(index, Scalar.M, Scalar.M, Scalar.M));
            }
        } else if ("*".equals(op)) {
            vector.put(y, Polynomial.fromScalars(index, Scalar.W, Scalar.W, Scalar.W));
            vector.put(z, Polynomial.fromScalars(index, Scalar.W, Scalar.W, Scalar.W));
        } else if (y.equals(z)) {
            vector.put(y, Polynomial.fromScalars(index, Scalar.P, Scalar.P, Scalar.W));
        } else {
            vector.put(y, Polynomial.fromScalars(index, Scalar.M, Scalar.P, Scalar.W));
            vector.put(z, Polynomial.fromScalars(index, Scalar.P, Scalar.M, Scalar.W));
        }
        return vector;
    }

    private CommandResult unaryAssign(int index, String x, Unary rhs, Stmt stmt) {
        Expr operand = Cast.unwrap(rhs.expr());
        if (operand instanceof Const) return constant(index, x);
        if (!(operand instanceof Var y)) return unsupported(index, stmt);
        if (rhs.isIncOrDec()) {
            String op = Unary.INC.contains(rhs.op()) ? "+" : "-";
            return binary(index, x, new Binary(op, y, Const.of(1)), stmt);
        }
        switch (rhs.op()) {
            case "!":
            case "sizeof":
                // 0 or 1 for negation, a type width for sizeof
                return constant(index, x);
            case "+":
                return copy(index, x, y.name());
            case "-":
                return binary(index, x, new Binary("*", y, Const.of(-1)), stmt);
            default:
                return unsupported(index, stmt);
        }
    }

    private CommandResult expression(int index, ExprStmt stmt) {
        Expr e = stmt.expr();
        if (e instanceof Call c && Coverage.IGNORED_CALLS.contains(c.name())) {
            return CommandResult.skip(index);
        }
        if (e instanceof Unary u) {
            Expr operand = Cast.unwrap(u.expr());
            if (u.isIncOrDec() && operand instanceof Var x) {
                String op = Unary.INC.contains(u.op()) ? "+" : "-";
                return binary(index, x.name(), new Binary(op, x, Const.of(1)), stmt);
            }
            if (Coverage.UNARY_OPS.contains(u.op()) && Coverage.isAtom(operand)) {
                return CommandResult.skip(index);
            }
        }
        return unsupported(index, stmt);
    }

    // --- Control flow ---

    private CommandResult conditional(int index, If stmt, DeltaGraph graph) {
        debug("computing relation (conditional case)");
        RelationList thenRelations = RelationList.empty();
        RelationList elseRelations = RelationList.empty();

        CommandResult r = branch(index, stmt.thenBranch(), thenRelations, graph);
        if (r.exit()) return r;
        r = branch(r.index(), stmt.elseBranch(), elseRelations, graph);
        if (r.exit()) return r;
        return new CommandResult(r.index(), elseRelations.sum(thenRelations), false);
    }

    private CommandResult branch(int index, Stmt body, RelationList relations, DeltaGraph graph) {
        if (body != null) {
            for (Stmt child : children(body)) {
                CommandResult r = computeRelation(index, child, graph);
                index = r.index();
                if (r.exit()) return new CommandResult(index, relations, true);
                relations.composition(r.relations());
            }
        }
        return new CommandResult(index, relations, false);
    }

    private CommandResult whileLoop(int index, Stmt body, DeltaGraph graph) {
        debug("analysing while");
        RelationList relations = RelationList.empty();
        for (Stmt child : children(body)) {
            CommandResult r = computeRelation(index, child, graph);
            if (r.exit()) return r;
            index = r.index();
            relations.composition(r.relations());
        }
        debug("while loop fixpoint");
        relations.fixpoint();
        relations.whileCorrection(graph);
        graph.fusion();
        return new CommandResult(index, relations, graph.isFull());
    }

    private CommandResult boundedLoop(int index, Loop loop, DeltaGraph graph) {
        if (Coverage.assignsTo(loop.body(), loop.bound())) {
            return unsupported(index, loop);
        }
        RelationList relations = RelationList.identity(List.of(loop.bound()));
        for (Stmt child : children(loop.body())) {
            CommandResult r = computeRelation(index, child, graph);
            if (r.exit()) return r;
            index = r.index();
            relations.composition(r.relations());
        }
        debug("loop fixpoint");
        relations.fixpoint();
        relations.loopCorrection(loop.bound(), graph);
        graph.fusion();
        return new CommandResult(index, relations, graph.isFull());
    }

    private CommandResult block(int index, Block block, DeltaGraph graph) {
        RelationList relations = RelationList.empty();
        for (Stmt child : block.stmts()) {
            CommandResult r = computeRelation(index, child, graph);
            index = r.index();
            relations.composition(r.relations());
            if (r.exit()) return new CommandResult(index, relations, true);
        }
        return new CommandResult(index, relations, false);
    }

    private static List<Stmt> children(Stmt body) {
        return body instanceof Block b ? b.stmts() : List.of(body);
    }

    // --- Logging ---

    private CommandResult unsupported(int index, Stmt stmt) {
        unsupported(stmt);
        return CommandResult.skip(index);
    }

    private static void unsupported(Stmt stmt) {
        System.err.println("[mwp-analyzer] WARNING: Unsupported syntax: " + stmt);
    }

    private void debug(String message) {
        if (verbose) System.err.println("[mwp-analyzer] " + message);
    }
}
