package com.mwpbound.analyzer.lang;

import java.util.Arrays;
import java.util.List;

/**
 * Short static factories for building programs in code.
 */
public final class Ast {

    private Ast() {}

    public static Var var(String name) { return new Var(name); }

    public static Const num(long value) { return Const.of(value); }

    public static Binary add(Expr left, Expr right) { return new Binary("+", left, right); }
    public static Binary sub(Expr left, Expr right) { return new Binary("-", left, right); }
    public static Binary mul(Expr left, Expr right) { return new Binary("*", left, right); }
    public static Binary op(String op, Expr left, Expr right) { return new Binary(op, left, right); }

    public static Unary unary(String op, Expr expr) { return new Unary(op, expr); }

    public static Assign assign(String target, Expr value) { return new Assign(target, value); }

    public static Assign assign(String target, String op, Expr value) {
        return new Assign(new Var(target), op, value);
    }

    public static ExprStmt inc(String variable) { return new ExprStmt(new Unary("p++", new Var(variable))); }

    public static ExprStmt call(String name, Expr... args) { return new ExprStmt(new Call(name, List.of(args))); }

    public static Decl decl(String name) { return new Decl(name, null); }

    public static Decl decl(String name, Expr init) { return new Decl(name, init); }

    public static If ifThen(Expr cond, Stmt then) { return new If(cond, then, null); }

    public static If ifThenElse(Expr cond, Stmt then, Stmt otherwise) { return new If(cond, then, otherwise); }

    public static While whileLoop(Expr cond, Stmt... body) { return new While(cond, Block.of(body)); }

    public static DoWhile doWhile(Expr cond, Stmt... body) { return new DoWhile(Block.of(body), cond); }

    public static Loop loop(String bound, Stmt... body) { return new Loop(bound, Block.of(body)); }

    public static Block block(Stmt... stmts) { return Block.of(stmts); }

    public static FunctionDef function(String name, List<String> params, Stmt... body) {
        return new FunctionDef(name, params, new Block(Arrays.asList(body)));
    }

    public static Program program(FunctionDef... functions) { return new Program(List.of(functions)); }
}
