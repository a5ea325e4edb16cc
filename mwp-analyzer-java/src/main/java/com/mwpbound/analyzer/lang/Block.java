package com.mwpbound.analyzer.lang;

import java.util.List;

public record Block(List<Stmt> stmts) implements Stmt {

    public Block {
        stmts = stmts == null ? List.of() : List.copyOf(stmts);
    }

    public static Block of(Stmt... stmts) {
        return new Block(List.of(stmts));
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            for (Stmt s : stmts) s.accept(visitor);
        }
    }
}
