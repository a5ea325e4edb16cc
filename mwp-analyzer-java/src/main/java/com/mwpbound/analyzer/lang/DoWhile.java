package com.mwpbound.analyzer.lang;

import java.util.Objects;

public record DoWhile(Stmt body, Expr cond) implements Stmt {

    public DoWhile {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(cond, "cond");
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            body.accept(visitor);
            cond.accept(visitor);
        }
    }
}
