package com.mwpbound.analyzer.lang;

import java.util.Objects;

public record While(Expr cond, Stmt body) implements Stmt {

    public While {
        Objects.requireNonNull(cond, "cond");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            cond.accept(visitor);
            body.accept(visitor);
        }
    }
}
