package com.mwpbound.analyzer.lang;

import java.util.Objects;

/**
 * Conditional; {@code elseBranch} may be null.
 */
public record If(Expr cond, Stmt thenBranch, Stmt elseBranch) implements Stmt {

    public If {
        Objects.requireNonNull(cond, "cond");
        Objects.requireNonNull(thenBranch, "thenBranch");
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            cond.accept(visitor);
            thenBranch.accept(visitor);
            if (elseBranch != null) elseBranch.accept(visitor);
        }
    }
}
