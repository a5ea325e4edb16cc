package com.mwpbound.analyzer.lang;

import java.util.Objects;

/**
 * An expression evaluated for its side effect, e.g. {@code x++;} or {@code assert(x > 0);}.
 */
public record ExprStmt(Expr expr) implements Stmt {

    public ExprStmt {
        Objects.requireNonNull(expr, "expr");
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            expr.accept(visitor);
        }
    }
}
