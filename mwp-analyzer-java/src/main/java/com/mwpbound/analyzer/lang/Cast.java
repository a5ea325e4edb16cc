package com.mwpbound.analyzer.lang;

import java.util.Objects;

public record Cast(String type, Expr expr) implements Expr {

    public Cast {
        Objects.requireNonNull(expr, "expr");
    }

    /** Strips any number of casts around {@code e}. */
    public static Expr unwrap(Expr e) {
        while (e instanceof Cast) e = ((Cast) e).expr();
        return e;
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            expr.accept(visitor);
        }
    }
}
