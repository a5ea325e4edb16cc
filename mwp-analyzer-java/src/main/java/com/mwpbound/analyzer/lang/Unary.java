package com.mwpbound.analyzer.lang;

import java.util.Objects;
import java.util.Set;

/**
 * Unary operation. Increments and decrements use the prefix spelling ({@code ++}, {@code --})
 * and a {@code p} marker for the postfix one ({@code p++}, {@code p--}).
 */
public record Unary(String op, Expr expr) implements Expr {

    public static final Set<String> INC = Set.of("++", "p++");
    public static final Set<String> DEC = Set.of("--", "p--");

    public Unary {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(expr, "expr");
    }

    public boolean isIncOrDec() {
        return INC.contains(op) || DEC.contains(op);
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            expr.accept(visitor);
        }
    }
}
