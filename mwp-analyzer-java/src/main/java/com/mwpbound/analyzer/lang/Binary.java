package com.mwpbound.analyzer.lang;

import java.util.Objects;

public record Binary(String op, Expr left, Expr right) implements Expr {

    public Binary {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            left.accept(visitor);
            right.accept(visitor);
        }
    }
}
