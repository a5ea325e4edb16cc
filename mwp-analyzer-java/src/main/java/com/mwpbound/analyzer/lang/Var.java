package com.mwpbound.analyzer.lang;

import java.util.Objects;

public record Var(String name) implements Expr {

    public Var {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
