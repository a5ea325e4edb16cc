package com.mwpbound.analyzer.lang;

import java.util.List;
import java.util.Objects;

public record Call(String name, List<Expr> args) implements Expr {

    public Call {
        Objects.requireNonNull(name, "name");
        args = args == null ? List.of() : List.copyOf(args);
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            for (Expr arg : args) arg.accept(visitor);
        }
    }
}
