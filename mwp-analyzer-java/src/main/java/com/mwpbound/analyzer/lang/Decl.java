package com.mwpbound.analyzer.lang;

import java.util.Objects;

/**
 * Variable declaration; {@code init} may be null.
 */
public record Decl(String name, Expr init) implements Stmt {

    public Decl {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this) && init != null) {
            init.accept(visitor);
        }
    }
}
