package com.mwpbound.analyzer.lang;

import java.util.Objects;

/**
 * Bounded iteration {@code loop bound { body }}: the body runs as many times as the value of
 * {@code bound} when the loop is entered. The body must not assign {@code bound}.
 */
public record Loop(String bound, Stmt body) implements Stmt {

    public Loop {
        Objects.requireNonNull(bound, "bound");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            body.accept(visitor);
        }
    }
}
