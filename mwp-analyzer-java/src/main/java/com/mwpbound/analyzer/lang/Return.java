package com.mwpbound.analyzer.lang;

/**
 * Return statement; {@code value} may be null.
 */
public record Return(Expr value) implements Stmt {

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this) && value != null) {
            value.accept(visitor);
        }
    }
}
