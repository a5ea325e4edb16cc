package com.mwpbound.analyzer.lang;

/**
 * Literal constant. The value is kept as written since the analysis never looks at it.
 */
public record Const(String value) implements Expr {

    public static Const of(long value) {
        return new Const(Long.toString(value));
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
