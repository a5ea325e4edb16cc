package com.mwpbound.analyzer.lang;

/**
 * Empty statement. Also stands in for statements removed by the syntax check.
 */
public record Skip() implements Stmt {

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
