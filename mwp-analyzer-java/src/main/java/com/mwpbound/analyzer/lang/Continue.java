package com.mwpbound.analyzer.lang;

public record Continue() implements Stmt {

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
