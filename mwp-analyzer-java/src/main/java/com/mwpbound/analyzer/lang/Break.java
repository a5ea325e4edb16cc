package com.mwpbound.analyzer.lang;

public record Break() implements Stmt {

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
