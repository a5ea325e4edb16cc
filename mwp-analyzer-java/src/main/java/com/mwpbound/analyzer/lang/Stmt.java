package com.mwpbound.analyzer.lang;

/**
 * Statement node.
 */
public interface Stmt {

    void accept(AstVisitor visitor);
}
