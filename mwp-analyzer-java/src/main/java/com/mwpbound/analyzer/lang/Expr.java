package com.mwpbound.analyzer.lang;

/**
 * Expression node.
 */
public interface Expr {

    void accept(AstVisitor visitor);

    /** Variables and constants are atoms: the only operands the mwp rules type directly. */
    default boolean isAtom() {
        return this instanceof Var || this instanceof Const;
    }
}
