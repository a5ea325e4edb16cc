package com.mwpbound.analyzer.lang;

/**
 * Base visitor over the AST. Each {@code visit} returns whether the children of the node
 * should be visited; the defaults visit everything.
 */
public abstract class AstVisitor {

    public boolean visit(FunctionDef node) { return true; }

    // --- Statements ---

    public boolean visit(Assign node)   { return true; }
    public boolean visit(ExprStmt node) { return true; }
    public boolean visit(Decl node)     { return true; }
    public boolean visit(If node)       { return true; }
    public boolean visit(While node)    { return true; }
    public boolean visit(DoWhile node)  { return true; }
    public boolean visit(Loop node)     { return true; }
    public boolean visit(Block node)    { return true; }
    public boolean visit(Return node)   { return true; }
    public boolean visit(Break node)    { return true; }
    public boolean visit(Continue node) { return true; }
    public boolean visit(Skip node)     { return true; }

    // --- Expressions ---

    public boolean visit(Var node)    { return true; }
    public boolean visit(Const node)  { return true; }
    public boolean visit(Binary node) { return true; }
    public boolean visit(Unary node)  { return true; }
    public boolean visit(Cast node)   { return true; }
    public boolean visit(Call node)   { return true; }
}
