package com.mwpbound.analyzer.lang;

import java.util.Map;
import java.util.Objects;

/**
 * Assignment {@code target op value} with {@code op} one of {@code =}, {@code +=}, {@code -=}, {@code *=}.
 */
public record Assign(Expr target, String op, Expr value) implements Stmt {

    private static final Map<String, String> COMPOUND = Map.of("+=", "+", "-=", "-", "*=", "*");

    public Assign {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(value, "value");
        op = op == null ? "=" : op;
    }

    public Assign(String target, Expr value) {
        this(new Var(target), "=", value);
    }

    public boolean isCompound() {
        return COMPOUND.containsKey(op);
    }

    /**
     * {@code x op= e} as {@code x = x op e}; plain assignments are returned unchanged.
     * Fails for operators other than {@code =} and the compound arithmetic ones.
     */
    public Assign desugar() {
        if ("=".equals(op)) return this;
        String binaryOp = COMPOUND.get(op);
        if (binaryOp == null) {
            throw new IllegalStateException("Unsupported assignment operator: " + op);
        }
        return new Assign(target, "=", new Binary(binaryOp, target, value));
    }

    @Override
    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            target.accept(visitor);
            value.accept(visitor);
        }
    }
}
