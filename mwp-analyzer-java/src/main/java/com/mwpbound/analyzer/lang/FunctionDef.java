package com.mwpbound.analyzer.lang;

import java.util.List;
import java.util.Objects;

public record FunctionDef(String name, List<String> params, Block body) {

    public FunctionDef {
        Objects.requireNonNull(name, "name");
        params = params == null ? List.of() : List.copyOf(params);
        body = body == null ? new Block(List.of()) : body;
    }

    public void accept(AstVisitor visitor) {
        if (visitor.visit(this)) {
            body.accept(visitor);
        }
    }
}
