package com.mwpbound.analyzer.lang;

import java.util.List;
import java.util.Optional;

public record Program(List<FunctionDef> functions) {

    public Program {
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public Optional<FunctionDef> function(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
