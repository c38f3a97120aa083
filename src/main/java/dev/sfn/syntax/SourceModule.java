package dev.sfn.syntax;

import java.util.List;
import java.util.Optional;

/**
 * A parsed source file.
 */
public record SourceModule(String name, List<FunctionDef> functions) {

    public Optional<FunctionDef> function(String functionName) {
        return functions.stream().filter(f -> f.name().equals(functionName)).findFirst();
    }
}
