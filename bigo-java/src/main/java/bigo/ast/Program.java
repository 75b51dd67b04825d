package bigo.ast;

import bigo.ast.decl.Algorithm;
import bigo.ast.decl.ClassDefinition;

import java.util.List;
import java.util.Objects;

public record Program(
        List<ClassDefinition> classes,
        Algorithm algorithm
) {
    public Program {
        classes = List.copyOf(classes);
        Objects.requireNonNull(algorithm, "a program has exactly one algorithm");
    }
}
