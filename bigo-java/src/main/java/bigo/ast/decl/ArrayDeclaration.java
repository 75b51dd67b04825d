package bigo.ast.decl;

import bigo.ast.expr.Expression;

import java.util.Objects;

public record ArrayDeclaration(
        String name,
        Expression size
) implements Declaration {
    public ArrayDeclaration {
        Objects.requireNonNull(size, "size");
    }
}
