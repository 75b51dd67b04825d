package bigo.ast.stmt;

import bigo.ast.expr.Expression;

import java.util.Objects;

public record WhileLoop(
        Expression condition,
        Block body
) implements Statement {
    public WhileLoop {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
    }
}
