package bigo.ast.stmt;

import bigo.ast.expr.Expression;
import bigo.ast.expr.Variable;

import java.util.Objects;

public record Assignment(
        Variable target,
        Expression value
) implements Statement {
    public Assignment {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(value, "value");
    }
}
