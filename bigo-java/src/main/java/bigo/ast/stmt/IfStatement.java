package bigo.ast.stmt;

import bigo.ast.expr.Expression;

import java.util.Objects;

public record IfStatement(
        Expression condition,
        Block thenBlock,
        Block elseBlock      // null when there is no else
) implements Statement {
    public IfStatement {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(thenBlock, "thenBlock");
    }

    public boolean hasElse() {
        return elseBlock != null;
    }
}
