package bigo.ast.stmt;

import bigo.ast.expr.Expression;

import java.util.Objects;

public record ReturnStatement(Expression value) implements Statement {
    public ReturnStatement {
        Objects.requireNonNull(value, "value");
    }
}
