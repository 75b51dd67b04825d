package bigo.ast.expr;

import java.util.Objects;

/** {@code ┌expression┐} */
public record Ceiling(Expression expression) implements Expression {
    public Ceiling {
        Objects.requireNonNull(expression, "expression");
    }
}
