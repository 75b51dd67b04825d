package bigo.ast.expr;

import java.util.Objects;

/** {@code └expression┘} */
public record Floor(Expression expression) implements Expression {
    public Floor {
        Objects.requireNonNull(expression, "expression");
    }
}
