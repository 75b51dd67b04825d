package bigo.ast.expr;

import java.util.Objects;

/** {@code length(A)} */
public record Length(Variable variable) implements Expression {
    public Length {
        Objects.requireNonNull(variable, "variable");
    }
}
