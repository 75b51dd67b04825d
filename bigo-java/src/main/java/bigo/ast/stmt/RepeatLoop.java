package bigo.ast.stmt;

import bigo.ast.expr.Expression;

import java.util.List;
import java.util.Objects;

/** Post-test loop: the body runs at least once. */
public record RepeatLoop(
        List<Statement> body,
        Expression condition
) implements Statement {
    public RepeatLoop {
        body = List.copyOf(body);
        Objects.requireNonNull(condition, "condition");
    }
}
