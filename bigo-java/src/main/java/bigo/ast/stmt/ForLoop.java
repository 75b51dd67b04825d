package bigo.ast.stmt;

import bigo.ast.expr.Expression;

import java.util.Objects;

/** {@code for variable := start to end do begin ... end}, both bounds inclusive. */
public record ForLoop(
        String variable,
        Expression start,
        Expression end,
        Block body
) implements Statement {
    public ForLoop {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(body, "body");
    }
}
