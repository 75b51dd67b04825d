package bigo.ast.stmt;

import bigo.ast.expr.Expression;

import java.util.List;

public record CallStatement(
        String name,
        List<Expression> arguments
) implements Statement {
    public CallStatement {
        arguments = List.copyOf(arguments);
    }
}
