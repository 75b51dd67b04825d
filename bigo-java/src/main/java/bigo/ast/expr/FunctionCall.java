package bigo.ast.expr;

import java.util.List;

public record FunctionCall(
        String name,
        List<Expression> arguments
) implements Expression {
    public FunctionCall {
        arguments = List.copyOf(arguments);
    }
}
