package bigo.ast.expr;

import java.util.Objects;

public record UnaryOp(
        Operator operator,
        Expression operand
) implements Expression {

    public UnaryOp {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    public enum Operator {
        NOT("not"), NEG("-"), PLUS("+");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
