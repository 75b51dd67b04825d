package bigo.ast.expr;

import java.util.Objects;

public record BinaryOp(
        Operator operator,
        Expression left,
        Expression right
) implements Expression {

    public BinaryOp {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    public enum Operator {
        OR("or"), AND("and"),
        EQ("="), NE("!="), LT("<"), GT(">"), LE("<="), GE(">="),
        ADD("+"), SUB("-"),
        MUL("*"), DIV("/"), INT_DIV("div"), MOD("mod"),
        POW("^");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
