package bigo.ast.expr;

import java.util.Objects;

/** Integer literals hold a {@link Long}, decimal literals a {@link Double}. */
public record NumberLiteral(Number value) implements Expression {
    public NumberLiteral {
        Objects.requireNonNull(value, "value");
        if (!(value instanceof Long) && !(value instanceof Double)) {
            throw new IllegalArgumentException("number literal must be Long or Double, got " + value.getClass());
        }
    }

    public static NumberLiteral of(long value) {
        return new NumberLiteral(value);
    }

    public static NumberLiteral of(double value) {
        return new NumberLiteral(value);
    }

    public boolean isInteger() {
        return value instanceof Long;
    }
}
