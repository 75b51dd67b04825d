package bigo.analysis;

import bigo.ast.expr.*;

import java.util.List;
import java.util.stream.Collectors;

/** Renders expressions back to readable pseudocode, e.g. {@code n <= 1} or {@code A[1..n]}. */
public final class ExpressionPrinter {

    private ExpressionPrinter() {}

    public static String print(Expression e) {
        if (e == null) return "";

        if (e instanceof NumberLiteral n) {
            return n.isInteger() ? Long.toString(n.value().longValue()) : Double.toString(n.value().doubleValue());
        }
        if (e instanceof BooleanLiteral b) return b.value() ? "true" : "false";
        if (e instanceof NullLiteral) return "NULL";

        if (e instanceof Variable v) return printVariable(v);

        if (e instanceof BinaryOp b) {
            return print(b.left()) + " " + b.operator().symbol() + " " + print(b.right());
        }
        if (e instanceof UnaryOp u) {
            return u.operator() == UnaryOp.Operator.NOT
                    ? "not " + print(u.operand())
                    : u.operator().symbol() + print(u.operand());
        }

        if (e instanceof FunctionCall f) return f.name() + "(" + printAll(f.arguments()) + ")";
        if (e instanceof Length l) return "length(" + printVariable(l.variable()) + ")";
        if (e instanceof Ceiling c) return "┌" + print(c.expression()) + "┐";
        if (e instanceof Floor f) return "└" + print(f.expression()) + "┘";

        throw new IllegalArgumentException("Unknown expression: " + e);
    }

    public static String printAll(List<Expression> exprs) {
        return exprs.stream().map(ExpressionPrinter::print).collect(Collectors.joining(", "));
    }

    private static String printVariable(Variable v) {
        StringBuilder sb = new StringBuilder(v.name());
        if (v.isRange()) {
            sb.append('[').append(print(v.rangeStart())).append("..").append(print(v.rangeEnd())).append(']');
        }
        for (Expression index : v.indices()) {
            sb.append('[').append(print(index)).append(']');
        }
        if (v.isField()) {
            sb.append('.').append(v.field());
            for (Expression index : v.fieldIndices()) {
                sb.append('[').append(print(index)).append(']');
            }
        }
        return sb.toString();
    }
}
