package bigo.ast.expr;

import java.util.List;

/**
 * A variable reference in one of four access modes: bare name, indexed ({@code A[i][j]}),
 * field access ({@code p.x}, optionally indexed: {@code p.v[i]}) or range slice ({@code A[1..n]}).
 * The modes are mutually exclusive.
 */
public record Variable(
        String name,
        List<Expression> indices,
        String field,                  // null unless field access
        List<Expression> fieldIndices,
        boolean isRange,
        Expression rangeStart,         // null unless isRange
        Expression rangeEnd
) implements Expression {

    public Variable {
        indices = List.copyOf(indices);
        fieldIndices = List.copyOf(fieldIndices);

        int modes = (indices.isEmpty() ? 0 : 1) + (field != null ? 1 : 0) + (isRange ? 1 : 0);
        if (modes > 1) {
            throw new IllegalArgumentException("variable '" + name + "' mixes indices, field access and range");
        }
        if (field == null && !fieldIndices.isEmpty()) {
            throw new IllegalArgumentException("field indices without a field on '" + name + "'");
        }
        if (isRange != (rangeStart != null) || isRange != (rangeEnd != null)) {
            throw new IllegalArgumentException("range bounds must be given exactly when isRange is set on '" + name + "'");
        }
    }

    public static Variable named(String name) {
        return new Variable(name, List.of(), null, List.of(), false, null, null);
    }

    public static Variable indexed(String name, List<Expression> indices) {
        return new Variable(name, indices, null, List.of(), false, null, null);
    }

    public static Variable field(String name, String field, List<Expression> fieldIndices) {
        return new Variable(name, List.of(), field, fieldIndices, false, null, null);
    }

    public static Variable range(String name, Expression start, Expression end) {
        return new Variable(name, List.of(), null, List.of(), true, start, end);
    }

    public boolean isField() {
        return field != null;
    }
}
