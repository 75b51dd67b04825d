package bigo.ast.decl;

public record ArrayParameter(
        String name,
        int dimensions
) implements Parameter {
    public ArrayParameter {
        if (dimensions < 1) throw new IllegalArgumentException("array parameter needs at least one dimension");
    }
}
