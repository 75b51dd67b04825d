package bigo.ast.decl;

import java.util.List;

/** {@code Point { x y }}: attributes only, no methods. */
public record ClassDefinition(
        String name,
        List<String> attributes
) {
    public ClassDefinition {
        attributes = List.copyOf(attributes);
    }
}
