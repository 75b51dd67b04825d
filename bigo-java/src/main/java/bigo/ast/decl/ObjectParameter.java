package bigo.ast.decl;

/** The class is referenced by name, never embedded. */
public record ObjectParameter(
        String name,
        String className
) implements Parameter {}
