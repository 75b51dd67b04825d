package bigo.ast.decl;

public record ObjectDeclaration(
        String name,
        String className
) implements Declaration {}
