package bigo.ast.decl;

public record SimpleParameter(String name) implements Parameter {}
