package bigo.ast.stmt;

public record Comment(String text) implements Statement {}
