package bigo.ast.expr;

public record BooleanLiteral(boolean value) implements Expression {}
