package bigo.ast.expr;

public record NullLiteral() implements Expression {}
