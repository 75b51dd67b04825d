package bigo.ast.expr;

public sealed interface Expression
        permits NumberLiteral, BooleanLiteral, NullLiteral,
        Variable, BinaryOp, UnaryOp, FunctionCall,
        Length, Ceiling, Floor {}
