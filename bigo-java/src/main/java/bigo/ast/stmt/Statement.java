package bigo.ast.stmt;

public sealed interface Statement
        permits Assignment, ForLoop, WhileLoop, RepeatLoop,
        IfStatement, CallStatement, ReturnStatement, Comment {}
