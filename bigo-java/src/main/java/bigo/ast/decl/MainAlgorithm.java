package bigo.ast.decl;

import bigo.ast.stmt.Statement;

import java.util.List;

public record MainAlgorithm(
        List<Declaration> declarations,
        List<Statement> body
) {
    public MainAlgorithm {
        declarations = List.copyOf(declarations);
        body = List.copyOf(body);
    }
}
