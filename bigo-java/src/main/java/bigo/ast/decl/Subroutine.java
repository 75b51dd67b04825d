package bigo.ast.decl;

import bigo.ast.stmt.Statement;

import java.util.List;

public record Subroutine(
        String name,
        List<Parameter> parameters,
        List<Declaration> declarations,
        List<Statement> body
) {
    public Subroutine {
        parameters = List.copyOf(parameters);
        declarations = List.copyOf(declarations);
        body = List.copyOf(body);
    }
}
