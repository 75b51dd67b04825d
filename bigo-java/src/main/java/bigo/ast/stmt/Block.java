package bigo.ast.stmt;

import java.util.List;

/** Statements between {@code begin} and {@code end}. */
public record Block(List<Statement> statements) {
    public Block {
        statements = List.copyOf(statements);
    }
}
