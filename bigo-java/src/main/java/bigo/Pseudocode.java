package bigo;

import bigo.ast.Program;
import bigo.builder.AstBuilder;
import bigo.lexer.Lexer;
import bigo.lexer.Token;
import bigo.parser.Parser;
import bigo.parser.SyntaxException;

import java.util.List;

/** Front end: source text to AST in one call. */
public final class Pseudocode {

    private Pseudocode() {}

    /**
     * Lexes, parses and builds the AST for {@code source}.
     *
     * @throws SyntaxException if the text is not valid pseudocode
     */
    public static Program parse(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        return new AstBuilder().build(new Parser(tokens).parseProgram());
    }
}
