package bigo.parser;

import bigo.lexer.Lexer;
import bigo.lexer.TokenType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static ParseTree.Node parse(String src) {
        var tokens = new Lexer(src).tokenize();
        return new Parser(tokens).parseProgram();
    }

    private static ParseTree.Node mainBlock(ParseTree.Node program) {
        ParseTree.Node algorithm = program.node(program.size() - 1);
        ParseTree.Node main = algorithm.node(algorithm.size() - 1);
        assertEquals(Rule.MAIN_ALGORITHM, main.rule());
        return main.node(1);
    }

    @Test
    void parse_classes_subroutines_and_main() {
        var p = parse("""
            Point { x y }
            f(n)
            begin
                return n
            end
            begin
                x := 1
            end
            """);
        assertEquals(Rule.PROGRAM, p.rule());
        assertEquals(Rule.CLASS_DEFINITION, p.node(0).rule());
        assertEquals(3, p.node(0).size());        // name + two attributes

        ParseTree.Node algorithm = p.node(1);
        assertEquals(Rule.ALGORITHM, algorithm.rule());
        assertEquals(Rule.SUBROUTINE, algorithm.node(0).rule());
        assertEquals(Rule.MAIN_ALGORITHM, algorithm.node(1).rule());
    }

    @Test
    void parameter_shapes() {
        var p = parse("""
            g(n, A[], M[n][m], B[1..n], Point q)
            begin
            end
            begin
            end
            """);
        ParseTree.Node params = p.node(0).node(0).node(1);
        assertEquals(Rule.PARAMETERS, params.rule());
        assertEquals(Rule.SIMPLE_PARAMETER, params.node(0).rule());
        assertEquals(Rule.ARRAY_PARAMETER, params.node(1).rule());
        assertEquals(3, params.node(2).size());    // name + two dimensions
        assertTrue(ParseTree.is(params.node(3).node(1).child(0), Rule.RANGE));
        assertEquals(Rule.OBJECT_PARAMETER, params.node(4).rule());
    }

    @Test
    void declarations_only_before_first_statement() {
        var p = parse("""
            begin
                A[10]
                Point p
                ► comments do not close the declarations
                B[n]
                x := 1
            end
            """);
        ParseTree.Node main = p.node(0).node(0);
        ParseTree.Node decls = main.node(0);
        assertEquals(3, decls.size());
        assertEquals(Rule.ARRAY_DECLARATION, decls.node(0).rule());
        assertEquals(Rule.OBJECT_DECLARATION, decls.node(1).rule());
        assertEquals(2, main.node(1).size());       // comment + assignment
    }

    @Test
    void declaration_after_statement_is_rejected() {
        var ex = assertThrows(SyntaxException.class, () -> parse("""
            begin
                x := 1
                A[10]
            end
            """));
        assertEquals(4, ex.line());
        assertEquals("Expected ':=' after variable", ex.expected());
    }

    @Test
    void operator_chain_keeps_operator_leaves() {
        var block = mainBlock(parse("""
            begin
                x := a + b - c
            end
            """));
        ParseTree.Node chain = block.node(0).node(1);
        assertEquals(Rule.ARITHMETIC, chain.rule());
        assertEquals(5, chain.size());
        assertEquals(TokenType.MINUS, chain.token(3).type());
    }

    @Test
    void single_operand_creates_no_chain_node() {
        var block = mainBlock(parse("""
            begin
                x := 42
            end
            """));
        assertInstanceOf(ParseTree.Leaf.class, block.node(0).child(1));
    }

    @Test
    void statements_of_every_kind() {
        var block = mainBlock(parse("""
            begin
                for i := 1 to n do
                begin
                    A[i] := 0
                end
                while i > 0 do
                begin
                    i := i - 1
                end
                repeat
                    i := i + 1
                until i >= n
                if i = n then
                begin
                    call f(i, n)
                end
                else
                begin
                    return NULL
                end
            end
            """));
        assertEquals(Rule.FOR_LOOP, block.node(0).rule());
        assertEquals(Rule.WHILE_LOOP, block.node(1).rule());
        assertEquals(Rule.REPEAT_LOOP, block.node(2).rule());
        assertEquals(Rule.IF_STATEMENT, block.node(3).rule());
        assertEquals(3, block.node(3).size());
    }

    @Test
    void missing_then_reports_position() {
        var ex = assertThrows(SyntaxException.class, () -> parse("""
            begin
                if n <= 1
                begin
                    return 1
                end
            end
            """));
        assertEquals(3, ex.line());
        assertEquals(5, ex.column());
        assertEquals("Expected 'then' after if condition", ex.expected());
        assertTrue(ex.getMessage().startsWith("[3:5]"));
    }

    @Test
    void unclosed_block_reports_end_of_input() {
        var ex = assertThrows(SyntaxException.class, () -> parse("""
            begin
                x := 1
            """));
        assertEquals("end of input", ex.found());
    }

    @Test
    void block_without_begin_is_rejected() {
        assertThrows(SyntaxException.class, () -> parse("""
            begin
                while x do
                    x := x - 1
            end
            """));
    }
}
