package bigo.lexer;

import bigo.parser.SyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static List<TokenType> typesNoEof(String src) {
        return lex(src).stream().filter(t -> t.type() != TokenType.EOF).map(Token::type).toList();
    }

    @Test
    void lex_operators_and_symbols() {
        var ts = typesNoEof(":= = != < > <= >= + - * / ^ ( ) { } [ ] , .");
        assertEquals(List.of(
                TokenType.ASSIGN, TokenType.EQ, TokenType.NEQ,
                TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE,
                TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.CARET,
                TokenType.LPAREN, TokenType.RPAREN, TokenType.LBRACE, TokenType.RBRACE,
                TokenType.LBRACKET, TokenType.RBRACKET, TokenType.COMMA, TokenType.DOT
        ), ts);
    }

    @Test
    void unicode_comparisons_are_normalized() {
        var ts = lex("≤ ≥ ≠");
        assertEquals("<=", ts.get(0).lexeme());
        assertEquals(">=", ts.get(1).lexeme());
        assertEquals("!=", ts.get(2).lexeme());
        assertEquals(TokenType.NEQ, ts.get(2).type());
    }

    @Test
    void lex_keywords_and_literals() {
        var ts = typesNoEof("begin end for to do while repeat until if then else call return length div mod and or not NULL T F true false");
        assertEquals(List.of(
                TokenType.BEGIN, TokenType.END, TokenType.FOR, TokenType.TO, TokenType.DO,
                TokenType.WHILE, TokenType.REPEAT, TokenType.UNTIL, TokenType.IF, TokenType.THEN,
                TokenType.ELSE, TokenType.CALL, TokenType.RETURN, TokenType.LENGTH,
                TokenType.DIV, TokenType.MOD, TokenType.AND, TokenType.OR, TokenType.NOT,
                TokenType.NULL, TokenType.BOOL_LITERAL, TokenType.BOOL_LITERAL,
                TokenType.BOOL_LITERAL, TokenType.BOOL_LITERAL
        ), ts);
    }

    @Test
    void range_is_not_a_decimal() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.RANGE, TokenType.IDENTIFIER), typesNoEof("1..n"));

        var ts = lex("3.25 7");
        assertEquals("3.25", ts.get(0).lexeme());
        assertEquals("7", ts.get(1).lexeme());
    }

    @Test
    void ceiling_and_floor_brackets() {
        assertEquals(List.of(
                TokenType.CEIL_OPEN, TokenType.IDENTIFIER, TokenType.CEIL_CLOSE,
                TokenType.FLOOR_OPEN, TokenType.IDENTIFIER, TokenType.FLOOR_CLOSE
        ), typesNoEof("┌x┐ └y┘"));
    }

    @Test
    void comment_runs_to_end_of_line() {
        var ts = lex("► swap the two halves\nx := 1");
        assertEquals(TokenType.COMMENT, ts.get(0).type());
        assertEquals("swap the two halves", ts.get(0).lexeme());
        assertEquals(TokenType.IDENTIFIER, ts.get(1).type());
        assertEquals(2, ts.get(1).line());
    }

    @Test
    void tokens_carry_line_and_column() {
        var ts = lex("begin\n  x := 10\nend");
        Token x = ts.get(1);
        assertEquals(2, x.line());
        assertEquals(3, x.column());
        Token assign = ts.get(2);
        assertEquals(5, assign.column());
    }

    @Test
    void lone_colon_is_an_error() {
        var ex = assertThrows(SyntaxException.class, () -> lex("x : 1"));
        assertEquals(1, ex.line());
        assertEquals(3, ex.column());
    }

    @Test
    void unknown_character_is_an_error() {
        var ex = assertThrows(SyntaxException.class, () -> lex("x := 1 # 2"));
        assertEquals(8, ex.column());
        assertTrue(ex.found().contains("#"));
    }
}
