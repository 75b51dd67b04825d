package bigo.lexer;

import bigo.parser.SyntaxException;

import java.util.*;

public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("begin", TokenType.BEGIN),
            Map.entry("end", TokenType.END),
            Map.entry("for", TokenType.FOR),
            Map.entry("to", TokenType.TO),
            Map.entry("do", TokenType.DO),
            Map.entry("while", TokenType.WHILE),
            Map.entry("repeat", TokenType.REPEAT),
            Map.entry("until", TokenType.UNTIL),
            Map.entry("if", TokenType.IF),
            Map.entry("then", TokenType.THEN),
            Map.entry("else", TokenType.ELSE),
            Map.entry("call", TokenType.CALL),
            Map.entry("return", TokenType.RETURN),
            Map.entry("length", TokenType.LENGTH),
            Map.entry("div", TokenType.DIV),
            Map.entry("mod", TokenType.MOD),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),
            Map.entry("NULL", TokenType.NULL),
            Map.entry("null", TokenType.NULL),
            Map.entry("T", TokenType.BOOL_LITERAL),
            Map.entry("F", TokenType.BOOL_LITERAL),
            Map.entry("true", TokenType.BOOL_LITERAL),
            Map.entry("false", TokenType.BOOL_LITERAL)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            int startCol = col;
            int startLine = line;

            if (isAtEnd()) break;

            char c = advance();

            switch (c) {
                case '+' -> add(TokenType.PLUS, "+", startLine, startCol);
                case '-' -> add(TokenType.MINUS, "-", startLine, startCol);
                case '*' -> add(TokenType.STAR, "*", startLine, startCol);
                case '/' -> add(TokenType.SLASH, "/", startLine, startCol);
                case '^' -> add(TokenType.CARET, "^", startLine, startCol);
                case '=' -> add(TokenType.EQ, "=", startLine, startCol);

                case ':' -> {
                    if (match('=')) add(TokenType.ASSIGN, ":=", startLine, startCol);
                    else error("':=' (a lone ':' is not a token)", startLine, startCol);
                }
                case '!' -> {
                    if (match('=')) add(TokenType.NEQ, "!=", startLine, startCol);
                    else error("'!=' (a lone '!' is not a token)", startLine, startCol);
                }

                case '<' -> {
                    boolean le = match('=');
                    add(le ? TokenType.LE : TokenType.LT, le ? "<=" : "<", startLine, startCol);
                }
                case '>' -> {
                    boolean ge = match('=');
                    add(ge ? TokenType.GE : TokenType.GT, ge ? ">=" : ">", startLine, startCol);
                }
                case '≤' -> add(TokenType.LE, "<=", startLine, startCol);
                case '≥' -> add(TokenType.GE, ">=", startLine, startCol);
                case '≠' -> add(TokenType.NEQ, "!=", startLine, startCol);

                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
                case '{' -> add(TokenType.LBRACE, "{", startLine, startCol);
                case '}' -> add(TokenType.RBRACE, "}", startLine, startCol);
                case '[' -> add(TokenType.LBRACKET, "[", startLine, startCol);
                case ']' -> add(TokenType.RBRACKET, "]", startLine, startCol);
                case '┌' -> add(TokenType.CEIL_OPEN, "┌", startLine, startCol);
                case '┐' -> add(TokenType.CEIL_CLOSE, "┐", startLine, startCol);
                case '└' -> add(TokenType.FLOOR_OPEN, "└", startLine, startCol);
                case '┘' -> add(TokenType.FLOOR_CLOSE, "┘", startLine, startCol);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol);

                case '.' -> {
                    if (match('.')) add(TokenType.RANGE, "..", startLine, startCol);
                    else add(TokenType.DOT, ".", startLine, startCol);
                }

                // ► comment runs to the end of the line
                case '►' -> comment(startLine, startCol);

                default -> {
                    if (isDigit(c)) numberLiteral(c, startLine, startCol);
                    else if (isAlpha(c)) identifier(c, startLine, startCol);
                    else error("a valid token", startLine, startCol, "character '" + c + "'");
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ================= helpers =================

    private void numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }

        // "1..n" is a range, not a decimal
        if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }

        add(TokenType.NUMBER, sb.toString(), line, col);
    }

    private void identifier(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);

        add(type, text, line, col);
    }

    private void comment(int line, int col) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '\n') {
            sb.append(advance());
        }
        add(TokenType.COMMENT, sb.toString().strip(), line, col);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r' -> advance();
                case '\n' -> {
                    advance();
                    line++;
                    col = 1;
                }
                default -> { return; }
            }
        }
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        col++;
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }

    private void error(String expected, int line, int col) {
        String found = isAtEnd() ? "end of input" : "'" + source.charAt(pos - 1) + peek() + "'";
        error(expected, line, col, found);
    }

    private void error(String expected, int line, int col, String found) {
        throw new SyntaxException(line, col, "Expected " + expected, found);
    }
}
