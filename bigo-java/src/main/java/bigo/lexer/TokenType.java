package bigo.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    NUMBER,
    BOOL_LITERAL,
    NULL,
    COMMENT,

    // keywords
    BEGIN,
    END,
    FOR,
    TO,
    DO,
    WHILE,
    REPEAT,
    UNTIL,
    IF,
    THEN,
    ELSE,
    CALL,
    RETURN,
    LENGTH,

    // operators
    PLUS, MINUS, STAR, SLASH, CARET,
    DIV, MOD,
    ASSIGN,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    AND, OR, NOT,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    CEIL_OPEN, CEIL_CLOSE,
    FLOOR_OPEN, FLOOR_CLOSE,
    COMMA, DOT, RANGE,

    EOF
}
