package bigo.parser;

import bigo.lexer.Token;
import bigo.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Predictive parser for the pseudocode grammar. Looks at most two tokens ahead and never
 * backtracks; the result is a concrete {@link ParseTree} that {@code AstBuilder} turns into the AST.
 */
public final class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public ParseTree.Node parseProgram() {
        Token start = peek();
        List<ParseTree> items = new ArrayList<>();

        while (check(TokenType.IDENTIFIER) && checkNext(TokenType.LBRACE)) {
            items.add(parseClassDefinition());
        }
        items.add(parseAlgorithm());

        consume(TokenType.EOF, "Expected end of input after the main algorithm");
        logger.debug("Parsed {} tokens into {} top-level items", tokens.size(), items.size());
        return node(Rule.PROGRAM, items, start);
    }

    // ---------- class ----------
    private ParseTree parseClassDefinition() {
        Token name = consume(TokenType.IDENTIFIER, "Expected class name");
        consume(TokenType.LBRACE, "Expected '{' after class name");

        List<ParseTree> children = new ArrayList<>();
        children.add(leaf(name));
        do {
            children.add(leaf(consume(TokenType.IDENTIFIER, "Expected attribute name")));
        } while (check(TokenType.IDENTIFIER));

        consume(TokenType.RBRACE, "Expected '}' after class attributes");
        return node(Rule.CLASS_DEFINITION, children, name);
    }

    // ---------- algorithm ----------
    private ParseTree parseAlgorithm() {
        Token start = peek();
        List<ParseTree> items = new ArrayList<>();

        while (check(TokenType.IDENTIFIER)) {
            items.add(parseSubroutine());
        }

        Token begin = consume(TokenType.BEGIN, "Expected 'begin' to open the main algorithm");
        items.add(node(Rule.MAIN_ALGORITHM, parseBody(begin), begin));
        return node(Rule.ALGORITHM, items, start);
    }

    private ParseTree parseSubroutine() {
        Token name = consume(TokenType.IDENTIFIER, "Expected subroutine name");
        Token open = consume(TokenType.LPAREN, "Expected '(' after subroutine name");

        List<ParseTree> params = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                params.add(parseParameter());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after parameters");

        Token begin = consume(TokenType.BEGIN, "Expected 'begin' to open subroutine '" + name.lexeme() + "'");

        List<ParseTree> children = new ArrayList<>();
        children.add(leaf(name));
        children.add(node(Rule.PARAMETERS, params, open));
        children.addAll(parseBody(begin));
        return node(Rule.SUBROUTINE, children, name);
    }

    private ParseTree parseParameter() {
        Token name = consume(TokenType.IDENTIFIER, "Expected parameter name");

        // ClassName p
        if (check(TokenType.IDENTIFIER)) {
            Token paramName = advance();
            return node(Rule.OBJECT_PARAMETER, List.of(leaf(name), leaf(paramName)), name);
        }

        // A[], A[n], M[n][m], A[1..n]
        if (check(TokenType.LBRACKET)) {
            List<ParseTree> children = new ArrayList<>();
            children.add(leaf(name));
            while (match(TokenType.LBRACKET)) {
                Token open = previous();
                List<ParseTree> dim = new ArrayList<>();
                if (!check(TokenType.RBRACKET)) {
                    ParseTree first = parseExpr();
                    if (match(TokenType.RANGE)) {
                        dim.add(node(Rule.RANGE, List.of(first, parseExpr()), open));
                    } else {
                        dim.add(first);
                    }
                }
                consume(TokenType.RBRACKET, "Expected ']' in array parameter");
                children.add(node(Rule.DIMENSION, dim, open));
            }
            return node(Rule.ARRAY_PARAMETER, children, name);
        }

        return node(Rule.SIMPLE_PARAMETER, List.of(leaf(name)), name);
    }

    // ---------- body: declarations then statements ----------
    private List<ParseTree> parseBody(Token begin) {
        List<ParseTree> declarations = new ArrayList<>();
        List<ParseTree> statements = new ArrayList<>();
        boolean declarationsOpen = true;

        while (!check(TokenType.END) && !check(TokenType.EOF)) {
            if (declarationsOpen && check(TokenType.IDENTIFIER)) {
                // ClassName obj
                if (checkNext(TokenType.IDENTIFIER)) {
                    Token className = advance();
                    Token objName = advance();
                    declarations.add(node(Rule.OBJECT_DECLARATION, List.of(leaf(className), leaf(objName)), className));
                    continue;
                }
                // A[n] is a declaration unless ':=' follows
                ParseTree.Node variable = parseVariable();
                if (check(TokenType.ASSIGN)) {
                    statements.add(finishAssignment(variable));
                    declarationsOpen = false;
                } else {
                    declarations.add(toArrayDeclaration(variable));
                }
                continue;
            }

            ParseTree stmt = parseStatement();
            statements.add(stmt);
            if (!ParseTree.is(stmt, Rule.COMMENT)) {
                declarationsOpen = false;
            }
        }

        consume(TokenType.END, "Expected 'end' to close 'begin' at line " + begin.line());
        return List.of(
                node(Rule.DECLARATIONS, declarations, begin),
                node(Rule.BLOCK, statements, begin)
        );
    }

    private ParseTree toArrayDeclaration(ParseTree.Node variable) {
        boolean singleIndex = variable.size() == 2
                && ParseTree.is(variable.child(1), Rule.INDICES)
                && variable.node(1).size() == 1;
        if (!singleIndex) {
            throw error(peek(), "Expected ':=' after variable");
        }
        return node(Rule.ARRAY_DECLARATION,
                List.of(variable.child(0), variable.node(1).child(0)),
                variable.line(), variable.column());
    }

    // ---------- block / statements ----------
    private ParseTree parseBlock() {
        Token begin = consume(TokenType.BEGIN, "Expected 'begin' to open a block");
        List<ParseTree> stmts = new ArrayList<>();
        while (!check(TokenType.END) && !check(TokenType.EOF)) {
            stmts.add(parseStatement());
        }
        consume(TokenType.END, "Expected 'end' to close 'begin' at line " + begin.line());
        return node(Rule.BLOCK, stmts, begin);
    }

    private ParseTree parseStatement() {
        if (check(TokenType.COMMENT)) {
            Token c = advance();
            return node(Rule.COMMENT, List.of(leaf(c)), c);
        }

        if (match(TokenType.FOR)) return parseFor(previous());
        if (match(TokenType.WHILE)) return parseWhile(previous());
        if (match(TokenType.REPEAT)) return parseRepeat(previous());
        if (match(TokenType.IF)) return parseIf(previous());
        if (match(TokenType.CALL)) return parseCall(previous());
        if (match(TokenType.RETURN)) {
            Token kw = previous();
            return node(Rule.RETURN_STATEMENT, List.of(parseExpr()), kw);
        }

        if (check(TokenType.IDENTIFIER)) {
            return finishAssignment(parseVariable());
        }

        throw error(peek(), "Expected a statement");
    }

    private ParseTree finishAssignment(ParseTree.Node variable) {
        consume(TokenType.ASSIGN, "Expected ':=' after variable");
        ParseTree value = parseExpr();
        return node(Rule.ASSIGNMENT, List.of(variable, value), variable.line(), variable.column());
    }

    private ParseTree parseFor(Token kw) {
        Token var = consume(TokenType.IDENTIFIER, "Expected loop variable after 'for'");
        consume(TokenType.ASSIGN, "Expected ':=' after loop variable");
        ParseTree from = parseExpr();
        consume(TokenType.TO, "Expected 'to' in for loop");
        ParseTree to = parseExpr();
        consume(TokenType.DO, "Expected 'do' after for bounds");
        ParseTree body = parseBlock();
        return node(Rule.FOR_LOOP, List.of(leaf(var), from, to, body), kw);
    }

    private ParseTree parseWhile(Token kw) {
        ParseTree cond = parseExpr();
        consume(TokenType.DO, "Expected 'do' after while condition");
        ParseTree body = parseBlock();
        return node(Rule.WHILE_LOOP, List.of(cond, body), kw);
    }

    private ParseTree parseRepeat(Token kw) {
        List<ParseTree> stmts = new ArrayList<>();
        do {
            stmts.add(parseStatement());
        } while (!check(TokenType.UNTIL) && !check(TokenType.EOF));
        consume(TokenType.UNTIL, "Expected 'until' to close 'repeat' at line " + kw.line());
        ParseTree cond = parseExpr();
        return node(Rule.REPEAT_LOOP, List.of(node(Rule.BLOCK, stmts, kw), cond), kw);
    }

    private ParseTree parseIf(Token kw) {
        ParseTree cond = parseExpr();
        consume(TokenType.THEN, "Expected 'then' after if condition");
        ParseTree thenB = parseBlock();

        if (match(TokenType.ELSE)) {
            ParseTree elseB = parseBlock();
            return node(Rule.IF_STATEMENT, List.of(cond, thenB, elseB), kw);
        }
        return node(Rule.IF_STATEMENT, List.of(cond, thenB), kw);
    }

    private ParseTree parseCall(Token kw) {
        Token name = consume(TokenType.IDENTIFIER, "Expected subroutine name after 'call'");
        consume(TokenType.LPAREN, "Expected '(' after subroutine name");
        ParseTree args = parseArguments(name);
        consume(TokenType.RPAREN, "Expected ')' after arguments");
        return node(Rule.CALL_STATEMENT, List.of(leaf(name), args), kw);
    }

    private ParseTree parseArguments(Token at) {
        List<ParseTree> args = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                args.add(parseExpr());
            } while (match(TokenType.COMMA));
        }
        return node(Rule.ARGUMENTS, args, at);
    }

    // ---------- expressions (one rule per precedence level) ----------
    private ParseTree parseExpr() { return parseOr(); }

    private ParseTree parseOr() {
        ParseTree first = parseAnd();
        if (!check(TokenType.OR)) return first;

        List<ParseTree> operands = new ArrayList<>();
        operands.add(first);
        while (match(TokenType.OR)) {
            operands.add(parseAnd());
        }
        return node(Rule.LOGICAL_OR, operands, first.line(), first.column());
    }

    private ParseTree parseAnd() {
        ParseTree first = parseNot();
        if (!check(TokenType.AND)) return first;

        List<ParseTree> operands = new ArrayList<>();
        operands.add(first);
        while (match(TokenType.AND)) {
            operands.add(parseNot());
        }
        return node(Rule.LOGICAL_AND, operands, first.line(), first.column());
    }

    private ParseTree parseNot() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            return node(Rule.LOGICAL_NOT, List.of(parseNot()), op);
        }
        return parseComparison();
    }

    private ParseTree parseComparison() {
        return parseChain(Rule.COMPARISON, this::parseArithmetic,
                TokenType.EQ, TokenType.NEQ, TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE);
    }

    private ParseTree parseArithmetic() {
        return parseChain(Rule.ARITHMETIC, this::parseTerm, TokenType.PLUS, TokenType.MINUS);
    }

    private ParseTree parseTerm() {
        return parseChain(Rule.TERM, this::parseFactor,
                TokenType.STAR, TokenType.SLASH, TokenType.DIV, TokenType.MOD);
    }

    /** operand (op operand)* with the operator tokens kept as leaves between operands. */
    private ParseTree parseChain(Rule rule, Operand operand, TokenType... operators) {
        ParseTree first = operand.parse();
        if (!checkAny(operators)) return first;

        List<ParseTree> items = new ArrayList<>();
        items.add(first);
        while (match(operators)) {
            items.add(leaf(previous()));
            items.add(operand.parse());
        }
        return node(rule, items, first.line(), first.column());
    }

    private ParseTree parseFactor() {
        if (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            return node(Rule.FACTOR, List.of(leaf(op), parseFactor()), op);
        }
        return parsePower();
    }

    private ParseTree parsePower() {
        ParseTree first = parseAtom();
        if (!check(TokenType.CARET)) return first;

        List<ParseTree> operands = new ArrayList<>();
        operands.add(first);
        while (match(TokenType.CARET)) {
            operands.add(parseAtom());
        }
        return node(Rule.POWER, operands, first.line(), first.column());
    }

    private ParseTree parseAtom() {
        if (match(TokenType.NUMBER, TokenType.BOOL_LITERAL, TokenType.NULL)) {
            return leaf(previous());
        }
        if (match(TokenType.LENGTH)) {
            Token kw = previous();
            consume(TokenType.LPAREN, "Expected '(' after 'length'");
            ParseTree.Node var = parseVariable();
            consume(TokenType.RPAREN, "Expected ')' after length argument");
            return node(Rule.LENGTH, List.of(var), kw);
        }
        if (match(TokenType.CEIL_OPEN)) {
            Token open = previous();
            ParseTree e = parseExpr();
            consume(TokenType.CEIL_CLOSE, "Expected '┐' to close ceiling");
            return node(Rule.CEILING, List.of(e), open);
        }
        if (match(TokenType.FLOOR_OPEN)) {
            Token open = previous();
            ParseTree e = parseExpr();
            consume(TokenType.FLOOR_CLOSE, "Expected '┘' to close floor");
            return node(Rule.FLOOR, List.of(e), open);
        }
        if (match(TokenType.LPAREN)) {
            ParseTree e = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return e;
        }
        if (check(TokenType.IDENTIFIER)) {
            if (checkNext(TokenType.LPAREN)) {
                Token name = advance();
                advance(); // (
                ParseTree args = parseArguments(name);
                consume(TokenType.RPAREN, "Expected ')' after arguments");
                return node(Rule.FUNCTION_CALL, List.of(leaf(name), args), name);
            }
            return parseVariable();
        }
        throw error(peek(), "Expected an expression");
    }

    // name | name[e]..[e] | name[e..e] | name.field[e]..
    private ParseTree.Node parseVariable() {
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        List<ParseTree> children = new ArrayList<>();
        children.add(leaf(name));

        if (match(TokenType.LBRACKET)) {
            Token open = previous();
            ParseTree first = parseExpr();
            if (match(TokenType.RANGE)) {
                ParseTree end = parseExpr();
                consume(TokenType.RBRACKET, "Expected ']' after range");
                children.add(node(Rule.RANGE, List.of(first, end), open));
            } else {
                consume(TokenType.RBRACKET, "Expected ']' after index");
                List<ParseTree> indices = new ArrayList<>();
                indices.add(first);
                indices.addAll(parseMoreIndices());
                children.add(node(Rule.INDICES, indices, open));
            }
        } else if (match(TokenType.DOT)) {
            Token field = consume(TokenType.IDENTIFIER, "Expected field name after '.'");
            List<ParseTree> fieldChildren = new ArrayList<>();
            fieldChildren.add(leaf(field));
            if (check(TokenType.LBRACKET)) {
                Token open = peek();
                fieldChildren.add(node(Rule.INDICES, parseMoreIndices(), open));
            }
            children.add(node(Rule.FIELD, fieldChildren, field));
        }

        return node(Rule.VARIABLE, children, name);
    }

    private List<ParseTree> parseMoreIndices() {
        List<ParseTree> indices = new ArrayList<>();
        while (match(TokenType.LBRACKET)) {
            indices.add(parseExpr());
            consume(TokenType.RBRACKET, "Expected ']' after index");
        }
        return indices;
    }

    // ---------- helpers ----------
    @FunctionalInterface
    private interface Operand {
        ParseTree parse();
    }

    private static ParseTree.Leaf leaf(Token t) {
        return new ParseTree.Leaf(t);
    }

    private static ParseTree.Node node(Rule rule, List<ParseTree> children, Token at) {
        return new ParseTree.Node(rule, children, at.line(), at.column());
    }

    private static ParseTree.Node node(Rule rule, List<ParseTree> children, int line, int column) {
        return new ParseTree.Node(rule, children, line, column);
    }

    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private boolean checkAny(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) return true;
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private SyntaxException error(Token at, String msg) {
        String found = at.type() == TokenType.EOF
                ? "end of input"
                : at.type() + " '" + at.lexeme() + "'";
        return new SyntaxException(at.line(), at.column(), msg, found);
    }
}
