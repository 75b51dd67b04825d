package bigo.builder;

import bigo.ast.Program;
import bigo.ast.decl.*;
import bigo.ast.expr.*;
import bigo.ast.stmt.*;
import bigo.lexer.TokenType;
import bigo.parser.ParseTree;
import bigo.parser.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-shapes a grammar-valid {@link ParseTree} into the typed AST.
 * <p>
 * Operator chains are folded here: or/and/comparison/additive/multiplicative to the left,
 * power to the right. No semantic checks are made.
 */
public final class AstBuilder {

    private static final Logger logger = LoggerFactory.getLogger(AstBuilder.class);

    public Program build(ParseTree.Node tree) {
        expect(tree, Rule.PROGRAM);

        List<ClassDefinition> classes = new ArrayList<>();
        Algorithm algorithm = null;
        for (ParseTree child : tree.children()) {
            ParseTree.Node n = asNode(child);
            switch (n.rule()) {
                case CLASS_DEFINITION -> classes.add(buildClass(n));
                case ALGORITHM -> algorithm = buildAlgorithm(n);
                default -> throw unexpected(n);
            }
        }
        if (algorithm == null) {
            throw new IllegalStateException("Parse tree has no algorithm node");
        }

        Program program = new Program(classes, algorithm);
        logger.debug("Built program: {} classes, {} subroutines",
                classes.size(), algorithm.subroutines().size());
        return program;
    }

    // ---------- structure ----------
    private ClassDefinition buildClass(ParseTree.Node n) {
        List<String> attributes = new ArrayList<>();
        for (int i = 1; i < n.size(); i++) {
            attributes.add(n.token(i).lexeme());
        }
        return new ClassDefinition(n.token(0).lexeme(), attributes);
    }

    private Algorithm buildAlgorithm(ParseTree.Node n) {
        List<Subroutine> subroutines = new ArrayList<>();
        MainAlgorithm main = null;
        for (ParseTree child : n.children()) {
            ParseTree.Node c = asNode(child);
            switch (c.rule()) {
                case SUBROUTINE -> subroutines.add(buildSubroutine(c));
                case MAIN_ALGORITHM -> main = new MainAlgorithm(
                        buildDeclarations(c.node(0)),
                        buildBlock(c.node(1)).statements());
                default -> throw unexpected(c);
            }
        }
        return new Algorithm(subroutines, main);
    }

    private Subroutine buildSubroutine(ParseTree.Node n) {
        String name = n.token(0).lexeme();

        List<Parameter> parameters = new ArrayList<>();
        for (ParseTree p : n.node(1).children()) {
            parameters.add(buildParameter(asNode(p)));
        }

        return new Subroutine(name, parameters,
                buildDeclarations(n.node(2)),
                buildBlock(n.node(3)).statements());
    }

    private Parameter buildParameter(ParseTree.Node n) {
        return switch (n.rule()) {
            case SIMPLE_PARAMETER -> new SimpleParameter(n.token(0).lexeme());
            case ARRAY_PARAMETER -> new ArrayParameter(n.token(0).lexeme(), n.size() - 1);
            case OBJECT_PARAMETER -> new ObjectParameter(n.token(1).lexeme(), n.token(0).lexeme());
            default -> throw unexpected(n);
        };
    }

    private List<Declaration> buildDeclarations(ParseTree.Node n) {
        expect(n, Rule.DECLARATIONS);
        List<Declaration> decls = new ArrayList<>();
        for (ParseTree child : n.children()) {
            ParseTree.Node d = asNode(child);
            switch (d.rule()) {
                case ARRAY_DECLARATION -> decls.add(new ArrayDeclaration(d.token(0).lexeme(), buildExpression(d.child(1))));
                case OBJECT_DECLARATION -> decls.add(new ObjectDeclaration(d.token(1).lexeme(), d.token(0).lexeme()));
                default -> throw unexpected(d);
            }
        }
        return decls;
    }

    // ---------- statements ----------
    private Block buildBlock(ParseTree.Node n) {
        expect(n, Rule.BLOCK);
        List<Statement> stmts = new ArrayList<>();
        for (ParseTree child : n.children()) {
            stmts.add(buildStatement(asNode(child)));
        }
        return new Block(stmts);
    }

    private Statement buildStatement(ParseTree.Node n) {
        return switch (n.rule()) {
            case ASSIGNMENT -> new Assignment(buildVariable(n.node(0)), buildExpression(n.child(1)));
            case FOR_LOOP -> new ForLoop(
                    n.token(0).lexeme(),
                    buildExpression(n.child(1)),
                    buildExpression(n.child(2)),
                    buildBlock(n.node(3)));
            case WHILE_LOOP -> new WhileLoop(buildExpression(n.child(0)), buildBlock(n.node(1)));
            case REPEAT_LOOP -> new RepeatLoop(buildBlock(n.node(0)).statements(), buildExpression(n.child(1)));
            case IF_STATEMENT -> new IfStatement(
                    buildExpression(n.child(0)),
                    buildBlock(n.node(1)),
                    n.size() > 2 ? buildBlock(n.node(2)) : null);
            case CALL_STATEMENT -> new CallStatement(n.token(0).lexeme(), buildArguments(n.node(1)));
            case RETURN_STATEMENT -> new ReturnStatement(buildExpression(n.child(0)));
            case COMMENT -> new Comment(n.token(0).lexeme());
            default -> throw unexpected(n);
        };
    }

    // ---------- expressions ----------
    private Expression buildExpression(ParseTree tree) {
        if (tree instanceof ParseTree.Leaf leaf) {
            return buildLiteral(leaf);
        }

        ParseTree.Node n = (ParseTree.Node) tree;
        return switch (n.rule()) {
            case LOGICAL_OR -> foldLeft(n, BinaryOp.Operator.OR);
            case LOGICAL_AND -> foldLeft(n, BinaryOp.Operator.AND);
            case LOGICAL_NOT -> new UnaryOp(UnaryOp.Operator.NOT, buildExpression(n.child(0)));
            case COMPARISON, ARITHMETIC, TERM -> foldLeftWithOperators(n);
            case FACTOR -> new UnaryOp(
                    n.token(0).type() == TokenType.MINUS ? UnaryOp.Operator.NEG : UnaryOp.Operator.PLUS,
                    buildExpression(n.child(1)));
            case POWER -> foldRight(n);
            case VARIABLE -> buildVariable(n);
            case FUNCTION_CALL -> new FunctionCall(n.token(0).lexeme(), buildArguments(n.node(1)));
            case LENGTH -> new Length(buildVariable(n.node(0)));
            case CEILING -> new Ceiling(buildExpression(n.child(0)));
            case FLOOR -> new Floor(buildExpression(n.child(0)));
            default -> throw unexpected(n);
        };
    }

    // a or b or c  =>  ((a or b) or c)
    private Expression foldLeft(ParseTree.Node n, BinaryOp.Operator op) {
        Expression result = buildExpression(n.child(0));
        for (int i = 1; i < n.size(); i++) {
            result = new BinaryOp(op, result, buildExpression(n.child(i)));
        }
        return result;
    }

    // children alternate operand, operator leaf, operand, ...
    private Expression foldLeftWithOperators(ParseTree.Node n) {
        Expression result = buildExpression(n.child(0));
        for (int i = 1; i + 1 < n.size(); i += 2) {
            BinaryOp.Operator op = toBinOp(n.token(i).type());
            result = new BinaryOp(op, result, buildExpression(n.child(i + 1)));
        }
        return result;
    }

    // a ^ b ^ c  =>  a ^ (b ^ c)
    private Expression foldRight(ParseTree.Node n) {
        Expression result = buildExpression(n.child(n.size() - 1));
        for (int i = n.size() - 2; i >= 0; i--) {
            result = new BinaryOp(BinaryOp.Operator.POW, buildExpression(n.child(i)), result);
        }
        return result;
    }

    private Variable buildVariable(ParseTree.Node n) {
        expect(n, Rule.VARIABLE);
        String name = n.token(0).lexeme();
        if (n.size() == 1) {
            return Variable.named(name);
        }

        ParseTree.Node access = n.node(1);
        return switch (access.rule()) {
            case INDICES -> Variable.indexed(name, buildExpressions(access));
            case RANGE -> Variable.range(name, buildExpression(access.child(0)), buildExpression(access.child(1)));
            case FIELD -> Variable.field(name, access.token(0).lexeme(),
                    access.size() > 1 ? buildExpressions(access.node(1)) : List.of());
            default -> throw unexpected(access);
        };
    }

    private List<Expression> buildArguments(ParseTree.Node n) {
        expect(n, Rule.ARGUMENTS);
        return buildExpressions(n);
    }

    private List<Expression> buildExpressions(ParseTree.Node n) {
        List<Expression> exprs = new ArrayList<>();
        for (ParseTree child : n.children()) {
            exprs.add(buildExpression(child));
        }
        return exprs;
    }

    private Expression buildLiteral(ParseTree.Leaf leaf) {
        String text = leaf.text();
        return switch (leaf.type()) {
            case NUMBER -> buildNumber(text);
            case BOOL_LITERAL -> new BooleanLiteral(text.equals("T") || text.equals("true"));
            case NULL -> new NullLiteral();
            default -> throw new IllegalStateException("Unexpected token in expression position: " + leaf.token());
        };
    }

    // integers beyond the long range are kept as decimals
    private static NumberLiteral buildNumber(String text) {
        if (!text.contains(".")) {
            try {
                return NumberLiteral.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                logger.debug("Integer literal {} exceeds long range, kept as double", text);
            }
        }
        return NumberLiteral.of(Double.parseDouble(text));
    }

    // ---------- helpers ----------
    private static BinaryOp.Operator toBinOp(TokenType t) {
        return switch (t) {
            case PLUS  -> BinaryOp.Operator.ADD;
            case MINUS -> BinaryOp.Operator.SUB;
            case STAR  -> BinaryOp.Operator.MUL;
            case SLASH -> BinaryOp.Operator.DIV;
            case DIV   -> BinaryOp.Operator.INT_DIV;
            case MOD   -> BinaryOp.Operator.MOD;

            case EQ  -> BinaryOp.Operator.EQ;
            case NEQ -> BinaryOp.Operator.NE;
            case LT  -> BinaryOp.Operator.LT;
            case GT  -> BinaryOp.Operator.GT;
            case LE  -> BinaryOp.Operator.LE;
            case GE  -> BinaryOp.Operator.GE;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }

    private static ParseTree.Node asNode(ParseTree tree) {
        if (tree instanceof ParseTree.Node n) return n;
        throw new IllegalStateException("Expected a rule node at " + tree.line() + ":" + tree.column() + ", got " + tree);
    }

    private static void expect(ParseTree.Node n, Rule rule) {
        if (n.rule() != rule) {
            throw new IllegalStateException("Expected " + rule + " at " + n.line() + ":" + n.column() + ", got " + n.rule());
        }
    }

    private static IllegalStateException unexpected(ParseTree.Node n) {
        return new IllegalStateException("Unexpected " + n.rule() + " node at " + n.line() + ":" + n.column());
    }
}
