package bigo.parser;

import bigo.lexer.Token;
import bigo.lexer.TokenType;

import java.util.List;

/**
 * Concrete parse tree: rule nodes over token leaves.
 * Keywords and punctuation are dropped; identifiers, literals, operators and comments are kept.
 */
public sealed interface ParseTree permits ParseTree.Node, ParseTree.Leaf {

    int line();

    int column();

    record Node(Rule rule, List<ParseTree> children, int line, int column) implements ParseTree {
        public Node {
            children = List.copyOf(children);
        }

        public ParseTree child(int i) {
            return children.get(i);
        }

        public Node node(int i) {
            return (Node) children.get(i);
        }

        public Token token(int i) {
            return ((Leaf) children.get(i)).token();
        }

        public int size() {
            return children.size();
        }
    }

    record Leaf(Token token) implements ParseTree {
        public TokenType type() {
            return token.type();
        }

        public String text() {
            return token.lexeme();
        }

        @Override
        public int line() {
            return token.line();
        }

        @Override
        public int column() {
            return token.column();
        }
    }

    /** True when {@code tree} is an inner node of the given rule. */
    static boolean is(ParseTree tree, Rule rule) {
        return tree instanceof Node n && n.rule() == rule;
    }
}
