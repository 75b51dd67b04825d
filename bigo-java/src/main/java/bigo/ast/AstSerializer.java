package bigo.ast;

import bigo.ast.decl.*;
import bigo.ast.expr.*;
import bigo.ast.stmt.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts AST nodes into plain maps and lists tagged with their variant name.
 * <p>
 * Every node becomes a {@code Map} whose first entry is {@code "type"}, followed by one
 * entry per record component in declaration order. Operators render as their source symbol.
 */
public final class AstSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private AstSerializer() {}

    public static Object toTree(Object node) {
        if (node == null
                || node instanceof String
                || node instanceof Number
                || node instanceof Boolean) {
            return node;
        }
        if (node instanceof BinaryOp.Operator op) return op.symbol();
        if (node instanceof UnaryOp.Operator op) return op.symbol();
        if (node instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(toTree(item));
            }
            return out;
        }
        if (node instanceof Program p) {
            Map<String, Object> map = tagged(p);
            map.put("classes", toTree(p.classes()));
            map.put("algorithm", toTree(p.algorithm()));
            return map;
        }
        if (node instanceof Expression e) return expression(e);
        if (node instanceof Statement s) return statement(s);
        if (node instanceof Block b) {
            Map<String, Object> map = tagged(b);
            map.put("statements", toTree(b.statements()));
            return map;
        }
        return structure(node);
    }

    public static String toJson(Object node) {
        try {
            return MAPPER.writeValueAsString(toTree(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render AST as JSON", e);
        }
    }

    public static String typeName(Object node) {
        if (node instanceof NumberLiteral) return "Number";
        if (node instanceof BooleanLiteral) return "Boolean";
        if (node instanceof NullLiteral) return "Null";
        return node.getClass().getSimpleName();
    }

    // ---------- classes, subroutines, declarations ----------
    private static Map<String, Object> structure(Object node) {
        Map<String, Object> map = tagged(node);
        if (node instanceof ClassDefinition c) {
            map.put("name", c.name());
            map.put("attributes", toTree(c.attributes()));
        } else if (node instanceof Algorithm a) {
            map.put("subroutines", toTree(a.subroutines()));
            map.put("main", toTree(a.main()));
        } else if (node instanceof Subroutine s) {
            map.put("name", s.name());
            map.put("parameters", toTree(s.parameters()));
            map.put("declarations", toTree(s.declarations()));
            map.put("body", toTree(s.body()));
        } else if (node instanceof MainAlgorithm m) {
            map.put("declarations", toTree(m.declarations()));
            map.put("body", toTree(m.body()));
        } else if (node instanceof SimpleParameter p) {
            map.put("name", p.name());
        } else if (node instanceof ArrayParameter p) {
            map.put("name", p.name());
            map.put("dimensions", p.dimensions());
        } else if (node instanceof ObjectParameter p) {
            map.put("name", p.name());
            map.put("className", p.className());
        } else if (node instanceof ArrayDeclaration d) {
            map.put("name", d.name());
            map.put("size", toTree(d.size()));
        } else if (node instanceof ObjectDeclaration d) {
            map.put("name", d.name());
            map.put("className", d.className());
        } else {
            throw new IllegalArgumentException("Not an AST value: " + node.getClass().getName());
        }
        return map;
    }

    // ---------- statements ----------
    private static Map<String, Object> statement(Statement node) {
        Map<String, Object> map = tagged(node);
        if (node instanceof Assignment a) {
            map.put("target", toTree(a.target()));
            map.put("value", toTree(a.value()));
        } else if (node instanceof ForLoop f) {
            map.put("variable", f.variable());
            map.put("start", toTree(f.start()));
            map.put("end", toTree(f.end()));
            map.put("body", toTree(f.body()));
        } else if (node instanceof WhileLoop w) {
            map.put("condition", toTree(w.condition()));
            map.put("body", toTree(w.body()));
        } else if (node instanceof RepeatLoop r) {
            map.put("body", toTree(r.body()));
            map.put("condition", toTree(r.condition()));
        } else if (node instanceof IfStatement i) {
            map.put("condition", toTree(i.condition()));
            map.put("thenBlock", toTree(i.thenBlock()));
            map.put("elseBlock", toTree(i.elseBlock()));
        } else if (node instanceof CallStatement c) {
            map.put("name", c.name());
            map.put("arguments", toTree(c.arguments()));
        } else if (node instanceof ReturnStatement r) {
            map.put("value", toTree(r.value()));
        } else if (node instanceof Comment c) {
            map.put("text", c.text());
        } else {
            throw new IllegalArgumentException("Unknown statement: " + node.getClass().getName());
        }
        return map;
    }

    // ---------- expressions ----------
    private static Map<String, Object> expression(Expression node) {
        Map<String, Object> map = tagged(node);
        if (node instanceof NumberLiteral n) {
            map.put("value", n.value());
        } else if (node instanceof BooleanLiteral b) {
            map.put("value", b.value());
        } else if (node instanceof NullLiteral) {
            return map;
        } else if (node instanceof Variable v) {
            map.put("name", v.name());
            map.put("indices", toTree(v.indices()));
            map.put("field", v.field());
            map.put("fieldIndices", toTree(v.fieldIndices()));
            map.put("isRange", v.isRange());
            map.put("rangeStart", toTree(v.rangeStart()));
            map.put("rangeEnd", toTree(v.rangeEnd()));
        } else if (node instanceof BinaryOp b) {
            map.put("operator", b.operator().symbol());
            map.put("left", toTree(b.left()));
            map.put("right", toTree(b.right()));
        } else if (node instanceof UnaryOp u) {
            map.put("operator", u.operator().symbol());
            map.put("operand", toTree(u.operand()));
        } else if (node instanceof FunctionCall f) {
            map.put("name", f.name());
            map.put("arguments", toTree(f.arguments()));
        } else if (node instanceof Length l) {
            map.put("variable", toTree(l.variable()));
        } else if (node instanceof Ceiling c) {
            map.put("expression", toTree(c.expression()));
        } else if (node instanceof Floor f) {
            map.put("expression", toTree(f.expression()));
        } else {
            throw new IllegalArgumentException("Unknown expression: " + node.getClass().getName());
        }
        return map;
    }

    private static Map<String, Object> tagged(Object node) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", typeName(node));
        return map;
    }
}
