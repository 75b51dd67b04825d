package bigo.analysis;

import bigo.ast.decl.Subroutine;
import bigo.ast.expr.BinaryOp;
import bigo.ast.expr.Expression;
import bigo.ast.expr.FunctionCall;
import bigo.ast.expr.UnaryOp;
import bigo.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural facts about self-recursion in a subroutine: where it calls itself, which
 * {@code if} looks like the base case, and how the recursion parameter shrinks.
 */
public final class RecursionAnalyzer {

    private RecursionAnalyzer() {}

    /** Every self-call site with its position path and printed arguments. */
    public record RecursiveCalls(int count, List<String> positions, List<List<String>> arguments) {
        public RecursiveCalls {
            positions = List.copyOf(positions);
            arguments = List.copyOf(arguments);
        }
    }

    public record BaseCase(boolean exists, String condition, String returnValue, String position) {
        public static BaseCase absent() {
            return new BaseCase(false, null, null, null);
        }
    }

    /**
     * @param pattern         one of {@code none}, {@code constant}, {@code n-1}, {@code n/2}, {@code n/b}, {@code custom}
     * @param reductionFactor {@code 0}, {@code 1}, {@code 2}, {@code b} or {@code unknown}
     * @param examples        every recursive-call argument that mentions the parameter
     */
    public record RecursionParameter(String pattern, String reductionFactor, List<String> examples) {
        public RecursionParameter {
            examples = List.copyOf(examples);
        }
    }

    // ---------- recursive calls ----------
    public static RecursiveCalls findRecursiveCalls(Subroutine sub) {
        List<String> positions = new ArrayList<>();
        List<List<String>> arguments = new ArrayList<>();
        searchCalls(sub.body(), sub.name(), "body", positions, arguments);
        return new RecursiveCalls(positions.size(), positions, arguments);
    }

    private static void searchCalls(List<Statement> stmts, String name, String path,
                                    List<String> positions, List<List<String>> arguments) {
        for (int i = 0; i < stmts.size(); i++) {
            Statement s = stmts.get(i);
            String here = path + "[" + i + "]";

            if (s instanceof CallStatement c) {
                if (c.name().equals(name)) {
                    positions.add(here + ".call");
                    arguments.add(printArgs(c.arguments()));
                }
            } else if (s instanceof ReturnStatement r) {
                for (FunctionCall call : collectCalls(r.value(), name)) {
                    positions.add(here + ".return");
                    arguments.add(printArgs(call.arguments()));
                }
            } else if (s instanceof Assignment a) {
                for (FunctionCall call : collectCalls(a.value(), name)) {
                    positions.add(here + ".assignment");
                    arguments.add(printArgs(call.arguments()));
                }
            } else if (s instanceof ForLoop f) {
                searchCalls(f.body().statements(), name, here + ".for", positions, arguments);
            } else if (s instanceof WhileLoop w) {
                searchCalls(w.body().statements(), name, here + ".while", positions, arguments);
            } else if (s instanceof RepeatLoop r) {
                searchCalls(r.body(), name, here + ".repeat", positions, arguments);
            } else if (s instanceof IfStatement ifs) {
                searchCalls(ifs.thenBlock().statements(), name, here + ".then", positions, arguments);
                if (ifs.hasElse()) {
                    searchCalls(ifs.elseBlock().statements(), name, here + ".else", positions, arguments);
                }
            }
        }
    }

    // left to right through BinaryOp/UnaryOp; a matching call is not searched further
    private static List<FunctionCall> collectCalls(Expression e, String name) {
        List<FunctionCall> found = new ArrayList<>();
        collectCalls(e, name, found);
        return found;
    }

    private static void collectCalls(Expression e, String name, List<FunctionCall> found) {
        if (e instanceof FunctionCall f) {
            if (f.name().equals(name)) found.add(f);
        } else if (e instanceof BinaryOp b) {
            collectCalls(b.left(), name, found);
            collectCalls(b.right(), name, found);
        } else if (e instanceof UnaryOp u) {
            collectCalls(u.operand(), name, found);
        }
    }

    private static List<String> printArgs(List<Expression> args) {
        List<String> out = new ArrayList<>(args.size());
        for (Expression arg : args) {
            out.add(ExpressionPrinter.print(arg));
        }
        return out;
    }

    // ---------- base case ----------
    public static BaseCase detectBaseCase(Subroutine sub) {
        List<Statement> body = sub.body();
        for (int i = 0; i < body.size(); i++) {
            if (!(body.get(i) instanceof IfStatement ifs)) continue;

            List<Statement> then = ifs.thenBlock().statements();
            if (hasRecursionInBlock(then, sub.name())) continue;

            return new BaseCase(true,
                    ExpressionPrinter.print(ifs.condition()),
                    firstReturnValue(then),
                    "body[" + i + "].then");
        }
        return BaseCase.absent();
    }

    private static String firstReturnValue(List<Statement> stmts) {
        for (Statement s : stmts) {
            if (s instanceof ReturnStatement r) return ExpressionPrinter.print(r.value());
        }
        return null;
    }

    // ---------- parameter reduction ----------
    private static final Pattern MINUS_ONE = Pattern.compile("-1(?!\\d)");
    private static final Pattern HALVING = Pattern.compile("(/|div)2(?!\\d)");

    public static RecursionParameter analyzeRecursionParameter(Subroutine sub, String param) {
        RecursiveCalls calls = findRecursiveCalls(sub);
        if (calls.count() == 0) {
            return new RecursionParameter("none", "0", List.of());
        }

        Pattern mention = Pattern.compile("\\b" + Pattern.quote(param) + "\\b");
        List<String> examples = new ArrayList<>();
        for (List<String> args : calls.arguments()) {
            for (String arg : args) {
                if (mention.matcher(arg).find()) examples.add(arg);
            }
        }
        if (examples.isEmpty()) {
            return new RecursionParameter("constant", "0", List.of());
        }

        String first = examples.get(0).replaceAll("\\s+", "");
        if (MINUS_ONE.matcher(first).find()) {
            return new RecursionParameter("n-1", "1", examples);
        }
        if (HALVING.matcher(first).find()) {
            return new RecursionParameter("n/2", "2", examples);
        }
        if (first.contains("/") || first.contains("div")) {
            return new RecursionParameter("n/b", "b", examples);
        }
        return new RecursionParameter("custom", "unknown", examples);
    }

    // ---------- shared predicates ----------

    /** True when a statement directly in {@code stmts} (not nested) calls {@code name}. */
    public static boolean hasRecursionInBlock(List<Statement> stmts, String name) {
        for (Statement s : stmts) {
            if (s instanceof CallStatement c && c.name().equals(name)) return true;
            if (s instanceof ReturnStatement r && expressionHasCall(r.value(), name)) return true;
            if (s instanceof Assignment a && expressionHasCall(a.value(), name)) return true;
        }
        return false;
    }

    public static boolean expressionHasCall(Expression e, String name) {
        if (e instanceof FunctionCall f) return f.name().equals(name);
        if (e instanceof BinaryOp b) return expressionHasCall(b.left(), name) || expressionHasCall(b.right(), name);
        if (e instanceof UnaryOp u) return expressionHasCall(u.operand(), name);
        return false;
    }
}
