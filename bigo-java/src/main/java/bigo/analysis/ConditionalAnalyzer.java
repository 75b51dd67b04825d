package bigo.analysis;

import bigo.ast.decl.Subroutine;
import bigo.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

public final class ConditionalAnalyzer {

    private ConditionalAnalyzer() {}

    public record ConditionalInfo(
            String condition,
            String position,
            boolean hasRecursionThen,
            boolean hasRecursionElse
    ) {}

    /** Every {@code if} in depth-first order, including those nested in loops and branches. */
    public static List<ConditionalInfo> detectConditionals(Subroutine sub) {
        List<ConditionalInfo> out = new ArrayList<>();
        search(sub.body(), sub.name(), "body", out);
        return out;
    }

    private static void search(List<Statement> stmts, String name, String path, List<ConditionalInfo> out) {
        for (int i = 0; i < stmts.size(); i++) {
            Statement s = stmts.get(i);
            String here = path + "[" + i + "]";

            if (s instanceof IfStatement ifs) {
                List<Statement> then = ifs.thenBlock().statements();
                List<Statement> otherwise = ifs.hasElse() ? ifs.elseBlock().statements() : List.of();
                out.add(new ConditionalInfo(
                        ExpressionPrinter.print(ifs.condition()),
                        here,
                        RecursionAnalyzer.hasRecursionInBlock(then, name),
                        RecursionAnalyzer.hasRecursionInBlock(otherwise, name)));

                search(then, name, here + ".then", out);
                if (ifs.hasElse()) {
                    search(otherwise, name, here + ".else", out);
                }
            } else if (s instanceof ForLoop f) {
                search(f.body().statements(), name, here + ".for", out);
            } else if (s instanceof WhileLoop w) {
                search(w.body().statements(), name, here + ".while", out);
            } else if (s instanceof RepeatLoop r) {
                search(r.body(), name, here + ".repeat", out);
            }
        }
    }
}
