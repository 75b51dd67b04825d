package bigo.analysis;

import bigo.ast.decl.Subroutine;
import bigo.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/** Loop inventory of a subroutine and a rough per-iteration operation count. */
public final class LoopAnalyzer {

    private LoopAnalyzer() {}

    public enum LoopKind { FOR, WHILE, REPEAT }

    public record LoopInfo(
            LoopKind type,
            String variable,
            String start,
            String end,
            int nestingLevel,
            String position
    ) {}

    public record LoopReport(int totalLoops, int maxNesting, List<LoopInfo> loops) {
        public LoopReport {
            loops = List.copyOf(loops);
        }
    }

    private static final String CONDITION_BASED = "condition-based";
    private static final String UNKNOWN = "unknown";

    public static LoopReport analyzeLoops(Subroutine sub) {
        List<LoopInfo> loops = new ArrayList<>();
        walk(sub.body(), 0, "body", loops);

        int maxNesting = 0;
        for (LoopInfo loop : loops) {
            maxNesting = Math.max(maxNesting, loop.nestingLevel());
        }
        return new LoopReport(loops.size(), maxNesting, loops);
    }

    private static void walk(List<Statement> stmts, int level, String path, List<LoopInfo> out) {
        for (int i = 0; i < stmts.size(); i++) {
            Statement s = stmts.get(i);
            String here = path + "[" + i + "]";

            if (s instanceof ForLoop f) {
                out.add(new LoopInfo(LoopKind.FOR, f.variable(),
                        ExpressionPrinter.print(f.start()), ExpressionPrinter.print(f.end()),
                        level, here));
                walk(f.body().statements(), level + 1, here + ".body", out);
            } else if (s instanceof WhileLoop w) {
                out.add(new LoopInfo(LoopKind.WHILE, CONDITION_BASED, UNKNOWN, UNKNOWN, level, here));
                walk(w.body().statements(), level + 1, here + ".body", out);
            } else if (s instanceof RepeatLoop r) {
                out.add(new LoopInfo(LoopKind.REPEAT, CONDITION_BASED, UNKNOWN, UNKNOWN, level, here));
                walk(r.body(), level + 1, here + ".body", out);
            } else if (s instanceof IfStatement ifs) {
                // branches stay on the current level
                walk(ifs.thenBlock().statements(), level, here + ".then", out);
                if (ifs.hasElse()) {
                    walk(ifs.elseBlock().statements(), level, here + ".else", out);
                }
            }
        }
    }

    /** Assignments and calls count 1, a nested loop 10; never less than 1. */
    public static int countOperationsInLoop(List<Statement> body) {
        int ops = 0;
        for (Statement s : body) {
            if (s instanceof Assignment || s instanceof CallStatement) {
                ops += 1;
            } else if (s instanceof ForLoop || s instanceof WhileLoop || s instanceof RepeatLoop) {
                ops += 10;
            }
        }
        return Math.max(ops, 1);
    }
}
