package bigo.resolve;

import bigo.resolve.RecurrenceParser.DivideAndConquer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Level-by-level accounting of the call tree of {@code T(n) = aT(n/b) + f(n)}. */
public final class RecursionTree {

    private static final Logger logger = LoggerFactory.getLogger(RecursionTree.class);

    public static final int LEVELS_SHOWN = 4;

    private RecursionTree() {}

    public static Resolution analyze(String recurrence) {
        Optional<DivideAndConquer> parsed = RecurrenceParser.parseDivideAndConquer(recurrence);
        if (parsed.isEmpty()) {
            logger.debug("Not a divide-and-conquer recurrence: {}", recurrence);
            return new ResolutionFailure(recurrence,
                    "Could not parse as a divide-and-conquer recurrence T(n) = aT(n/b) + f(n)",
                    "For T(n) = T(n-k) + O(f(n)) use the substitution method");
        }

        int a = parsed.get().a();
        int b = parsed.get().b();
        String f = parsed.get().fN();
        if (a < 1 || b < 2) {
            return new ResolutionFailure(recurrence, "A recursion tree needs a >= 1 and b >= 2 (got a=" + a + ", b=" + b + ")", null);
        }

        String depth = "log_" + b + "(n)";
        List<String> nodesPerLevel = new ArrayList<>();
        List<String> workPerLevel = new ArrayList<>();

        BigInteger nodes = BigInteger.ONE;
        BigInteger divisor = BigInteger.ONE;
        for (int level = 0; level < LEVELS_SHOWN; level++) {
            String size = level == 0 ? "n" : "n/" + divisor;
            nodesPerLevel.add("Level " + level + ": " + nodes + " nodes");

            if (f.equals("1")) {
                workPerLevel.add(nodes + " × O(1) = O(" + nodes + ")");
            } else if (f.equals("n")) {
                workPerLevel.add(nodes + " × O(" + size + ") = O(n)");
            } else {
                workPerLevel.add(nodes + " × O(" + f + ") at size " + size);
            }

            nodes = nodes.multiply(BigInteger.valueOf(a));
            divisor = divisor.multiply(BigInteger.valueOf(b));
        }

        String totalWork;
        String complexity;
        if (f.equals("n")) {
            totalWork = "O(n) per level × " + depth + " levels = O(n log n)";
            complexity = "O(n log n)";
        } else if (f.equals("1")) {
            String exponent = MasterTheorem.exponent(Math.log(a) / Math.log(b));
            totalWork = "Leaves: " + a + "^" + depth + " = n^(log_" + b + "(" + a + "))";
            complexity = "O(n^" + exponent + ")";
        } else {
            totalWork = "See the Master Theorem for the exact total";
            Resolution master = MasterTheorem.apply(recurrence);
            complexity = master instanceof MasterTheoremSolution m ? "O(" + m.complexity() + ")" : null;
        }

        List<String> steps = new ArrayList<>();
        steps.add("Tree depth: " + depth);
        steps.addAll(nodesPerLevel);
        steps.add("Total work: " + totalWork);

        return new RecursionTreeSolution(a, b, f, depth, nodesPerLevel, workPerLevel, totalWork, complexity, steps,
                "Tree with branching factor " + a + " and depth " + depth + ". O(" + f + ") work in every node.");
    }
}
