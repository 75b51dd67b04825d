package bigo.resolve;

import bigo.resolve.RecurrenceParser.DivideAndConquer;
import bigo.resolve.RecurrenceParser.Linear;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Unrolls recurrences by repeated substitution. */
public final class SubstitutionSolver {

    private static final Logger logger = LoggerFactory.getLogger(SubstitutionSolver.class);

    public static final int DEFAULT_STEPS = 4;

    private SubstitutionSolver() {}

    public static Resolution solve(String recurrence) {
        return solve(recurrence, DEFAULT_STEPS);
    }

    /** Solves {@code T(n) = T(n-k) + O(f)} showing {@code steps} unrolling steps. */
    public static Resolution solve(String recurrence, int steps) {
        if (steps < 1) {
            return new ResolutionFailure(recurrence, "At least one substitution step is required (got " + steps + ")", null);
        }

        Optional<Linear> parsed = RecurrenceParser.parseLinear(recurrence);
        if (parsed.isEmpty()) {
            logger.debug("Not a linear recurrence: {}", recurrence);
            return new ResolutionFailure(recurrence,
                    "Could not parse the recurrence; expected T(n) = T(n-k) + O(f(n))",
                    "For T(n) = aT(n/b) + f(n) use the Master Theorem or a recursion tree");
        }

        int k = parsed.get().decrement();
        String cost = parsed.get().cost();
        if (k < 1) {
            logger.debug("Decrement {} never reaches the base case: {}", k, recurrence);
            return new ResolutionFailure(recurrence,
                    "Substitution needs a decrement k >= 1 (got k=" + k + ")",
                    null);
        }
        String perLevel = cost.equals("1") ? "c" : cost;

        List<String> unrolled = new ArrayList<>(steps);
        for (int i = 1; i <= steps; i++) {
            unrolled.add("T(n) = T(n-" + ((long) i * k) + ") + " + i + "·" + perLevel);
        }
        String pattern = "T(n) = T(0) + (n/" + k + ")·" + perLevel;
        String complexity = complexityOf(k, cost);

        StringBuilder explanation = new StringBuilder()
                .append("Unrolling the recurrence ").append(steps).append(" times:\n");
        for (String step : unrolled) {
            explanation.append("  ").append(step).append('\n');
        }
        explanation.append("Pattern: ").append(pattern).append('\n')
                .append("n/").append(k).append(" levels until the base case\n")
                .append("Therefore: ").append(complexity);

        return new SubstitutionSolution(recurrence.strip(), k, cost, unrolled, pattern, complexity, explanation.toString());
    }

    static String complexityOf(int k, String cost) {
        switch (cost) {
            case "1":
                return "O(n)";
            case "n":
                return "O(n²)";
            case "log n":
                return "O(n log n)";
            default:
                String levels = k > 1 ? "n/" + k : "n";
                return "O(" + levels + "·" + cost + ")";
        }
    }

    /**
     * Expands {@code T(n) = aT(n/b) + f(n)} for a few levels. Gives the shape of the sum
     * and the level count only; the Master Theorem gives the bound.
     */
    public static Resolution expandDivideAndConquer(String recurrence) {
        Optional<DivideAndConquer> parsed = RecurrenceParser.parseDivideAndConquer(recurrence);
        if (parsed.isEmpty()) {
            logger.debug("Not a divide-and-conquer recurrence: {}", recurrence);
            return new ResolutionFailure(recurrence,
                    "Could not parse as a divide-and-conquer recurrence T(n) = aT(n/b) + f(n)",
                    "For T(n) = T(n-k) + O(f(n)) use solve");
        }

        int a = parsed.get().a();
        int b = parsed.get().b();
        String f = parsed.get().fN();
        if (a < 1 || b < 2) {
            return new ResolutionFailure(recurrence, "Expansion needs a >= 1 and b >= 2 (got a=" + a + ", b=" + b + ")", null);
        }

        long a2 = (long) a * a;
        long b2 = (long) b * b;
        String levels = "log_" + b + "(n)";
        List<String> steps = List.of(
                "T(n) = " + a + "T(n/" + b + ") + " + f,
                "T(n) = " + a + "[" + a + "T(n/" + b2 + ") + " + f + "/" + b + "] + " + f,
                "T(n) = " + a2 + "T(n/" + b2 + ") + " + a + "·" + f + "/" + b + " + " + f,
                "...",
                "Pattern: " + f + " summed on every level, " + levels + " levels"
        );

        return new DivideAndConquerExpansion(a, b, f, steps, levels,
                "Expanded 3 levels; there are " + levels + " levels in total.",
                "Use the Master Theorem for the exact bound");
    }
}
