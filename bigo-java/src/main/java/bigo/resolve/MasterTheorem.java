package bigo.resolve;

import bigo.resolve.RecurrenceParser.DivideAndConquer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies {@code T(n) = aT(n/b) + f(n)} into the three Master Theorem cases by comparing
 * the polynomial order of {@code f(n)} with {@code c = log_b(a)}.
 */
public final class MasterTheorem {

    private static final Logger logger = LoggerFactory.getLogger(MasterTheorem.class);

    /** Tolerance when comparing the order of f(n) with log_b(a). */
    public static final double EPSILON = 0.01;

    private static final Map<String, Double> KNOWN_ORDERS = Map.of(
            "1", 0.0,
            "log n", 0.5,
            "n", 1.0,
            "n log n", 1.1,   // between linear and quadratic
            "n^2", 2.0,
            "n²", 2.0,
            "n^3", 3.0,
            "n³", 3.0
    );

    private static final Pattern POLY_EXPONENT = Pattern.compile("n\\^?(\\d+)");

    private MasterTheorem() {}

    public static Resolution apply(String recurrence) {
        Optional<DivideAndConquer> parsed = RecurrenceParser.parseDivideAndConquer(recurrence);
        if (parsed.isEmpty()) {
            logger.debug("Not a divide-and-conquer recurrence: {}", recurrence);
            return new ResolutionFailure(recurrence,
                    "Could not parse the recurrence; expected T(n) = aT(n/b) + O(f(n))",
                    "For T(n) = T(n-k) + O(f(n)) use the substitution method");
        }

        int a = parsed.get().a();
        int b = parsed.get().b();
        String fN = parsed.get().fN();
        if (a < 1 || b < 2) {
            logger.debug("Master Theorem does not apply to a={}, b={}", a, b);
            return new ResolutionFailure(recurrence,
                    "Master Theorem needs a >= 1 and b >= 2 (got a=" + a + ", b=" + b + ")",
                    null);
        }

        double c = Math.log(a) / Math.log(b);
        OptionalDouble order = orderOf(fN);
        int caseNumber = classify(order, c);

        String critical = "n^" + exponent(c);
        List<String> steps = new ArrayList<>();
        steps.add("a = " + a + ", b = " + b + ", f(n) = " + fN);
        steps.add("log_" + b + "(" + a + ") = " + String.format(Locale.ROOT, "%.2f", c));
        steps.add(order.isPresent()
                ? "Order of f(n): " + formatOrder(order.getAsDouble())
                : "Order of f(n) not recognized, treated as equal to " + critical);

        String complexity;
        String explanation;
        switch (caseNumber) {
            case 1 -> {
                complexity = critical;
                explanation = "Case 1: f(n) = O(" + fN + ") is below n^(log_" + b + "(" + a + ")) = "
                        + critical + ". Therefore T(n) = Θ(" + complexity + ")";
            }
            case 2 -> {
                complexity = Math.abs(c - 1.0) < 1e-9 ? "n log n" : critical + " log n";
                explanation = "Case 2: f(n) = Θ(" + fN + ") = Θ(n^(log_" + b + "(" + a + "))). "
                        + "Therefore T(n) = Θ(" + complexity + ")";
            }
            default -> {
                complexity = fN;
                explanation = "Case 3: f(n) = Ω(" + fN + ") dominates n^(log_" + b + "(" + a + ")) = "
                        + critical + ". Therefore T(n) = Θ(" + fN + ")";
            }
        }
        steps.add("Case " + caseNumber + ": T(n) = Θ(" + complexity + ")");

        return new MasterTheoremSolution(recurrence.strip(), caseNumber, a, b, fN,
                Math.round(c * 100.0) / 100.0, complexity, steps, explanation);
    }

    /**
     * Polynomial order of f(n): the fixed table first, then a trailing {@code n^k} exponent.
     * Empty when neither applies.
     */
    static OptionalDouble orderOf(String fN) {
        Double known = KNOWN_ORDERS.get(fN.toLowerCase(Locale.ROOT));
        if (known != null) return OptionalDouble.of(known);

        Matcher m = POLY_EXPONENT.matcher(fN);
        if (m.find()) {
            return OptionalDouble.of(Double.parseDouble(m.group(1)));
        }
        return OptionalDouble.empty();
    }

    // an unknown order falls back to case 2; the tie at c = 0 is reported as case 1
    static int classify(OptionalDouble order, double c) {
        if (order.isEmpty()) return 2;

        double f = order.getAsDouble();
        if (f < c - EPSILON) return 1;
        if (Math.abs(f - c) < EPSILON) return c < EPSILON ? 1 : 2;
        return 3;
    }

    static String exponent(double value) {
        return String.format(Locale.ROOT, "%.2f", value).replace(".00", "");
    }

    private static String formatOrder(double order) {
        return order == Math.rint(order) ? Long.toString((long) order) : Double.toString(order);
    }
}
