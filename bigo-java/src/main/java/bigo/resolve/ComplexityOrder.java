package bigo.resolve;

import java.util.Comparator;
import java.util.Map;

/** Approximate growth order of a complexity string, for ranking bounds against each other. */
public final class ComplexityOrder {

    private static final Map<String, Double> ORDERS = Map.of(
            "O(1)", 0.0,
            "O(log n)", 0.5,
            "O(n)", 1.0,
            "O(n log n)", 1.5,
            "O(n²)", 2.0,
            "O(n^2)", 2.0,
            "O(n³)", 3.0,
            "O(n^3)", 3.0,
            "O(2^n)", 10.0
    );

    /** Unknown strings rank as linear. */
    public static final double UNKNOWN = 1.0;

    public static final Comparator<String> COMPARATOR = Comparator.comparingDouble(ComplexityOrder::of);

    private ComplexityOrder() {}

    public static double of(String complexity) {
        if (complexity == null) return UNKNOWN;
        return ORDERS.getOrDefault(complexity.strip(), UNKNOWN);
    }
}
