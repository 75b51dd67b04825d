package bigo.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Closed forms for the summations that come out of loop analysis: nested triangular and
 * rectangular double sums with a constant body, and a fixed library of single sums.
 * Patterns are matched against the whole normalized text.
 */
public final class SummationSolver {

    private static final Logger logger = LoggerFactory.getLogger(SummationSolver.class);

    private record KnownSum(String name, Pattern pattern, String formula, String complexity, String description) {
        KnownSum(String name, String regex, String formula, String complexity, String description) {
            this(name, Pattern.compile(regex), formula, complexity, description);
        }
    }

    private static final List<KnownSum> LIBRARY = List.of(
            new KnownSum("constant", "Σ\\(i=1 to n\\) (O\\(1\\)|1)", "n", "O(n)",
                    "Sum of a constant n times"),
            new KnownSum("arithmetic", "Σ\\(i=1 to n\\) i", "n(n+1)/2", "O(n²)",
                    "Arithmetic series 1 + 2 + ... + n"),
            new KnownSum("squares", "Σ\\(i=1 to n\\) i\\^2", "n(n+1)(2n+1)/6", "O(n³)",
                    "Sum of squares"),
            new KnownSum("cubes", "Σ\\(i=1 to n\\) i\\^3", "[n(n+1)/2]²", "O(n⁴)",
                    "Sum of cubes"),
            new KnownSum("geometric", "Σ\\(i=1 to n\\) 2\\^i", "2^(n+1) - 2", "O(2^n)",
                    "Geometric series with ratio 2"),
            new KnownSum("geometric-log", "Σ\\(i=0 to log n\\) 2\\^i", "2n - 1", "O(n)",
                    "Geometric series up to log n")
    );

    private static final Pattern NESTED = Pattern.compile("Σ\\(i=1 to n\\)\\s*Σ\\(j=([^)]+)\\)\\s*(.+)");
    private static final Pattern BIG_O = Pattern.compile("O\\s*\\(\\s*(\\w+)\\s*\\)");

    private SummationSolver() {}

    public static Resolution simplify(String summation) {
        if (summation == null) {
            return new ResolutionFailure(null, "No summation given", null);
        }

        String normalized = normalize(summation);

        Matcher nested = NESTED.matcher(normalized);
        if (nested.matches()) {
            return solveNested(summation, nested.group(1).strip(), nested.group(2).strip());
        }

        for (KnownSum known : LIBRARY) {
            if (known.pattern().matcher(normalized).matches()) {
                return new SummationSolution(summation, known.formula(), known.complexity(), known.name(),
                        List.of(
                                "Recognized: " + known.description(),
                                "Closed form: " + known.formula(),
                                "Complexity: " + known.complexity()),
                        known.description());
            }
        }

        logger.debug("Unrecognized summation: {}", normalized);
        return new ResolutionFailure(summation,
                "Summation pattern not recognized",
                "Try the substitution method or analyze the loop bounds by hand");
    }

    /** Collapses whitespace, tightens {@code O( x )} and rewrites superscript powers. */
    static String normalize(String summation) {
        String s = String.join(" ", summation.strip().split("\\s+"));
        s = BIG_O.matcher(s).replaceAll("O($1)");
        return s.replace("²", "^2").replace("³", "^3");
    }

    private static Resolution solveNested(String original, String innerRange, String body) {
        boolean constantBody = body.equals("O(1)") || body.equals("1");

        if (innerRange.equals("1 to i") || innerRange.equals("i to n")) {
            if (constantBody) {
                return new SummationSolution(original, "n(n+1)/2", "O(n²)", "triangular",
                        List.of(
                                "Nested sum: Σ(i=1 to n) Σ(j=" + innerRange + ") O(1)",
                                "The inner sum depends on i and contributes at most i terms",
                                "Remaining: Σ(i=1 to n) i",
                                "Arithmetic series: n(n+1)/2",
                                "Therefore: O(n²)"),
                        "Triangular sum: the inner bound depends on the outer index");
            }
        } else if (innerRange.equals("1 to n")) {
            if (constantBody) {
                return new SummationSolution(original, "n²", "O(n²)", "rectangular",
                        List.of(
                                "Nested sum: Σ(i=1 to n) Σ(j=1 to n) O(1)",
                                "The inner sum gives n",
                                "Remaining: Σ(i=1 to n) n = n × n",
                                "Therefore: O(n²)"),
                        "Rectangular sum: both indices run to n independently");
            }
        }

        logger.debug("Unrecognized nested summation: j={} body={}", innerRange, body);
        return new ResolutionFailure(original,
                "Nested summation pattern not recognized",
                "Only constant bodies over 1..i, i..n or 1..n inner ranges are supported");
    }
}
