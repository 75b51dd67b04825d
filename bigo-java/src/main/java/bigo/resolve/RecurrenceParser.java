package bigo.resolve;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts parameters from recurrence text.
 * <ul>
 *   <li>divide and conquer: {@code T(n) = aT(n/b) + f(n)}, with or without {@code O(...)} around f
 *       and with an optional {@code *} or {@code ·} after {@code a} (default 1)</li>
 *   <li>linear: {@code T(n) = T(n-k) + O(f(n))}</li>
 * </ul>
 */
public final class RecurrenceParser {

    private RecurrenceParser() {}

    public record DivideAndConquer(int a, int b, String fN) {}

    public record Linear(int decrement, String cost) {}

    private static final String LHS = "T\\(n\\)\\s*=\\s*";
    private static final String COEFF = "(\\d+)\\s*[*·]?\\s*";
    private static final String SPLIT = "T\\(n/(\\d+)\\)\\s*\\+\\s*";

    // tried in order; the O(...) forms first so that "O(" is not kept as part of f(n)
    private static final List<Pattern> DIVIDE_AND_CONQUER = List.of(
            Pattern.compile(LHS + COEFF + SPLIT + "O\\((.+?)\\)"),
            Pattern.compile(LHS + SPLIT + "O\\((.+?)\\)"),
            Pattern.compile(LHS + COEFF + SPLIT + "(.+)"),
            Pattern.compile(LHS + SPLIT + "(.+)")
    );

    private static final Pattern LINEAR =
            Pattern.compile(LHS + "T\\(n\\s*-\\s*(\\d+)\\)\\s*\\+\\s*O\\((.+?)\\)");

    public static Optional<DivideAndConquer> parseDivideAndConquer(String text) {
        if (text == null) return Optional.empty();
        String s = text.strip();

        for (Pattern p : DIVIDE_AND_CONQUER) {
            Matcher m = p.matcher(s);
            if (!m.find()) continue;
            try {
                if (m.groupCount() == 3) {
                    return Optional.of(new DivideAndConquer(
                            Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), m.group(3).strip()));
                }
                return Optional.of(new DivideAndConquer(1, Integer.parseInt(m.group(1)), m.group(2).strip()));
            } catch (NumberFormatException e) {
                // coefficient does not fit an int
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Linear> parseLinear(String text) {
        if (text == null) return Optional.empty();

        Matcher m = LINEAR.matcher(text.strip());
        if (!m.find()) return Optional.empty();
        try {
            return Optional.of(new Linear(Integer.parseInt(m.group(1)), m.group(2).strip()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
