package bigo.resolve;

import java.util.Collection;
import java.util.Optional;

public final class Resolutions {

    private Resolutions() {}

    /**
     * The asymptotic bound a resolution reports, in {@code O(...)} form. Empty for failures
     * and for expansions, which carry no bound.
     */
    public static Optional<String> complexityOf(Resolution r) {
        if (r instanceof MasterTheoremSolution m) return Optional.of("O(" + m.complexity() + ")");
        if (r instanceof SubstitutionSolution s) return Optional.ofNullable(s.complexity());
        if (r instanceof RecursionTreeSolution t) return Optional.ofNullable(t.complexity());
        if (r instanceof SummationSolution s) return Optional.ofNullable(s.complexity());
        return Optional.empty();
    }

    /** The successful resolution with the smallest bound; ties keep the earliest. */
    public static Optional<Resolution> tightest(Collection<? extends Resolution> results) {
        Resolution best = null;
        String bestBound = null;
        for (Resolution r : results) {
            Optional<String> bound = complexityOf(r);
            if (!r.success() || bound.isEmpty()) continue;
            if (best == null || ComplexityOrder.COMPARATOR.compare(bound.get(), bestBound) < 0) {
                best = r;
                bestBound = bound.get();
            }
        }
        return Optional.ofNullable(best);
    }
}
