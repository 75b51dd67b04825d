package bigo.resolve;

import java.util.List;

/** A few levels of unrolling of {@code aT(n/b) + f(n)}; no closed form is derived. */
public record DivideAndConquerExpansion(
        int a,
        int b,
        String fN,
        List<String> steps,
        String levels,
        String explanation,
        String note
) implements Resolution {

    public DivideAndConquerExpansion {
        steps = List.copyOf(steps);
    }

    @Override
    public boolean success() {
        return true;
    }
}
