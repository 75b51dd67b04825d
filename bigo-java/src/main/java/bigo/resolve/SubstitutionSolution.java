package bigo.resolve;

import java.util.List;

public record SubstitutionSolution(
        String recurrence,
        int decrement,
        String cost,
        List<String> steps,
        String pattern,
        String complexity,
        String explanation
) implements Resolution {

    public SubstitutionSolution {
        steps = List.copyOf(steps);
    }

    @Override
    public boolean success() {
        return true;
    }
}
