package bigo.resolve;

import java.util.List;

public record SummationSolution(
        String original,
        String simplified,
        String complexity,
        String pattern,
        List<String> steps,
        String explanation
) implements Resolution {

    public SummationSolution {
        steps = List.copyOf(steps);
    }

    @Override
    public boolean success() {
        return true;
    }
}
