package bigo.resolve;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MasterTheoremSolution(
        String recurrence,
        @JsonProperty("case") int caseNumber,
        int a,
        int b,
        String fN,
        @JsonProperty("log_b_a") double logBA,        // rounded to two decimals
        String complexity,   // e.g. "n log n", "n^1.58", "n^2"
        List<String> steps,
        String explanation
) implements Resolution {

    public MasterTheoremSolution {
        steps = List.copyOf(steps);
    }

    @Override
    public boolean success() {
        return true;
    }
}
