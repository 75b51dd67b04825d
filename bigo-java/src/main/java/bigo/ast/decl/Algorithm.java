package bigo.ast.decl;

import java.util.List;
import java.util.Objects;

public record Algorithm(
        List<Subroutine> subroutines,
        MainAlgorithm main
) {
    public Algorithm {
        subroutines = List.copyOf(subroutines);
        Objects.requireNonNull(main, "an algorithm has exactly one main block");
    }
}
