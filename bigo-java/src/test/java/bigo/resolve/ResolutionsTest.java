package bigo.resolve;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResolutionsTest {

    @Test
    void complexity_order() {
        assertTrue(ComplexityOrder.of("O(log n)") < ComplexityOrder.of("O(n)"));
        assertTrue(ComplexityOrder.of("O(n log n)") < ComplexityOrder.of("O(n²)"));
        assertEquals(ComplexityOrder.UNKNOWN, ComplexityOrder.of("O(n!)"));
        assertTrue(ComplexityOrder.COMPARATOR.compare("O(2^n)", "O(n³)") > 0);
    }

    @Test
    void tightest_ignores_failures_and_expansions() {
        Resolution master = MasterTheorem.apply("T(n) = 2T(n/2) + O(n)");            // O(n log n)
        Resolution tree = RecursionTree.analyze("T(n) = 2T(n/2) + O(n)");            // O(n log n)
        Resolution linear = SubstitutionSolver.solve("T(n) = T(n-1) + O(1)");         // O(n)
        Resolution failure = SummationSolver.simplify("nonsense");
        Resolution expansion = SubstitutionSolver.expandDivideAndConquer("T(n) = 2T(n/2) + n");

        assertEquals(linear, Resolutions.tightest(List.of(master, failure, linear, tree, expansion)).orElseThrow());
        assertEquals(master, Resolutions.tightest(List.of(master, tree)).orElseThrow());
        assertTrue(Resolutions.tightest(List.of(failure, expansion)).isEmpty());
    }

    @Test
    void master_complexity_is_wrapped() {
        assertEquals("O(n log n)", Resolutions.complexityOf(MasterTheorem.apply("T(n) = 2T(n/2) + O(n)")).orElseThrow());
    }
}
