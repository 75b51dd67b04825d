package bigo.resolve;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SubstitutionSolverTest {

    @Test
    void linear_constant_cost() {
        var s = (SubstitutionSolution) SubstitutionSolver.solve("T(n) = T(n-1) + O(1)");
        assertTrue(s.success());
        assertEquals("O(n)", s.complexity());
        assertEquals(SubstitutionSolver.DEFAULT_STEPS, s.steps().size());
        assertEquals(4, s.steps().size());
        assertEquals(List.of(
                "T(n) = T(n-1) + 1·c",
                "T(n) = T(n-2) + 2·c",
                "T(n) = T(n-3) + 3·c",
                "T(n) = T(n-4) + 4·c"
        ), s.steps());
        assertEquals("T(n) = T(0) + (n/1)·c", s.pattern());
        assertTrue(s.explanation().endsWith("Therefore: O(n)"));
    }

    @Test
    void cost_table() {
        assertEquals("O(n²)", complexity("T(n) = T(n-1) + O(n)"));
        assertEquals("O(n log n)", complexity("T(n) = T(n - 2) + O(log n)"));
        assertEquals("O(n/3·n^2)", complexity("T(n) = T(n-3) + O(n^2)"));
        assertEquals("O(n·n^2)", complexity("T(n) = T(n-1) + O(n^2)"));
    }

    private static String complexity(String recurrence) {
        return ((SubstitutionSolution) SubstitutionSolver.solve(recurrence)).complexity();
    }

    @Test
    void step_count_is_configurable() {
        var s = (SubstitutionSolution) SubstitutionSolver.solve("T(n) = T(n-2) + O(n)", 2);
        assertEquals(List.of("T(n) = T(n-2) + 1·n", "T(n) = T(n-4) + 2·n"), s.steps());
        assertEquals(2, s.decrement());
        assertEquals("n", s.cost());

        assertFalse(SubstitutionSolver.solve("T(n) = T(n-1) + O(1)", 0).success());
    }

    @Test
    void divide_and_conquer_is_not_linear() {
        var r = SubstitutionSolver.solve("T(n) = 2T(n/2) + O(n)");
        assertFalse(r.success());
        assertNotNull(((ResolutionFailure) r).suggestion());
        assertFalse(SubstitutionSolver.solve(null).success());
    }

    @Test
    void expand_divide_and_conquer() {
        var e = (DivideAndConquerExpansion) SubstitutionSolver.expandDivideAndConquer("T(n) = 2T(n/2) + n");
        assertTrue(e.success());
        assertEquals("log_2(n)", e.levels());
        assertEquals("T(n) = 2T(n/2) + n", e.steps().get(0));
        assertEquals("T(n) = 2[2T(n/4) + n/2] + n", e.steps().get(1));
        assertEquals("T(n) = 4T(n/4) + 2·n/2 + n", e.steps().get(2));
        assertNotNull(e.note());

        assertFalse(SubstitutionSolver.expandDivideAndConquer("T(n) = T(n-1) + O(1)").success());
    }

    @Test
    void zero_decrement_never_reaches_base_case() {
        Resolution r = SubstitutionSolver.solve("T(n) = T(n-0) + O(1)");
        assertFalse(r.success());
        assertTrue(((ResolutionFailure) r).error().contains("k=0"));
    }
}
