package bigo.resolve;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class SummationSolverTest {

    private static SummationSolution solved(String text) {
        Resolution r = SummationSolver.simplify(text);
        assertTrue(r.success(), () -> "expected a closed form for " + text + ", got " + r);
        return (SummationSolution) r;
    }

    @Test
    void triangular_double_sum() {
        var s = solved("Σ(i=1 to n) Σ(j=1 to i) O(1)");
        assertEquals("n(n+1)/2", s.simplified());
        assertEquals("O(n²)", s.complexity());
        assertEquals("triangular", s.pattern());
    }

    @Test
    void rectangular_double_sum_has_its_own_trace() {
        var rect = solved("Σ(i=1 to n) Σ(j=1 to n) 1");
        var tri = solved("Σ(i=1 to n) Σ(j=i to n) 1");
        assertEquals("n²", rect.simplified());
        assertEquals("O(n²)", rect.complexity());
        assertEquals("rectangular", rect.pattern());
        assertNotEquals(tri.steps(), rect.steps());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Σ(i=1 to n) O(1)       | n               | O(n)",
            "Σ(i=1 to n) 1          | n               | O(n)",
            "Σ(i=1 to n) i          | n(n+1)/2        | O(n²)",
            "Σ(i=1 to n) i^2        | n(n+1)(2n+1)/6  | O(n³)",
            "Σ(i=1 to n) i²         | n(n+1)(2n+1)/6  | O(n³)",
            "Σ(i=1 to n) i^3        | [n(n+1)/2]²     | O(n⁴)",
            "Σ(i=1 to n) 2^i        | 2^(n+1) - 2     | O(2^n)",
            "Σ(i=0 to log n) 2^i    | 2n - 1          | O(n)",
    })
    void known_sums(String text, String simplified, String complexity) {
        var s = solved(text);
        assertEquals(simplified, s.simplified());
        assertEquals(complexity, s.complexity());
    }

    @Test
    void whitespace_and_big_o_are_normalized() {
        var s = solved("Σ(i=1 to n)   O( 1 )");
        assertEquals("n", s.simplified());
        assertEquals("Σ(i=1 to n)   O( 1 )", s.original());
    }

    @Test
    void unsupported_nested_body_fails() {
        var r = SummationSolver.simplify("Σ(i=1 to n) Σ(j=1 to i) j");
        assertFalse(r.success());
        assertFalse(SummationSolver.simplify("Σ(i=1 to n) Σ(j=2 to 5) 1").success());
    }

    @Test
    void unknown_sum_suggests_alternative() {
        var failure = (ResolutionFailure) SummationSolver.simplify("Σ(i=1 to n) log i");
        assertEquals("Σ(i=1 to n) log i", failure.input());
        assertNotNull(failure.suggestion());
        assertFalse(SummationSolver.simplify(null).success());
    }

    @Test
    void nested_sums_need_no_space_between_them() {
        var s = solved("Σ(i=1 to n)Σ(j=1 to i) O(1)");
        assertEquals("n(n+1)/2", s.simplified());
        assertEquals("triangular", s.pattern());
        assertEquals("n²", solved("Σ(i=1 to n)Σ(j=1 to n)1").simplified());
    }
}
