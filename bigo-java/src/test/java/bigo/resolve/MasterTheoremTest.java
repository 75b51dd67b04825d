package bigo.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class MasterTheoremTest {

    private static MasterTheoremSolution solved(String recurrence) {
        Resolution r = MasterTheorem.apply(recurrence);
        assertTrue(r.success(), () -> "expected a solution for " + recurrence + ", got " + r);
        return (MasterTheoremSolution) r;
    }

    @Test
    void merge_sort_is_case_two() {
        var s = solved("T(n) = 2T(n/2) + O(n)");
        assertEquals(2, s.caseNumber());
        assertEquals(1.0, s.logBA());
        assertEquals("n log n", s.complexity());
        assertEquals(2, s.a());
        assertEquals(2, s.b());
        assertEquals("n", s.fN());
    }

    @Test
    void binary_search_tie_at_zero_is_case_one() {
        var s = solved("T(n) = T(n/2) + O(1)");
        assertEquals(1, s.caseNumber());
        assertEquals(1, s.a());
        assertEquals(0.0, s.logBA());
        assertEquals("n^0", s.complexity());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "T(n) = 8T(n/2) + O(n^2)   | 1 | n^3",
            "T(n) = 3T(n/2) + O(n)     | 1 | n^1.58",
            "T(n) = 4T(n/2) + O(n²)    | 2 | n^2 log n",
            "T(n) = 2T(n/2) + O(n^2)   | 3 | n^2",
            "T(n) = 2 * T(n/2) + n     | 2 | n log n",
            "T(n) = 2·T(n/4) + O(n)    | 3 | n",
            "T(n) = T(n/3) + n log n   | 3 | n log n",
    })
    void classification(String recurrence, int expectedCase, String complexity) {
        var s = solved(recurrence);
        assertEquals(expectedCase, s.caseNumber());
        assertEquals(complexity, s.complexity());
    }

    @Test
    void unrecognized_order_falls_back_to_case_two() {
        var s = solved("T(n) = 2T(n/2) + O(sqrt)");
        assertEquals(2, s.caseNumber());
    }

    @Test
    void rounded_log() {
        assertEquals(1.58, solved("T(n) = 3T(n/2) + O(1)").logBA());
    }

    @Test
    void invalid_parameters_fail() {
        assertFalse(MasterTheorem.apply("T(n) = 0T(n/2) + O(n)").success());
        assertFalse(MasterTheorem.apply("T(n) = 2T(n/1) + O(n)").success());
    }

    @Test
    void unparseable_text_fails_without_throwing() {
        var r = MasterTheorem.apply("T(n) = T(n-1) + O(1)");
        var failure = assertInstanceOf(ResolutionFailure.class, r);
        assertEquals("T(n) = T(n-1) + O(1)", failure.input());
        assertNotNull(failure.error());
        assertNotNull(failure.suggestion());

        assertFalse(MasterTheorem.apply("").success());
        assertFalse(MasterTheorem.apply(null).success());
    }

    @Test
    void json_uses_case_and_log_b_a_keys() throws Exception {
        JsonNode json = new ObjectMapper().readTree(
                new ObjectMapper().writeValueAsString(solved("T(n) = 2T(n/2) + O(n)")));
        assertEquals(2, json.get("case").asInt());
        assertEquals(1.0, json.get("log_b_a").asDouble());
        assertFalse(json.has("caseNumber"));
        assertFalse(json.has("logBA"));
    }
}
