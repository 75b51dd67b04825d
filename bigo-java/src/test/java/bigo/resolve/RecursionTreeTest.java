package bigo.resolve;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RecursionTreeTest {

    @Test
    void linear_work_per_level() {
        var t = (RecursionTreeSolution) RecursionTree.analyze("T(n) = 2T(n/2) + O(n)");
        assertEquals("log_2(n)", t.treeDepth());
        assertEquals(RecursionTree.LEVELS_SHOWN, t.nodesPerLevel().size());
        assertEquals(List.of("Level 0: 1 nodes", "Level 1: 2 nodes", "Level 2: 4 nodes", "Level 3: 8 nodes"),
                t.nodesPerLevel());
        assertEquals("4 × O(n/4) = O(n)", t.workPerLevel().get(2));
        assertEquals("O(n log n)", t.complexity());
    }

    @Test
    void constant_work_is_leaf_dominated() {
        var t = (RecursionTreeSolution) RecursionTree.analyze("T(n) = 4T(n/2) + O(1)");
        assertEquals("O(n^2)", t.complexity());
        assertTrue(t.totalWork().startsWith("Leaves"));
        assertEquals("16 × O(1) = O(16)", t.workPerLevel().get(2));
    }

    @Test
    void other_work_defers_to_master_theorem() {
        var t = (RecursionTreeSolution) RecursionTree.analyze("T(n) = 2T(n/2) + O(n^2)");
        assertEquals("O(n^2)", t.complexity());
        assertEquals("1 × O(n^2) at size n", t.workPerLevel().get(0));
    }

    @Test
    void rejects_other_shapes() {
        assertFalse(RecursionTree.analyze("T(n) = T(n-1) + O(1)").success());
        assertFalse(RecursionTree.analyze("not a recurrence").success());
        assertFalse(RecursionTree.analyze(null).success());
    }
}
