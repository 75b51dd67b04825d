package bigo.resolve;

import java.util.List;

public record RecursionTreeSolution(
        int a,
        int b,
        String fN,
        String treeDepth,
        List<String> nodesPerLevel,
        List<String> workPerLevel,
        String totalWork,
        String complexity,
        List<String> steps,
        String explanation
) implements Resolution {

    public RecursionTreeSolution {
        nodesPerLevel = List.copyOf(nodesPerLevel);
        workPerLevel = List.copyOf(workPerLevel);
        steps = List.copyOf(steps);
    }

    @Override
    public boolean success() {
        return true;
    }
}
