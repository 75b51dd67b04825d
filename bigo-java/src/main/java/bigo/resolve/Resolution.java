package bigo.resolve;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a complexity resolver: either a method-specific solution or a
 * {@link ResolutionFailure}. Resolvers return failures instead of throwing.
 */
public sealed interface Resolution
        permits MasterTheoremSolution, SubstitutionSolution, DivideAndConquerExpansion,
        RecursionTreeSolution, SummationSolution, ResolutionFailure {

    @JsonProperty("success")
    boolean success();
}
