package io.matchscan.analysis;

import io.matchscan.model.BranchCondition.Conjunction;
import io.matchscan.model.Reference;
import io.matchscan.model.TypeEnvironment;

import java.util.List;

/**
 * Ordered references paired with the conjunctions still to be checked.
 *
 * @param references  References not yet partitioned, in dependency order
 * @param environment Types of those references
 * @param conditions  Remaining branch conditions (an else is the empty conjunction)
 */
public record CoverageProblem(
        List<Reference> references,
        TypeEnvironment environment,
        List<Conjunction> conditions
) {
    public CoverageProblem {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        references = references == null ? List.of() : List.copyOf(references);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /**
     * The sub-problem for the references after the head, with new conditions.
     */
    public CoverageProblem rest(List<Conjunction> remaining) {
        return new CoverageProblem(references.subList(1, references.size()), environment, remaining);
    }

    public Reference head() {
        return references.get(0);
    }

    public boolean hasReferences() {
        return !references.isEmpty();
    }
}
