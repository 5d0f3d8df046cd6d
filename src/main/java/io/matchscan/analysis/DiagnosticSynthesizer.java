package io.matchscan.analysis;

import io.matchscan.domain.DomainModel;
import io.matchscan.model.BranchCondition.Conjunction;
import io.matchscan.model.Counterexample;
import io.matchscan.model.Reference;
import io.matchscan.model.TypeShape;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds one concrete uncovered combination when coverage fails.
 * <p>
 * Walks the same partitions as {@link CoverageEngine}: at each reference it picks the first leaf
 * class (in domain order) whose partition is not covered and descends into it. Once no condition
 * is left, every later reference reports its first class as an unconstrained step.
 * <p>
 * Domain order is declaration order (null first, then entries or variants as declared, open class last),
 * not alphabetical, so the reported case follows the type's own layout.
 */
public class DiagnosticSynthesizer {

    private final CoverageEngine engine;

    public DiagnosticSynthesizer(CoverageEngine engine) {
        this.engine = engine;
    }

    /**
     * Returns a missing combination, or empty if the problem is covered.
     */
    public Optional<Counterexample> counterexample(CoverageProblem problem) {
        if (engine.coveredBy(problem)) {
            return Optional.empty();
        }

        List<Counterexample.Step> steps = new ArrayList<>();
        CoverageProblem current = problem;
        while (current.hasReferences()) {
            Reference head = current.head();
            TypeShape type = current.environment().typeOf(head);

            CoverageEngine.Partition uncovered = null;
            for (CoverageEngine.Partition partition : engine.partition(head, type, current.conditions())) {
                if (!engine.coveredBy(current.rest(partition.conditions()))) {
                    uncovered = partition;
                    break;
                }
            }
            if (uncovered == null) {
                throw new IllegalStateException("Uncovered problem has no uncovered partition at " + head);
            }
            steps.add(new Counterexample.Step(head, uncovered.valueClass(),
                    DomainModel.isSingletonVariant(type, uncovered.valueClass()),
                    !current.conditions().isEmpty()));
            current = current.rest(uncovered.conditions());
        }
        return Optional.of(new Counterexample(steps));
    }
}
