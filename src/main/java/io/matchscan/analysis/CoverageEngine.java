package io.matchscan.analysis;

import io.matchscan.domain.DomainModel;
import io.matchscan.model.AtomicPredicate;
import io.matchscan.model.BranchCondition.Conjunction;
import io.matchscan.model.Reference;
import io.matchscan.model.TypeShape;
import io.matchscan.model.ValueClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a set of conjunctions covers the cartesian product of the
 * domains of an ordered list of references.
 * <p>
 * For the head reference {@code r}, each leaf class of {@code r}'s domain gets the conditions that
 * hold for every value of that class: those silent on {@code r} and those whose predicate on
 * {@code r} denotes the class. The {@code r} predicate is stripped and the rest of the references
 * is checked recursively. The level is covered iff every class is.
 * <p>
 * Open classes (unbounded values, undeclared enum entries) are only reached by conditions silent
 * on {@code r}, so they need an else (or a branch not testing {@code r}).
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public class CoverageEngine {

    public static final long UNLIMITED = Long.MAX_VALUE;

    private final long maxSteps;

    /**
     * Conditions applying to one leaf class of the head reference, head predicate stripped.
     */
    public record Partition(ValueClass valueClass, List<Conjunction> conditions) {}

    public CoverageEngine() {
        this(UNLIMITED);
    }

    /**
     * @param maxSteps Maximum recursion steps per query before {@link BudgetExceededException}
     */
    public CoverageEngine(long maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    /**
     * Returns true iff every combination of the problem's reference values satisfies
     * at least one of its conditions.
     *
     * @throws BudgetExceededException if the step budget runs out
     */
    public boolean coveredBy(CoverageProblem problem) {
        return coveredBy(problem, new StepCounter(maxSteps));
    }

    private boolean coveredBy(CoverageProblem problem, StepCounter steps) {
        steps.tick();
        List<Conjunction> conditions = problem.conditions();
        if (conditions.isEmpty()) {
            return false;
        }
        // An else, or a branch whose predicates were all consumed, covers whatever is left
        if (conditions.stream().anyMatch(Conjunction::isEmpty)) {
            return true;
        }
        if (!problem.hasReferences()) {
            return false;
        }

        Reference head = problem.head();
        TypeShape type = problem.environment().typeOf(head);
        for (Partition partition : partition(head, type, conditions)) {
            if (!coveredBy(problem.rest(partition.conditions()), steps)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits the conditions by the leaf class of {@code head} they cover, in domain order.
     * Conditions silent on {@code head} appear in every partition; conditions whose predicate
     * on {@code head} is non-closing appear in none.
     */
    public List<Partition> partition(Reference head, TypeShape type, List<Conjunction> conditions) {
        List<ValueClass> leaves = DomainModel.domainOf(type).leaves();
        List<Partition> partitions = new ArrayList<>(leaves.size());
        for (ValueClass leaf : leaves) {
            List<Conjunction> matching = new ArrayList<>();
            for (Conjunction condition : conditions) {
                Optional<AtomicPredicate> predicate = condition.predicateOn(head);
                if (predicate.isEmpty()) {
                    matching.add(condition);
                } else if (predicate.get().covers(leaf)) {
                    matching.add(condition.without(head));
                }
            }
            partitions.add(new Partition(leaf, List.copyOf(matching)));
        }
        return partitions;
    }

    public long maxSteps() {
        return maxSteps;
    }

    /**
     * Per-query counter; keeps the engine itself stateless.
     */
    private static final class StepCounter {
        private final long limit;
        private long used;

        StepCounter(long limit) {
            this.limit = limit;
        }

        void tick() {
            if (++used > limit) {
                throw new BudgetExceededException(limit);
            }
        }
    }
}
