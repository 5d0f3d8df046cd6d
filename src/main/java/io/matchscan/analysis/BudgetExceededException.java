package io.matchscan.analysis;

/**
 * Thrown by the coverage engine when a single query takes more recursion steps than allowed.
 * The computation holds no resources, so callers simply discard it.
 */
public class BudgetExceededException extends RuntimeException {

    private final long maxSteps;

    public BudgetExceededException(long maxSteps) {
        super("Coverage check exceeded " + maxSteps + " steps");
        this.maxSteps = maxSteps;
    }

    public long maxSteps() {
        return maxSteps;
    }
}
