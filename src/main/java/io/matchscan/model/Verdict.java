package io.matchscan.model;

/**
 * Outcome of analyzing one match construct.
 * Only {@link #EXHAUSTIVE} means coverage was proven.
 */
public enum Verdict {
    /**
     * Every combination of reference values matches some branch.
     */
    EXHAUSTIVE("Exhaustive", true),

    /**
     * A concrete uncovered combination exists over finite domains.
     */
    MISSING_CASES("Missing cases", false),

    /**
     * A reference has an unbounded domain (Int, String, open enum) and no else covers it.
     */
    UNBOUNDED_DOMAIN("Unbounded domain without else", false),

    /**
     * Some branch could not be decomposed into atomic predicates.
     */
    UNANALYZABLE_BRANCH("Unanalyzable branch", false),

    /**
     * The construct exceeded the configured analysis budget.
     */
    BUDGET_EXCEEDED("Budget exceeded", false);

    private final String displayName;
    private final boolean proven;

    Verdict(String displayName, boolean proven) {
        this.displayName = displayName;
        this.proven = proven;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isProven() {
        return proven;
    }
}
