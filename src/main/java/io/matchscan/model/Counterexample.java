package io.matchscan.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One combination of reference values no branch covers.
 *
 * @param steps Chosen value class per reference, in analysis order
 */
public record Counterexample(List<Step> steps) {

    /**
     * @param reference   The reference
     * @param valueClass  The uncovered class picked for it
     * @param singleton   True when the class is a singleton variant (rendered as equality)
     * @param constrained False when no condition was left to test the reference, so any class would do
     */
    public record Step(Reference reference, ValueClass valueClass, boolean singleton, boolean constrained) {

        public Step(Reference reference, ValueClass valueClass, boolean singleton) {
            this(reference, valueClass, singleton, true);
        }

        public String render() {
            return valueClass.render(reference, singleton);
        }
    }

    public Counterexample {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * True if some constrained step picked a class only an else can cover.
     * Open classes on unconstrained steps don't count: a branch on the constrained steps alone closes the gap.
     */
    public boolean needsElse() {
        return steps.stream().anyMatch(step -> step.constrained() && step.valueClass().isOpen());
    }

    /**
     * Comma-separated form, e.g. "x != null, y != null".
     */
    public String describe() {
        return steps.stream().map(Step::render).collect(Collectors.joining(", "));
    }

    /**
     * The missing combination as a branch condition, e.g. "status is Error &amp;&amp; status.problem == UNKNOWN".
     * Unconstrained steps are left out.
     */
    public String asCondition() {
        List<Step> constrained = steps.stream().filter(Step::constrained).toList();
        if (constrained.isEmpty()) {
            return "else";
        }
        return constrained.stream().map(Step::render).collect(Collectors.joining(" && "));
    }

    /**
     * Suggestion shown to the user.
     */
    public String suggestion() {
        if (steps.stream().noneMatch(Step::constrained)) {
            return "add an else branch";
        }
        if (needsElse()) {
            return "add an else branch (no finite set of branches covers " + describe() + ")";
        }
        return "add a branch for " + asCondition();
    }

    @Override
    public String toString() {
        return describe();
    }
}
