package io.matchscan.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of analyzing one match construct.
 *
 * @param constructName  Name of the analyzed construct
 * @param verdict        Outcome
 * @param referenceOrder References in the order the coverage engine walked them
 * @param counterexample A missing combination, when one was found (may be null)
 * @param notes          Human-readable reasons (opaque branch, budget, ...)
 */
public record AnalysisResult(
        String constructName,
        Verdict verdict,
        List<Reference> referenceOrder,
        Counterexample counterexample,
        List<String> notes
) {
    public AnalysisResult {
        if (constructName == null || constructName.isBlank()) {
            throw new IllegalArgumentException("constructName cannot be null or blank");
        }
        if (verdict == null) {
            throw new IllegalArgumentException("verdict cannot be null");
        }
        referenceOrder = referenceOrder == null ? List.of() : List.copyOf(referenceOrder);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static AnalysisResult exhaustive(String constructName, List<Reference> referenceOrder) {
        return new AnalysisResult(constructName, Verdict.EXHAUSTIVE, referenceOrder, null, List.of());
    }

    public boolean isProvenExhaustive() {
        return verdict.isProven();
    }

    public Optional<Counterexample> missingCase() {
        return Optional.ofNullable(counterexample);
    }
}
