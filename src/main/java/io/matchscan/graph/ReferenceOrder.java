package io.matchscan.graph;

import io.matchscan.model.Reference;

import java.util.List;

/**
 * Reference ordering for one construct.
 *
 * @param references        References in the order the coverage engine walks them
 * @param opaqueBranchIndex Index of an opaque branch that is not the last one, or -1
 * @param opaqueReason      Why that branch is opaque (null when {@code opaqueBranchIndex} is -1)
 */
public record ReferenceOrder(
        List<Reference> references,
        int opaqueBranchIndex,
        String opaqueReason
) {
    public ReferenceOrder {
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static ReferenceOrder of(List<Reference> references) {
        return new ReferenceOrder(references, -1, null);
    }

    public static ReferenceOrder unanalyzable(List<Reference> references, int branchIndex, String reason) {
        return new ReferenceOrder(references, branchIndex, reason);
    }

    /**
     * False when a non-final opaque branch prevents any sound reasoning about later branches.
     */
    public boolean isAnalyzable() {
        return opaqueBranchIndex < 0;
    }
}
