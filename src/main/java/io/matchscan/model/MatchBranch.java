package io.matchscan.model;

import java.util.List;

/**
 * One branch of a match construct as delivered by the front end.
 *
 * @param heads  Subject tests of a subject construct ({@code Loading, is Ok ->}); more than one
 *               entry means "any of". Empty for else branches and subject-less constructs.
 * @param guard  Guard or, in a subject-less construct, the whole condition; null if absent
 * @param isElse True for {@code else} and {@code else if guard}
 * @param source Source text of the branch for diagnostics (may be null)
 */
public record MatchBranch(
        List<ConditionExpr> heads,
        ConditionExpr guard,
        boolean isElse,
        String source
) {
    public MatchBranch {
        heads = heads == null ? List.of() : List.copyOf(heads);
        if (isElse && !heads.isEmpty()) {
            throw new IllegalArgumentException("An else branch cannot have subject tests");
        }
        if (!isElse && heads.isEmpty() && guard == null) {
            throw new IllegalArgumentException("A branch needs a subject test, a condition or else");
        }
    }

    /**
     * Subject branch: {@code head1, head2 -> } with no guard.
     */
    public static MatchBranch on(ConditionExpr... heads) {
        return new MatchBranch(List.of(heads), null, false, null);
    }

    /**
     * Subject branch with a guard: {@code head if guard ->}.
     */
    public static MatchBranch guarded(ConditionExpr head, ConditionExpr guard) {
        return new MatchBranch(List.of(head), guard, false, null);
    }

    /**
     * Branch of a subject-less construct.
     */
    public static MatchBranch when(ConditionExpr condition) {
        return new MatchBranch(List.of(), condition, false, null);
    }

    public static MatchBranch otherwise() {
        return new MatchBranch(List.of(), null, true, "else");
    }

    public static MatchBranch otherwiseIf(ConditionExpr guard) {
        return new MatchBranch(List.of(), guard, true, null);
    }

    public MatchBranch withSource(String sourceText) {
        return new MatchBranch(heads, guard, isElse, sourceText);
    }

    /**
     * Text shown in diagnostics.
     */
    public String describe() {
        if (source != null && !source.isBlank()) {
            return source;
        }
        if (isElse) {
            return guard == null ? "else" : "else if " + guard;
        }
        StringBuilder sb = new StringBuilder();
        if (!heads.isEmpty()) {
            sb.append(String.join(", ", heads.stream().map(Object::toString).toList()));
            if (guard != null) {
                sb.append(" if ");
            }
        }
        if (guard != null) {
            sb.append(guard);
        }
        return sb.toString();
    }
}
