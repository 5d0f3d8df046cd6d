package io.matchscan.model;

import java.util.List;
import java.util.Optional;

/**
 * One multi-branch conditional to analyze.
 *
 * @param name        Identifier used in reports (e.g. "Renderer.kt:42")
 * @param subject     The value switched on, or null for a subject-less construct
 * @param environment Resolved types of the subject and every reference mentioned
 * @param branches    Branches in source order
 */
public record MatchConstruct(
        String name,
        Reference subject,
        TypeEnvironment environment,
        List<MatchBranch> branches
) {
    public MatchConstruct {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        branches = branches == null ? List.of() : List.copyOf(branches);
        if (subject == null) {
            for (MatchBranch branch : branches) {
                if (!branch.heads().isEmpty()) {
                    throw new IllegalArgumentException(
                            "Construct " + name + " has no subject but branch '" + branch.describe() + "' tests one");
                }
            }
        }
    }

    public Optional<Reference> subjectReference() {
        return Optional.ofNullable(subject);
    }

    public boolean hasSubject() {
        return subject != null;
    }
}
