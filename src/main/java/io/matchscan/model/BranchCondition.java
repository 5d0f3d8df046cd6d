package io.matchscan.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized form of one branch's condition.
 */
public sealed interface BranchCondition
        permits BranchCondition.Conjunction, BranchCondition.Opaque, BranchCondition.Else {

    /**
     * A conjunction of atomic predicates, at most one per reference.
     * The empty conjunction is trivially true.
     */
    record Conjunction(List<AtomicPredicate> predicates) implements BranchCondition {

        public static final Conjunction TRUE = new Conjunction(List.of());

        /**
         * Predicates on the same reference are intersected; first-occurrence order is kept.
         */
        public Conjunction {
            Map<Reference, AtomicPredicate> byReference = new LinkedHashMap<>();
            if (predicates != null) {
                for (AtomicPredicate predicate : predicates) {
                    byReference.merge(predicate.reference(), predicate, AtomicPredicate::and);
                }
            }
            predicates = List.copyOf(byReference.values());
        }

        public static Conjunction of(AtomicPredicate... predicates) {
            return new Conjunction(List.of(predicates));
        }

        public Optional<AtomicPredicate> predicateOn(Reference reference) {
            return predicates.stream()
                    .filter(p -> p.reference().equals(reference))
                    .findFirst();
        }

        /**
         * Returns this conjunction with the predicate on {@code reference} removed.
         */
        public Conjunction without(Reference reference) {
            List<AtomicPredicate> rest = new ArrayList<>(predicates.size());
            for (AtomicPredicate predicate : predicates) {
                if (!predicate.reference().equals(reference)) {
                    rest.add(predicate);
                }
            }
            return rest.size() == predicates.size() ? this : new Conjunction(rest);
        }

        public List<Reference> references() {
            return predicates.stream()
                    .map(AtomicPredicate::reference)
                    .toList();
        }

        public boolean isEmpty() {
            return predicates.isEmpty();
        }

        /**
         * True when some predicate can never hold, so the branch covers nothing.
         */
        public boolean isUnsatisfiable() {
            return predicates.stream().anyMatch(AtomicPredicate::isUnsatisfiable);
        }

        @Override
        public String toString() {
            if (predicates.isEmpty()) {
                return "true";
            }
            return String.join(" && ", predicates.stream().map(AtomicPredicate::description).toList());
        }
    }

    /**
     * A condition the analyzer cannot decompose.
     *
     * @param reason Why the condition could not be normalized
     */
    record Opaque(String reason) implements BranchCondition {
        public Opaque {
            if (reason == null || reason.isBlank()) {
                reason = "unsupported condition";
            }
        }

        @Override
        public String toString() {
            return "opaque (" + reason + ")";
        }
    }

    /**
     * An unguarded else branch.
     */
    record Else() implements BranchCondition {
        public static final Else INSTANCE = new Else();

        @Override
        public String toString() {
            return "else";
        }
    }
}
