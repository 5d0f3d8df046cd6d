package io.matchscan.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One indivisible test against a single reference.
 * <p>
 * A closing predicate denotes a union of whole leaf classes of the reference's domain
 * (equality to an entry, a type test, a null test, a boolean test). A non-closing predicate
 * denotes only part of a class, e.g. {@code x == 42} on an Int; it can never complete coverage.
 *
 * @param reference   The tested reference
 * @param description Human-readable form, e.g. "status is Error"
 * @param classes     Leaf classes denoted (closing) or touched (non-closing)
 * @param closing     False for literal equality on an open domain
 */
public record AtomicPredicate(
        Reference reference,
        String description,
        Set<ValueClass> classes,
        boolean closing
) {
    public AtomicPredicate {
        if (reference == null) {
            throw new IllegalArgumentException("reference cannot be null");
        }
        if (description == null || description.isBlank()) {
            description = reference.path();
        }
        classes = classes == null ? Set.of() : java.util.Collections.unmodifiableSet(new LinkedHashSet<>(classes));
    }

    public static AtomicPredicate closing(Reference reference, String description, Set<ValueClass> classes) {
        return new AtomicPredicate(reference, description, classes, true);
    }

    public static AtomicPredicate nonClosing(Reference reference, String description, Set<ValueClass> classes) {
        return new AtomicPredicate(reference, description, classes, false);
    }

    /**
     * True if every value of {@code leaf} satisfies this predicate.
     */
    public boolean covers(ValueClass leaf) {
        return closing && classes.contains(leaf);
    }

    /**
     * True if no value can satisfy the predicate.
     */
    public boolean isUnsatisfiable() {
        return classes.isEmpty();
    }

    /**
     * Conjunction of two predicates on the same reference.
     */
    public AtomicPredicate and(AtomicPredicate other) {
        if (!reference.equals(other.reference)) {
            throw new IllegalArgumentException("Cannot intersect predicates on " + reference + " and " + other.reference);
        }
        Set<ValueClass> both = new LinkedHashSet<>(classes);
        both.retainAll(other.classes);
        return new AtomicPredicate(reference, description + " && " + other.description, both,
                closing && other.closing);
    }

    @Override
    public String toString() {
        return description;
    }
}
