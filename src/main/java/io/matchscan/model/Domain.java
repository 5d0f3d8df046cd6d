package io.matchscan.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The exhaustive partition of a type into disjoint value classes.
 * <p>
 * A nullable domain is kept as {@code null} crossed with the inner domain rather than a flat list;
 * {@link #leaves()} gives the flattened enumeration the coverage engine walks.
 */
public sealed interface Domain permits Domain.Finite, Domain.Nullable, Domain.Unbounded {

    /**
     * Leaf classes in declaration order. Pairwise disjoint, union is the whole type.
     */
    List<ValueClass> leaves();

    String typeName();

    /**
     * True if no finite set of closing predicates can cover this domain.
     */
    default boolean isUnbounded() {
        return leaves().stream().anyMatch(ValueClass::isOpen);
    }

    /**
     * Finite partition: booleans, enums, sum types.
     */
    record Finite(String typeName, List<ValueClass> classes) implements Domain {
        public Finite {
            if (classes == null || classes.isEmpty()) {
                throw new IllegalArgumentException("Finite domain of " + typeName + " needs at least one class");
            }
            classes = List.copyOf(classes);
        }

        @Override
        public List<ValueClass> leaves() {
            return classes;
        }
    }

    /**
     * {@code {null} x {non-null with inner}}.
     */
    record Nullable(Domain inner) implements Domain {
        public Nullable {
            if (inner == null) {
                throw new IllegalArgumentException("inner domain cannot be null");
            }
        }

        @Override
        public String typeName() {
            return inner.typeName() + "?";
        }

        /**
         * The non-null leaves; an unbounded inner type collapses to one NON_NULL class.
         */
        public List<ValueClass> nonNullLeaves() {
            if (inner instanceof Unbounded) {
                return List.of(ValueClass.nonNull(inner.typeName()));
            }
            return inner.leaves();
        }

        @Override
        public List<ValueClass> leaves() {
            List<ValueClass> result = new ArrayList<>();
            result.add(ValueClass.nullValue(typeName()));
            result.addAll(nonNullLeaves());
            return List.copyOf(result);
        }
    }

    /**
     * A type with no closed value set.
     */
    record Unbounded(String typeName) implements Domain {
        @Override
        public List<ValueClass> leaves() {
            return List.of(ValueClass.unbounded(typeName));
        }
    }
}
