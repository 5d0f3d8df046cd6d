package io.matchscan.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static type of a reference, already resolved by the front end.
 * <p>
 * Only the shape needed for exhaustiveness is kept: which closed set of values
 * (if any) the type admits.
 */
public sealed interface TypeShape
        permits TypeShape.BooleanType, TypeShape.EnumType, TypeShape.SumType,
                TypeShape.NullableType, TypeShape.OpenType {

    /**
     * Display name of the type, e.g. "Status?" or "Boolean".
     */
    String displayName();

    /**
     * The boolean type.
     */
    record BooleanType() implements TypeShape {
        public static final BooleanType INSTANCE = new BooleanType();

        @Override
        public String displayName() {
            return "Boolean";
        }
    }

    /**
     * An enumerated type.
     *
     * @param name    Type name
     * @param entries Declared entries in declaration order
     * @param closed  False when values outside {@code entries} may occur (e.g. a non-sealed enum
     *                from a separately compiled library)
     */
    record EnumType(String name, List<String> entries, boolean closed) implements TypeShape {
        public EnumType {
            requireName(name);
            if (entries == null || entries.isEmpty()) {
                throw new IllegalArgumentException("Enum " + name + " must declare at least one entry");
            }
            entries = List.copyOf(new LinkedHashSet<>(entries));
        }

        public EnumType(String name, List<String> entries) {
            this(name, entries, true);
        }

        @Override
        public String displayName() {
            return name;
        }
    }

    /**
     * A sealed hierarchy (sum type).
     *
     * @param name     Type name
     * @param variants Direct subtypes in declaration order
     */
    record SumType(String name, List<Variant> variants) implements TypeShape {
        public SumType {
            requireName(name);
            if (variants == null || variants.isEmpty()) {
                throw new IllegalArgumentException("Sum type " + name + " must declare at least one variant");
            }
            variants = List.copyOf(variants);
            Set<String> seen = new LinkedHashSet<>();
            for (Variant leaf : leaves(variants)) {
                if (!seen.add(leaf.name())) {
                    throw new IllegalArgumentException("Duplicate variant " + leaf.name() + " in " + name);
                }
            }
        }

        /**
         * Returns the leaf variants in declaration order (sub-hierarchies expanded).
         */
        public List<Variant> leafVariants() {
            return leaves(variants);
        }

        /**
         * Finds a variant (leaf or sub-hierarchy) by name anywhere in the hierarchy.
         */
        public Optional<Variant> findVariant(String variantName) {
            return find(variants, variantName);
        }

        @Override
        public String displayName() {
            return name;
        }

        private static List<Variant> leaves(List<Variant> variants) {
            List<Variant> result = new ArrayList<>();
            for (Variant variant : variants) {
                if (variant.isLeaf()) {
                    result.add(variant);
                } else {
                    result.addAll(leaves(variant.subVariants()));
                }
            }
            return result;
        }

        private static Optional<Variant> find(List<Variant> variants, String variantName) {
            for (Variant variant : variants) {
                if (variant.name().equals(variantName)) {
                    return Optional.of(variant);
                }
                Optional<Variant> nested = find(variant.subVariants(), variantName);
                if (nested.isPresent()) {
                    return nested;
                }
            }
            return Optional.empty();
        }
    }

    /**
     * One subtype of a sealed hierarchy.
     *
     * @param name        Type name of the subtype
     * @param singleton   True for object/singleton subtypes that can be matched by equality
     * @param subVariants Non-empty when this subtype is itself sealed
     */
    record Variant(String name, boolean singleton, List<Variant> subVariants) {
        public Variant {
            requireName(name);
            subVariants = subVariants == null ? List.of() : List.copyOf(subVariants);
            if (singleton && !subVariants.isEmpty()) {
                throw new IllegalArgumentException("Singleton variant " + name + " cannot have subtypes");
            }
        }

        public static Variant of(String name) {
            return new Variant(name, false, List.of());
        }

        public static Variant singletonOf(String name) {
            return new Variant(name, true, List.of());
        }

        public static Variant sealed(String name, Variant... subVariants) {
            return new Variant(name, false, List.of(subVariants));
        }

        public boolean isLeaf() {
            return subVariants.isEmpty();
        }

        /**
         * Leaf names covered by a type test against this variant.
         */
        public List<String> leafNames() {
            if (isLeaf()) {
                return List.of(name);
            }
            List<String> names = new ArrayList<>();
            for (Variant sub : subVariants) {
                names.addAll(sub.leafNames());
            }
            return names;
        }
    }

    /**
     * A nullable type {@code T?}.
     */
    record NullableType(TypeShape inner) implements TypeShape {
        public NullableType {
            if (inner == null) {
                throw new IllegalArgumentException("Nullable inner type cannot be null");
            }
            // T?? is T?
            if (inner instanceof NullableType nested) {
                inner = nested.inner();
            }
        }

        @Override
        public String displayName() {
            return inner.displayName() + "?";
        }
    }

    /**
     * A type with no finite value partition (Int, String, Any, ...).
     */
    record OpenType(String name) implements TypeShape {
        public OpenType {
            requireName(name);
        }

        @Override
        public String displayName() {
            return name;
        }
    }

    /**
     * Strips one level of nullability.
     */
    static TypeShape nonNull(TypeShape type) {
        return type instanceof NullableType nullable ? nullable.inner() : type;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Type name cannot be null or blank");
        }
    }
}
