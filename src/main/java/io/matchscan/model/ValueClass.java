package io.matchscan.model;

/**
 * One disjoint class of runtime values in a reference's domain.
 *
 * @param kind     What sort of class this is
 * @param name     Entry/variant name, or the literal for null/true/false
 * @param typeName Name of the type the class belongs to
 */
public record ValueClass(Kind kind, String name, String typeName) {

    public enum Kind {
        NULL,
        /** Every non-null value of an unbounded type. */
        NON_NULL,
        TRUE,
        FALSE,
        ENUM_ENTRY,
        /** Entries of a non-closed enum that are not declared. */
        ENUM_OTHER,
        VARIANT,
        /** Every value of an unbounded type. */
        UNBOUNDED
    }

    public ValueClass {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    public static ValueClass nullValue(String typeName) {
        return new ValueClass(Kind.NULL, "null", typeName);
    }

    public static ValueClass nonNull(String typeName) {
        return new ValueClass(Kind.NON_NULL, "non-null", typeName);
    }

    public static ValueClass bool(boolean value) {
        return new ValueClass(value ? Kind.TRUE : Kind.FALSE, String.valueOf(value), "Boolean");
    }

    public static ValueClass entry(String typeName, String entry) {
        return new ValueClass(Kind.ENUM_ENTRY, entry, typeName);
    }

    public static ValueClass otherEntry(String typeName) {
        return new ValueClass(Kind.ENUM_OTHER, "other", typeName);
    }

    public static ValueClass variant(String typeName, String variant) {
        return new ValueClass(Kind.VARIANT, variant, typeName);
    }

    public static ValueClass unbounded(String typeName) {
        return new ValueClass(Kind.UNBOUNDED, "any", typeName);
    }

    /**
     * True for classes no closing predicate can denote; only a condition silent on the
     * reference (an else, or a branch that does not test it) covers them.
     */
    public boolean isOpen() {
        return kind == Kind.UNBOUNDED || kind == Kind.ENUM_OTHER;
    }

    /**
     * Renders a predicate that selects this class, e.g. {@code status is Error}.
     *
     * @param reference The reference the class belongs to
     * @param singleton True when a variant class is a singleton (rendered as equality)
     */
    public String render(Reference reference, boolean singleton) {
        String ref = reference.path();
        return switch (kind) {
            case NULL -> ref + " == null";
            case NON_NULL -> ref + " != null";
            case TRUE, FALSE -> ref + " == " + name;
            case ENUM_ENTRY -> ref + " == " + name;
            case ENUM_OTHER -> ref + " is an undeclared " + typeName + " entry";
            case VARIANT -> singleton ? ref + " == " + name : ref + " is " + name;
            case UNBOUNDED -> ref + " is any other " + typeName + " value";
        };
    }
}
