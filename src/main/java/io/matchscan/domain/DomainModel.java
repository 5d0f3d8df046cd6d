package io.matchscan.domain;

import io.matchscan.model.Domain;
import io.matchscan.model.TypeShape;
import io.matchscan.model.TypeShape.BooleanType;
import io.matchscan.model.TypeShape.EnumType;
import io.matchscan.model.TypeShape.NullableType;
import io.matchscan.model.TypeShape.OpenType;
import io.matchscan.model.TypeShape.SumType;
import io.matchscan.model.TypeShape.Variant;
import io.matchscan.model.ValueClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the value-class partition of a resolved type.
 */
public final class DomainModel {

    private DomainModel() {
        // Utility class
    }

    /**
     * Returns the domain of a type:
     * <ul>
     *   <li>sum type: one class per leaf variant</li>
     *   <li>{@code T?}: {@code null} crossed with {@code domainOf(T)}</li>
     *   <li>boolean: {@code true}, {@code false}</li>
     *   <li>enum: one class per entry, plus "other" if the enum is not closed</li>
     *   <li>anything else: unbounded</li>
     * </ul>
     */
    public static Domain domainOf(TypeShape type) {
        if (type instanceof NullableType nullable) {
            return new Domain.Nullable(domainOf(nullable.inner()));
        }
        if (type instanceof BooleanType) {
            return new Domain.Finite("Boolean", List.of(ValueClass.bool(true), ValueClass.bool(false)));
        }
        if (type instanceof EnumType enumType) {
            List<ValueClass> classes = new ArrayList<>();
            for (String entry : enumType.entries()) {
                classes.add(ValueClass.entry(enumType.name(), entry));
            }
            if (!enumType.closed()) {
                classes.add(ValueClass.otherEntry(enumType.name()));
            }
            return new Domain.Finite(enumType.name(), classes);
        }
        if (type instanceof SumType sumType) {
            List<ValueClass> classes = new ArrayList<>();
            for (Variant leaf : sumType.leafVariants()) {
                classes.add(ValueClass.variant(sumType.name(), leaf.name()));
            }
            return new Domain.Finite(sumType.name(), classes);
        }
        if (type instanceof OpenType open) {
            return new Domain.Unbounded(open.name());
        }
        throw new IllegalArgumentException("Unknown type shape: " + type);
    }

    /**
     * Returns the non-null leaf classes of a type's domain.
     */
    public static List<ValueClass> nonNullLeaves(TypeShape type) {
        Domain domain = domainOf(type);
        if (domain instanceof Domain.Nullable nullable) {
            return nullable.nonNullLeaves();
        }
        return domain.leaves();
    }

    /**
     * True if the leaf class is a singleton variant of the given type, matched by equality.
     */
    public static boolean isSingletonVariant(TypeShape type, ValueClass valueClass) {
        if (valueClass.kind() != ValueClass.Kind.VARIANT) {
            return false;
        }
        if (TypeShape.nonNull(type) instanceof SumType sumType) {
            return sumType.findVariant(valueClass.name())
                    .map(Variant::singleton)
                    .orElse(false);
        }
        return false;
    }
}
