package io.matchscan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolved static types of every reference a match construct mentions.
 */
public class TypeEnvironment {

    /**
     * Type and stability of one reference.
     *
     * @param type   Resolved static type
     * @param stable False when the value may change between evaluation and use
     *               (mutable property, custom getter, ...)
     */
    public record Binding(TypeShape type, boolean stable) {
        public Binding {
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null");
            }
        }
    }

    private final Map<Reference, Binding> bindings;

    private TypeEnvironment(Map<Reference, Binding> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Binding> lookup(Reference reference) {
        return Optional.ofNullable(bindings.get(reference));
    }

    public boolean isDeclared(Reference reference) {
        return bindings.containsKey(reference);
    }

    /**
     * Returns the type of a reference the front end promised to resolve.
     *
     * @throws ContractViolationException if the reference has no type
     */
    public TypeShape typeOf(Reference reference) {
        Binding binding = bindings.get(reference);
        if (binding == null) {
            throw new ContractViolationException(ContractViolationException.Kind.UNRESOLVED_REFERENCE, reference,
                    "No resolved type for reference '" + reference + "'");
        }
        return binding.type();
    }

    public boolean isStable(Reference reference) {
        Binding binding = bindings.get(reference);
        return binding != null && binding.stable();
    }

    public Set<Reference> references() {
        return bindings.keySet();
    }

    public int size() {
        return bindings.size();
    }

    public static class Builder {
        private final Map<Reference, Binding> bindings = new LinkedHashMap<>();

        public Builder declare(String path, TypeShape type) {
            return declare(Reference.of(path), type, true);
        }

        public Builder declare(Reference reference, TypeShape type) {
            return declare(reference, type, true);
        }

        public Builder declareUnstable(String path, TypeShape type) {
            return declare(Reference.of(path), type, false);
        }

        public Builder declare(Reference reference, TypeShape type, boolean stable) {
            bindings.put(reference, new Binding(type, stable));
            return this;
        }

        public TypeEnvironment build() {
            return new TypeEnvironment(bindings);
        }
    }
}
