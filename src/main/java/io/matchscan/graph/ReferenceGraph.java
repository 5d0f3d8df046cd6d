package io.matchscan.graph;

import io.matchscan.model.Reference;

import java.util.*;

/**
 * Dependency graph between the references of one match construct.
 * <p>
 * A derived reference ({@code a.b}) has an edge to its nearest ancestor present in the graph
 * ({@code a}). Since every reference has at most one base, the graph is a forest.
 */
public class ReferenceGraph {

    private final List<Reference> references;               // first-occurrence order
    private final Map<Reference, Integer> firstOccurrence;
    private final Map<Reference, Reference> baseOf;          // derived -> nearest ancestor in graph
    private final Map<Reference, Set<Reference>> dependents; // base -> direct derived references

    private ReferenceGraph(List<Reference> references) {
        this.references = List.copyOf(references);
        Map<Reference, Integer> occurrence = new HashMap<>();
        for (int i = 0; i < references.size(); i++) {
            occurrence.put(references.get(i), i);
        }
        this.firstOccurrence = Map.copyOf(occurrence);

        Map<Reference, Reference> bases = new HashMap<>();
        Map<Reference, Set<Reference>> children = new HashMap<>();
        for (Reference ref : references) {
            Optional<Reference> ancestor = ref.base();
            while (ancestor.isPresent() && !occurrence.containsKey(ancestor.get())) {
                ancestor = ancestor.get().base();
            }
            if (ancestor.isPresent()) {
                bases.put(ref, ancestor.get());
                children.computeIfAbsent(ancestor.get(), k -> new LinkedHashSet<>()).add(ref);
            }
        }
        this.baseOf = Map.copyOf(bases);
        this.dependents = new HashMap<>();
        children.forEach((base, derived) -> dependents.put(base, Collections.unmodifiableSet(derived)));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns all references in first-occurrence order.
     */
    public List<Reference> references() {
        return references;
    }

    public int size() {
        return references.size();
    }

    /**
     * Returns the nearest ancestor of the reference that is part of this graph.
     */
    public Optional<Reference> baseOf(Reference reference) {
        return Optional.ofNullable(baseOf.get(reference));
    }

    /**
     * Returns the references derived directly from the given one.
     */
    public Set<Reference> dependentsOf(Reference reference) {
        return dependents.getOrDefault(reference, Set.of());
    }

    /**
     * Topological order: no reference precedes its base. Independent references keep
     * their first-occurrence order.
     */
    public List<Reference> topologicalOrder() {
        Map<Reference, Integer> inDegree = new HashMap<>();
        PriorityQueue<Reference> ready = new PriorityQueue<>(Comparator.comparingInt(firstOccurrence::get));
        for (Reference ref : references) {
            int degree = baseOf.containsKey(ref) ? 1 : 0;
            inDegree.put(ref, degree);
            if (degree == 0) {
                ready.add(ref);
            }
        }

        List<Reference> order = new ArrayList<>(references.size());
        while (!ready.isEmpty()) {
            Reference current = ready.poll();
            order.add(current);
            for (Reference derived : dependentsOf(current)) {
                if (inDegree.merge(derived, -1, Integer::sum) == 0) {
                    ready.add(derived);
                }
            }
        }
        return List.copyOf(order);
    }

    /**
     * Builder for ReferenceGraph.
     */
    public static class Builder {
        private final Set<Reference> references = new LinkedHashSet<>();

        /**
         * Adds a reference; later duplicates keep the first position.
         */
        public Builder addReference(Reference reference) {
            references.add(reference);
            return this;
        }

        public Builder addReferences(Collection<Reference> refs) {
            references.addAll(refs);
            return this;
        }

        public ReferenceGraph build() {
            return new ReferenceGraph(new ArrayList<>(references));
        }
    }
}
