package io.matchscan.graph;

import io.matchscan.model.BranchCondition;
import io.matchscan.model.ContractViolationException;
import io.matchscan.model.Reference;
import io.matchscan.model.TypeEnvironment;
import io.matchscan.model.TypeShape;

import java.util.List;
import java.util.Optional;

/**
 * Collects the references of a construct's branch conditions and orders them so that
 * no reference precedes its base.
 */
public class ReferenceOrderer {

    /**
     * Orders the references of the given conditions.
     *
     * @param environment Resolved types of the construct
     * @param conditions  Normalized branch conditions in source order
     * @return the ordering, marked unanalyzable when an opaque branch is not the last one
     * @throws ContractViolationException if a derived reference's base has no resolved type
     */
    public ReferenceOrder order(TypeEnvironment environment, List<BranchCondition> conditions) {
        ReferenceGraph graph = buildGraph(environment, conditions);
        List<Reference> order = graph.topologicalOrder();

        for (int i = 0; i < conditions.size() - 1; i++) {
            if (conditions.get(i) instanceof BranchCondition.Opaque opaque) {
                return ReferenceOrder.unanalyzable(order, i, opaque.reason());
            }
        }
        return ReferenceOrder.of(order);
    }

    /**
     * Builds the reference graph from every conjunction; opaque and else branches add nothing.
     */
    public ReferenceGraph buildGraph(TypeEnvironment environment, List<BranchCondition> conditions) {
        ReferenceGraph.Builder builder = ReferenceGraph.builder();
        for (BranchCondition condition : conditions) {
            if (condition instanceof BranchCondition.Conjunction conjunction) {
                for (Reference ref : conjunction.references()) {
                    checkBaseKnown(environment, ref);
                    builder.addReference(ref);
                }
            }
        }
        return builder.build();
    }

    private void checkBaseKnown(TypeEnvironment environment, Reference ref) {
        environment.typeOf(ref);
        Optional<Reference> base = ref.base();
        while (base.isPresent()) {
            Reference ancestor = base.get();
            Optional<TypeEnvironment.Binding> binding = environment.lookup(ancestor);
            if (binding.isEmpty()) {
                throw new ContractViolationException(ContractViolationException.Kind.ORDERING_CONFLICT, ref,
                        "Reference '" + ref + "' is used but its base '" + ancestor + "' has no resolved type");
            }
            TypeShape baseType = TypeShape.nonNull(binding.get().type());
            if (baseType instanceof TypeShape.BooleanType) {
                throw new ContractViolationException(ContractViolationException.Kind.INVALID_TYPE, ref,
                        "Reference '" + ref + "' is a property of '" + ancestor + "' of type "
                                + binding.get().type().displayName());
            }
            base = ancestor.base();
        }
    }
}
