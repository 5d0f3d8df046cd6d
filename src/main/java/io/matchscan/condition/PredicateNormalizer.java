package io.matchscan.condition;

import io.matchscan.domain.DomainModel;
import io.matchscan.model.AtomicPredicate;
import io.matchscan.model.BranchCondition;
import io.matchscan.model.ConditionExpr;
import io.matchscan.model.ConditionExpr.And;
import io.matchscan.model.ConditionExpr.Call;
import io.matchscan.model.ConditionExpr.Equals;
import io.matchscan.model.ConditionExpr.Literal;
import io.matchscan.model.ConditionExpr.Not;
import io.matchscan.model.ConditionExpr.Or;
import io.matchscan.model.ConditionExpr.Path;
import io.matchscan.model.ConditionExpr.TypeTest;
import io.matchscan.model.ContractViolationException;
import io.matchscan.model.MatchBranch;
import io.matchscan.model.MatchConstruct;
import io.matchscan.model.Reference;
import io.matchscan.model.TypeEnvironment;
import io.matchscan.model.TypeShape;
import io.matchscan.model.TypeShape.BooleanType;
import io.matchscan.model.TypeShape.EnumType;
import io.matchscan.model.TypeShape.NullableType;
import io.matchscan.model.TypeShape.OpenType;
import io.matchscan.model.TypeShape.SumType;
import io.matchscan.model.TypeShape.Variant;
import io.matchscan.model.ValueClass;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Converts a branch condition into a conjunction of atomic predicates keyed by reference,
 * or marks it opaque when some conjunct has an unsupported shape.
 * <p>
 * Supported conjuncts (either operand order):
 * <ul>
 *   <li>{@code r == null}, {@code r != null}</li>
 *   <li>{@code r is T}, {@code r !is T}</li>
 *   <li>{@code r == ENTRY}, {@code r != ENTRY} (enums)</li>
 *   <li>{@code r == SingletonVariant}</li>
 *   <li>{@code r == literal} (non-closing on open types)</li>
 *   <li>{@code r}, {@code !r}, {@code r == true}, {@code r != false} (booleans)</li>
 * </ul>
 * Disjunctions are only decomposed in the head of a subject branch ({@code A, is B ->});
 * anywhere else they make the branch opaque.
 */
public class PredicateNormalizer {

    /**
     * Signals that a conjunct is not an atomic predicate. Never escapes this class.
     */
    private static final class NotAtomicException extends Exception {
        NotAtomicException(String reason) {
            super(reason, null, false, false);
        }
    }

    /**
     * Normalizes every branch of a construct, in source order.
     */
    public List<BranchCondition> normalizeAll(MatchConstruct construct) {
        List<BranchCondition> conditions = new ArrayList<>(construct.branches().size());
        for (MatchBranch branch : construct.branches()) {
            conditions.add(normalize(construct, branch));
        }
        return conditions;
    }

    /**
     * Normalizes one branch.
     *
     * @throws ContractViolationException if the branch mentions a reference with no resolved type
     */
    public BranchCondition normalize(MatchConstruct construct, MatchBranch branch) {
        if (branch.isElse() && branch.guard() == null) {
            return BranchCondition.Else.INSTANCE;
        }
        TypeEnvironment env = construct.environment();
        List<AtomicPredicate> predicates = new ArrayList<>();
        try {
            if (!branch.heads().isEmpty()) {
                predicates.add(subjectTest(construct, branch.heads()));
            }
            if (branch.guard() != null) {
                for (ConditionExpr conjunct : flatten(branch.guard())) {
                    atomic(conjunct, env).ifPresent(predicates::add);
                }
            }
        } catch (NotAtomicException e) {
            return new BranchCondition.Opaque(e.getMessage());
        }
        return new BranchCondition.Conjunction(predicates);
    }

    /**
     * One predicate on the subject; several heads denote the union of their classes.
     */
    private AtomicPredicate subjectTest(MatchConstruct construct, List<ConditionExpr> heads) throws NotAtomicException {
        Reference subject = construct.subject();
        List<AtomicPredicate> alternatives = new ArrayList<>();
        for (ConditionExpr head : heads) {
            AtomicPredicate predicate = atomic(head, construct.environment())
                    .orElseThrow(() -> new NotAtomicException("constant branch head '" + head + "'"));
            if (!predicate.reference().equals(subject)) {
                throw new NotAtomicException("branch head '" + head + "' does not test the subject " + subject);
            }
            alternatives.add(predicate);
        }
        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }

        // A partial alternative adds no whole class; drop it unless nothing else is left
        List<AtomicPredicate> closing = alternatives.stream().filter(AtomicPredicate::closing).toList();
        List<AtomicPredicate> kept = closing.isEmpty() ? alternatives : closing;
        Set<ValueClass> union = new LinkedHashSet<>();
        for (AtomicPredicate alternative : kept) {
            union.addAll(alternative.classes());
        }
        String description = String.join(" || ", alternatives.stream().map(AtomicPredicate::description).toList());
        return new AtomicPredicate(subject, description, union, !closing.isEmpty());
    }

    private List<ConditionExpr> flatten(ConditionExpr expr) {
        List<ConditionExpr> conjuncts = new ArrayList<>();
        if (expr instanceof And and) {
            for (ConditionExpr operand : and.operands()) {
                conjuncts.addAll(flatten(operand));
            }
        } else {
            conjuncts.add(expr);
        }
        return conjuncts;
    }

    /**
     * Returns the predicate for one conjunct, or empty for the constant {@code true}.
     */
    private Optional<AtomicPredicate> atomic(ConditionExpr expr, TypeEnvironment env) throws NotAtomicException {
        if (expr instanceof Literal literal) {
            if (literal.equals(Literal.TRUE)) {
                return Optional.empty();
            }
            throw new NotAtomicException("constant condition '" + literal + "'");
        }
        if (expr instanceof Path path) {
            Reference ref = resolve(path, env);
            return Optional.of(booleanTest(ref, true, expr.toString(), env));
        }
        if (expr instanceof Not not) {
            return Optional.of(negated(not.operand(), env));
        }
        if (expr instanceof Equals equals) {
            return Optional.of(equality(equals, env));
        }
        if (expr instanceof TypeTest test) {
            return Optional.of(typeTest(test, env));
        }
        if (expr instanceof Or) {
            throw new NotAtomicException("disjunction '" + expr + "' in guard");
        }
        if (expr instanceof Call call) {
            throw new NotAtomicException("call to " + call.name() + "()");
        }
        if (expr instanceof And) {
            throw new NotAtomicException("nested conjunction '" + expr + "'");
        }
        throw new NotAtomicException("unsupported condition '" + expr + "'");
    }

    private AtomicPredicate negated(ConditionExpr operand, TypeEnvironment env) throws NotAtomicException {
        if (operand instanceof Path path) {
            return booleanTest(resolve(path, env), false, "!" + path, env);
        }
        if (operand instanceof Equals equals) {
            return equality(new Equals(equals.left(), equals.right(), !equals.negated()), env);
        }
        if (operand instanceof TypeTest test) {
            return typeTest(new TypeTest(test.operand(), test.typeName(), !test.negated()), env);
        }
        if (operand instanceof Not inner) {
            Optional<AtomicPredicate> predicate = atomic(inner.operand(), env);
            if (predicate.isPresent()) {
                return predicate.get();
            }
        }
        throw new NotAtomicException("negation of compound condition '" + operand + "'");
    }

    private AtomicPredicate booleanTest(Reference ref, boolean value, String description, TypeEnvironment env)
            throws NotAtomicException {
        TypeShape type = env.typeOf(ref);
        if (!(TypeShape.nonNull(type) instanceof BooleanType)) {
            throw new NotAtomicException("'" + ref + "' of type " + type.displayName() + " used as a condition");
        }
        return AtomicPredicate.closing(ref, description, Set.of(ValueClass.bool(value)));
    }

    private AtomicPredicate equality(Equals equals, TypeEnvironment env) throws NotAtomicException {
        Optional<Reference> left = declaredReference(equals.left(), env);
        Optional<Reference> right = declaredReference(equals.right(), env);
        if (left.isPresent() && right.isPresent()) {
            throw new NotAtomicException("comparison between references '" + equals + "'");
        }
        if (left.isEmpty() && right.isEmpty()) {
            if (equals.left() instanceof Path path) {
                throw unresolved(path.reference());
            }
            if (equals.right() instanceof Path path) {
                throw unresolved(path.reference());
            }
            throw new NotAtomicException("comparison between constants '" + equals + "'");
        }
        Reference ref = left.isPresent() ? left.get() : right.get();
        ConditionExpr constant = left.isPresent() ? equals.right() : equals.left();
        requireStable(ref, env);

        TypeShape type = env.typeOf(ref);
        Set<ValueClass> positive = denotedByConstant(ref, type, constant, equals);
        String description = equals.toString();

        if (constant instanceof Literal literal
                && (literal.kind() == Literal.Kind.NUMBER || literal.kind() == Literal.Kind.STRING)) {
            if (equals.negated()) {
                throw new NotAtomicException("inequality on non-enum type " + type.displayName() + " '" + equals + "'");
            }
            return AtomicPredicate.nonClosing(ref, description, positive);
        }
        if (!equals.negated()) {
            return AtomicPredicate.closing(ref, description, positive);
        }
        boolean nullTest = constant instanceof Literal literal && literal.kind() == Literal.Kind.NULL;
        boolean booleanTest = constant instanceof Literal literal && literal.kind() == Literal.Kind.BOOLEAN;
        if (!nullTest && !booleanTest && !(TypeShape.nonNull(type) instanceof EnumType)) {
            throw new NotAtomicException("inequality on non-enum type " + type.displayName() + " '" + equals + "'");
        }
        return AtomicPredicate.closing(ref, description, complement(type, positive));
    }

    /**
     * Leaf classes for which {@code ref == constant} holds.
     */
    private Set<ValueClass> denotedByConstant(Reference ref, TypeShape type, ConditionExpr constant, Equals source)
            throws NotAtomicException {
        TypeShape inner = TypeShape.nonNull(type);
        boolean nullable = type instanceof NullableType;

        if (constant instanceof Literal literal) {
            switch (literal.kind()) {
                case NULL:
                    if (!nullable) {
                        return Set.of();
                    }
                    // null is the first leaf of a nullable domain
                    return Set.of(DomainModel.domainOf(type).leaves().get(0));
                case BOOLEAN:
                    if (!(inner instanceof BooleanType)) {
                        throw new NotAtomicException("boolean literal compared with " + type.displayName() + " '" + source + "'");
                    }
                    return Set.of(ValueClass.bool(Boolean.parseBoolean(literal.text())));
                default:
                    if (!(inner instanceof OpenType)) {
                        throw new NotAtomicException("literal compared with " + type.displayName() + " '" + source + "'");
                    }
                    // A literal picks one value out of the open class
                    return Set.copyOf(DomainModel.nonNullLeaves(type));
            }
        }
        if (!(constant instanceof Path path)) {
            throw new NotAtomicException("unsupported comparison '" + source + "'");
        }
        String name = constantName(path.reference(), inner);
        if (inner instanceof EnumType enumType) {
            if (!enumType.entries().contains(name)) {
                throw new NotAtomicException(name + " is not an entry of " + enumType.name());
            }
            return Set.of(ValueClass.entry(enumType.name(), name));
        }
        if (inner instanceof SumType sumType) {
            Variant variant = sumType.findVariant(name)
                    .orElseThrow(() -> new NotAtomicException(name + " is not a subtype of " + sumType.name()));
            if (!variant.singleton()) {
                throw new NotAtomicException("equality with non-singleton subtype " + name + " '" + source + "'");
            }
            return Set.of(ValueClass.variant(sumType.name(), name));
        }
        throw new NotAtomicException("'" + ref + "' of type " + type.displayName() + " compared with " + name);
    }

    /**
     * Accepts both {@code UNKNOWN} and {@code Problem.UNKNOWN}.
     */
    private String constantName(Reference constant, TypeShape inner) {
        List<String> segments = constant.segments();
        if (segments.size() > 1 && String.join(".", segments.subList(0, segments.size() - 1)).equals(inner.displayName())) {
            return segments.get(segments.size() - 1);
        }
        return constant.path();
    }

    private AtomicPredicate typeTest(TypeTest test, TypeEnvironment env) throws NotAtomicException {
        if (!(test.operand() instanceof Path path)) {
            throw new NotAtomicException("type test on expression '" + test.operand() + "'");
        }
        Reference ref = resolve(path, env);
        TypeShape type = env.typeOf(ref);
        TypeShape inner = TypeShape.nonNull(type);
        String description = test.toString();

        Set<ValueClass> positive;
        boolean closing = true;
        if (test.typeName().equals(inner.displayName())) {
            positive = new LinkedHashSet<>(DomainModel.nonNullLeaves(type));
        } else if (inner instanceof SumType sumType) {
            Variant variant = sumType.findVariant(test.typeName())
                    .orElseThrow(() -> new NotAtomicException(test.typeName() + " is not a subtype of " + sumType.name()));
            positive = new LinkedHashSet<>();
            for (String leaf : variant.leafNames()) {
                positive.add(ValueClass.variant(sumType.name(), leaf));
            }
        } else if (inner instanceof OpenType) {
            // e.g. Any is String: some of the values, never all of them
            positive = new LinkedHashSet<>(DomainModel.nonNullLeaves(type));
            closing = false;
        } else {
            throw new NotAtomicException("type test on " + type.displayName() + " '" + test + "'");
        }

        if (!test.negated()) {
            return new AtomicPredicate(ref, description, positive, closing);
        }
        if (!closing) {
            throw new NotAtomicException("negated type test on open type " + type.displayName() + " '" + test + "'");
        }
        return AtomicPredicate.closing(ref, description, complement(type, positive));
    }

    private Set<ValueClass> complement(TypeShape type, Set<ValueClass> positive) {
        Set<ValueClass> rest = new LinkedHashSet<>(DomainModel.domainOf(type).leaves());
        rest.removeAll(positive);
        return rest;
    }

    private Optional<Reference> declaredReference(ConditionExpr expr, TypeEnvironment env) {
        if (expr instanceof Path path && env.isDeclared(path.reference())) {
            return Optional.of(path.reference());
        }
        return Optional.empty();
    }

    private Reference resolve(Path path, TypeEnvironment env) throws NotAtomicException {
        Reference ref = path.reference();
        if (!env.isDeclared(ref)) {
            throw unresolved(ref);
        }
        requireStable(ref, env);
        return ref;
    }

    private void requireStable(Reference ref, TypeEnvironment env) throws NotAtomicException {
        if (!env.isStable(ref)) {
            throw new NotAtomicException("reference '" + ref + "' is not stable");
        }
    }

    private ContractViolationException unresolved(Reference ref) {
        return new ContractViolationException(ContractViolationException.Kind.UNRESOLVED_REFERENCE, ref,
                "No resolved type for reference '" + ref + "'");
    }
}
