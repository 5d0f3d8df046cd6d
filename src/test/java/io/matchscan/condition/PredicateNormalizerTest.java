package io.matchscan.condition;

import io.matchscan.model.AtomicPredicate;
import io.matchscan.model.BranchCondition;
import io.matchscan.model.BranchCondition.Conjunction;
import io.matchscan.model.BranchCondition.Opaque;
import io.matchscan.model.ContractViolationException;
import io.matchscan.model.MatchConstruct;
import io.matchscan.model.Reference;
import io.matchscan.model.TypeEnvironment;
import io.matchscan.model.TypeShape.BooleanType;
import io.matchscan.model.TypeShape.EnumType;
import io.matchscan.model.TypeShape.NullableType;
import io.matchscan.model.TypeShape.OpenType;
import io.matchscan.model.ValueClass;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.matchscan.TestConstructs.INT;
import static io.matchscan.TestConstructs.NULLABLE_INT;
import static io.matchscan.TestConstructs.PROBLEM;
import static io.matchscan.TestConstructs.STATUS;
import static io.matchscan.TestConstructs.construct;
import static io.matchscan.TestConstructs.statusEnvironment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PredicateNormalizerTest {

    private static final Reference STATUS_REF = Reference.of("status");
    private static final Reference PROBLEM_REF = Reference.of("status.problem");

    private final PredicateNormalizer normalizer = new PredicateNormalizer();

    private List<BranchCondition> normalize(MatchConstruct construct) {
        return normalizer.normalizeAll(construct);
    }

    private AtomicPredicate single(BranchCondition condition) {
        assertThat(condition).isInstanceOf(Conjunction.class);
        Conjunction conjunction = (Conjunction) condition;
        assertThat(conjunction.predicates()).hasSize(1);
        return conjunction.predicates().get(0);
    }

    @Test
    void normalize_singletonEqualityAndTypeTest() {
        List<BranchCondition> conditions = normalize(construct("render", "status", statusEnvironment(),
                "Loading", "is Ok"));

        assertThat(single(conditions.get(0)).classes()).containsExactly(ValueClass.variant("Status", "Loading"));
        assertThat(single(conditions.get(1)).classes()).containsExactly(ValueClass.variant("Status", "Ok"));
        assertThat(single(conditions.get(1)).closing()).isTrue();
    }

    @Test
    void normalize_headAndGuardFormOneConjunction() {
        BranchCondition condition = normalize(construct("render", "status", statusEnvironment(),
                "is Error if status.problem == Problem.CONNECTION")).get(0);

        Conjunction conjunction = (Conjunction) condition;
        assertThat(conjunction.references()).containsExactly(STATUS_REF, PROBLEM_REF);
        assertThat(conjunction.predicateOn(PROBLEM_REF).orElseThrow().classes())
                .containsExactly(ValueClass.entry("Problem", "CONNECTION"));
    }

    @Test
    void normalize_elseIsElseButGuardedElseIsConjunction() {
        TypeEnvironment env = TypeEnvironment.builder().declare("flag", BooleanType.INSTANCE).build();
        List<BranchCondition> conditions = normalize(construct("c", null, env, "else if flag", "else"));

        assertThat(conditions.get(0)).isInstanceOf(Conjunction.class);
        assertThat(conditions.get(1)).isEqualTo(BranchCondition.Else.INSTANCE);
    }

    @Test
    void normalize_nullTestsOnNullable() {
        TypeEnvironment env = TypeEnvironment.builder().declare("x", NULLABLE_INT).build();
        List<BranchCondition> conditions = normalize(construct("c", null, env, "x == null", "null != x"));

        assertThat(single(conditions.get(0)).classes()).extracting(ValueClass::kind)
                .containsExactly(ValueClass.Kind.NULL);
        assertThat(single(conditions.get(1)).classes()).extracting(ValueClass::kind)
                .containsExactly(ValueClass.Kind.NON_NULL);
    }

    @Test
    void normalize_booleanForms() {
        TypeEnvironment env = TypeEnvironment.builder().declare("flag", BooleanType.INSTANCE).build();
        List<BranchCondition> conditions = normalize(construct("c", null, env,
                "flag", "!flag", "flag == true", "flag != true"));

        assertThat(single(conditions.get(0)).classes()).containsExactly(ValueClass.bool(true));
        assertThat(single(conditions.get(1)).classes()).containsExactly(ValueClass.bool(false));
        assertThat(single(conditions.get(2)).classes()).containsExactly(ValueClass.bool(true));
        assertThat(single(conditions.get(3)).classes()).containsExactly(ValueClass.bool(false));
    }

    @Test
    void normalize_enumInequalityIsComplement() {
        TypeEnvironment env = TypeEnvironment.builder().declare("problem", PROBLEM).build();
        AtomicPredicate predicate = single(normalize(construct("c", null, env, "problem != UNKNOWN")).get(0));

        assertThat(predicate.closing()).isTrue();
        assertThat(predicate.classes()).containsExactly(
                ValueClass.entry("Problem", "CONNECTION"),
                ValueClass.entry("Problem", "AUTHENTICATION"));
    }

    @Test
    void normalize_negatedTypeTestIsComplement() {
        AtomicPredicate predicate = single(normalize(construct("render", "status", statusEnvironment(),
                "!is Error")).get(0));

        assertThat(predicate.classes()).extracting(ValueClass::name).containsExactly("Loading", "Ok");
    }

    @Test
    void normalize_literalOnOpenTypeIsNonClosing() {
        TypeEnvironment env = TypeEnvironment.builder().declare("n", INT).build();
        AtomicPredicate predicate = single(normalize(construct("c", "n", env, "42")).get(0));

        assertThat(predicate.closing()).isFalse();
        assertThat(predicate.covers(ValueClass.unbounded("Int"))).isFalse();
    }

    @Test
    void normalize_literalInequalityIsOpaque() {
        TypeEnvironment env = TypeEnvironment.builder().declare("n", INT).build();

        assertThat(normalize(construct("c", null, env, "n != 42")).get(0)).isInstanceOf(Opaque.class);
    }

    @Test
    void normalize_multipleHeadsUnion() {
        AtomicPredicate predicate = single(normalize(construct("render", "status", statusEnvironment(),
                "Loading, is Ok")).get(0));

        assertThat(predicate.closing()).isTrue();
        assertThat(predicate.classes()).extracting(ValueClass::name).containsExactly("Loading", "Ok");
    }

    @Test
    void normalize_predicatesOnSameReferenceIntersect() {
        TypeEnvironment env = TypeEnvironment.builder().declare("problem", PROBLEM).build();
        AtomicPredicate predicate = single(normalize(construct("c", null, env,
                "problem != UNKNOWN && problem != CONNECTION")).get(0));

        assertThat(predicate.classes()).containsExactly(ValueClass.entry("Problem", "AUTHENTICATION"));
    }

    @Test
    void normalize_contradictoryPredicatesAreUnsatisfiable() {
        TypeEnvironment env = TypeEnvironment.builder().declare("flag", BooleanType.INSTANCE).build();
        Conjunction conjunction = (Conjunction) normalize(construct("c", null, env, "flag && !flag")).get(0);

        assertThat(conjunction.isUnsatisfiable()).isTrue();
        assertThat(conjunction.predicates().get(0).isUnsatisfiable()).isTrue();
    }

    @Test
    void normalize_trueConjunctIsDropped() {
        TypeEnvironment env = TypeEnvironment.builder().declare("flag", BooleanType.INSTANCE).build();

        assertThat(single(normalize(construct("c", null, env, "flag && true")).get(0)).classes())
                .containsExactly(ValueClass.bool(true));
    }

    @Test
    void normalize_unsupportedShapesAreOpaque() {
        TypeEnvironment env = TypeEnvironment.builder()
                .declare("a", BooleanType.INSTANCE)
                .declare("b", BooleanType.INSTANCE)
                .declare("n", INT)
                .declare("m", INT)
                .build();
        List<BranchCondition> conditions = normalize(construct("c", null, env,
                "a || b", "isReady(a)", "n == m", "!(a && b)", "false"));

        assertThat(conditions).allSatisfy(c -> assertThat(c).isInstanceOf(Opaque.class));
        assertThat(((Opaque) conditions.get(0)).reason()).contains("disjunction");
        assertThat(((Opaque) conditions.get(1)).reason()).contains("isReady");
    }

    @Test
    void normalize_unstableReferenceIsOpaque() {
        TypeEnvironment env = TypeEnvironment.builder()
                .declareUnstable("flag", BooleanType.INSTANCE)
                .build();
        BranchCondition condition = normalize(construct("c", null, env, "flag")).get(0);

        assertThat(condition).isInstanceOf(Opaque.class);
        assertThat(((Opaque) condition).reason()).contains("not stable");
    }

    @Test
    void normalize_unknownEntryIsOpaque() {
        TypeEnvironment env = TypeEnvironment.builder().declare("problem", PROBLEM).build();

        assertThat(normalize(construct("c", null, env, "problem == TIMEOUT")).get(0)).isInstanceOf(Opaque.class);
    }

    @Test
    void normalize_typeTestOnOpenTypeIsNonClosing() {
        TypeEnvironment env = TypeEnvironment.builder().declare("value", new OpenType("Any")).build();
        AtomicPredicate predicate = single(normalize(construct("c", null, env, "value is String")).get(0));

        assertThat(predicate.closing()).isFalse();
    }

    @Test
    void normalize_typeTestAgainstOwnTypeCoversNonNull() {
        TypeEnvironment env = TypeEnvironment.builder().declare("s", new NullableType(STATUS)).build();
        AtomicPredicate predicate = single(normalize(construct("c", "s", env, "is Status")).get(0));

        assertThat(predicate.classes()).hasSize(3)
                .allSatisfy(c -> assertThat(c.kind()).isEqualTo(ValueClass.Kind.VARIANT));
    }

    @Test
    void normalize_undeclaredReferenceViolatesContract() {
        TypeEnvironment env = TypeEnvironment.builder().declare("x", NULLABLE_INT).build();

        assertThatThrownBy(() -> normalize(construct("c", null, env, "x == null && z == null")))
                .isInstanceOfSatisfying(ContractViolationException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ContractViolationException.Kind.UNRESOLVED_REFERENCE);
                    assertThat(e.reference()).isEqualTo(Reference.of("z"));
                });
    }

    @Test
    void normalize_openEnumEntryStillClosesItsOwnClass() {
        EnumType level = new EnumType("Level", List.of("LOW", "HIGH"), false);
        TypeEnvironment env = TypeEnvironment.builder().declare("level", level).build();
        AtomicPredicate predicate = single(normalize(construct("c", "level", env, "LOW")).get(0));

        assertThat(predicate.covers(ValueClass.entry("Level", "LOW"))).isTrue();
        assertThat(predicate.covers(ValueClass.otherEntry("Level"))).isFalse();
    }
}
