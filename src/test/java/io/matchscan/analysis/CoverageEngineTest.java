package io.matchscan.analysis;

import io.matchscan.condition.PredicateNormalizer;
import io.matchscan.domain.DomainModel;
import io.matchscan.graph.ReferenceOrderer;
import io.matchscan.model.AtomicPredicate;
import io.matchscan.model.BranchCondition;
import io.matchscan.model.BranchCondition.Conjunction;
import io.matchscan.model.MatchConstruct;
import io.matchscan.model.Reference;
import io.matchscan.model.TypeEnvironment;
import io.matchscan.model.TypeShape;
import io.matchscan.model.TypeShape.BooleanType;
import io.matchscan.model.TypeShape.EnumType;
import io.matchscan.model.TypeShape.NullableType;
import io.matchscan.model.ValueClass;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static io.matchscan.TestConstructs.INT;
import static io.matchscan.TestConstructs.construct;
import static io.matchscan.TestConstructs.pairEnvironment;
import static io.matchscan.TestConstructs.statusEnvironment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoverageEngineTest {

    private final PredicateNormalizer normalizer = new PredicateNormalizer();
    private final ReferenceOrderer orderer = new ReferenceOrderer();
    private final CoverageEngine engine = new CoverageEngine();

    private CoverageProblem problem(MatchConstruct construct) {
        List<BranchCondition> conditions = normalizer.normalizeAll(construct);
        List<Reference> order = orderer.order(construct.environment(), conditions).references();
        List<Conjunction> conjunctions = new ArrayList<>();
        for (BranchCondition condition : conditions) {
            if (condition instanceof Conjunction conjunction) {
                conjunctions.add(conjunction);
            } else if (condition instanceof BranchCondition.Else) {
                conjunctions.add(Conjunction.TRUE);
            }
        }
        return new CoverageProblem(order, construct.environment(), conjunctions);
    }

    private boolean covered(MatchConstruct construct) {
        return engine.coveredBy(problem(construct));
    }

    @Test
    void coveredBy_allNullCombinationsOfTwoNullables() {
        assertThat(covered(construct("pair", null, pairEnvironment(),
                "x == null && y == null",
                "x == null && y != null",
                "x != null && y == null",
                "x != null && y != null"))).isTrue();
    }

    @Test
    void coveredBy_missingOneNullCombination() {
        assertThat(covered(construct("pair", null, pairEnvironment(),
                "x == null && y == null",
                "x == null && y != null",
                "x != null && y == null"))).isFalse();
    }

    @Test
    void coveredBy_branchSilentOnAReferenceCoversAllItsValues() {
        assertThat(covered(construct("pair", null, pairEnvironment(),
                "x == null",
                "x != null && y == null",
                "x != null && y != null"))).isTrue();
    }

    @Test
    void coveredBy_sealedHierarchyWithNestedEnum() {
        assertThat(covered(construct("render", "status", statusEnvironment(),
                "Loading",
                "is Ok",
                "is Error if status.problem == CONNECTION",
                "is Error if status.problem == AUTHENTICATION",
                "is Error if status.problem == UNKNOWN"))).isTrue();

        assertThat(covered(construct("render", "status", statusEnvironment(),
                "Loading",
                "is Ok",
                "is Error if status.problem == CONNECTION",
                "is Error if status.problem == AUTHENTICATION"))).isFalse();
    }

    @Test
    void coveredBy_booleanTrueAndFalse() {
        TypeEnvironment env = TypeEnvironment.builder().declare("flag", BooleanType.INSTANCE).build();

        assertThat(covered(construct("c", "flag", env, "true", "false"))).isTrue();
        assertThat(covered(construct("c", null, env, "flag", "!flag"))).isTrue();
        assertThat(covered(construct("c", null, env, "flag"))).isFalse();
    }

    @Test
    void coveredBy_literalsNeverCoverAnOpenDomain() {
        TypeEnvironment env = TypeEnvironment.builder().declare("n", INT).build();

        assertThat(covered(construct("c", "n", env, "0", "1", "2"))).isFalse();
        assertThat(covered(construct("c", "n", env, "0", "else"))).isTrue();
    }

    @Test
    void coveredBy_openEnumNeedsElse() {
        EnumType level = new EnumType("Level", List.of("LOW", "HIGH"), false);
        TypeEnvironment env = TypeEnvironment.builder().declare("level", level).build();

        assertThat(covered(construct("c", "level", env, "LOW", "HIGH"))).isFalse();
        assertThat(covered(construct("c", "level", env, "LOW", "HIGH", "else"))).isTrue();
    }

    @Test
    void coveredBy_noConditionsIsNotCovered() {
        CoverageProblem empty = new CoverageProblem(List.of(), pairEnvironment(), List.of());

        assertThat(engine.coveredBy(empty)).isFalse();
    }

    @Test
    void coveredBy_elseAloneCoversEverything() {
        assertThat(covered(construct("pair", null, pairEnvironment(), "else"))).isTrue();
    }

    @Test
    void coveredBy_addingElseNeverRemovesCoverage() {
        String[][] branchSets = {
                {"x == null"},
                {"x == null && y == null", "x != null"},
                {"x == 3", "y == 4"},
                {"x == null", "x != null"}
        };
        for (String[] branches : branchSets) {
            List<String> withElse = new ArrayList<>(List.of(branches));
            withElse.add("else");
            boolean before = covered(construct("c", null, pairEnvironment(), branches));
            boolean after = covered(construct("c", null, pairEnvironment(), withElse.toArray(String[]::new)));

            assertThat(after).isTrue();
            assertThat(!before || after).isTrue();
        }
    }

    @Test
    void coveredBy_isIdempotentAndOrderIndependent() {
        List<String> branches = new ArrayList<>(List.of(
                "Loading",
                "is Ok",
                "is Error if status.problem != UNKNOWN",
                "is Error if status.problem == UNKNOWN"));
        boolean first = covered(construct("render", "status", statusEnvironment(), branches.toArray(String[]::new)));
        boolean second = covered(construct("render", "status", statusEnvironment(), branches.toArray(String[]::new)));

        Collections.reverse(branches);
        boolean reversed = covered(construct("render", "status", statusEnvironment(), branches.toArray(String[]::new)));

        assertThat(first).isTrue();
        assertThat(second).isEqualTo(first);
        assertThat(reversed).isEqualTo(first);
    }

    @Test
    void coveredBy_throwsWhenStepBudgetRunsOut() {
        CoverageEngine tight = new CoverageEngine(2);
        CoverageProblem problem = problem(construct("pair", null, pairEnvironment(),
                "x == null && y == null",
                "x == null && y != null",
                "x != null && y == null",
                "x != null && y != null"));

        assertThatThrownBy(() -> tight.coveredBy(problem))
                .isInstanceOfSatisfying(BudgetExceededException.class, e -> assertThat(e.maxSteps()).isEqualTo(2));
    }

    @Test
    void constructor_rejectsNonPositiveBudget() {
        assertThatThrownBy(() -> new CoverageEngine(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void partition_placesSilentConditionsEverywhereAndNonClosingNowhere() {
        TypeEnvironment env = TypeEnvironment.builder().declare("n", new NullableType(INT)).build();
        Reference n = Reference.of("n");
        Conjunction isNull = Conjunction.of(AtomicPredicate.closing(n, "n == null",
                Set.of(ValueClass.nullValue("Int?"))));
        Conjunction literal = Conjunction.of(AtomicPredicate.nonClosing(n, "n == 3",
                Set.of(ValueClass.nonNull("Int"))));
        Conjunction silent = Conjunction.TRUE;

        List<CoverageEngine.Partition> partitions = engine.partition(n, env.typeOf(n),
                List.of(isNull, literal, silent));

        assertThat(partitions).hasSize(2);
        assertThat(partitions.get(0).conditions()).containsExactly(Conjunction.TRUE, Conjunction.TRUE);
        assertThat(partitions.get(1).conditions()).containsExactly(Conjunction.TRUE);
    }

    /**
     * Compares the engine with exhaustive enumeration over small finite domains.
     */
    @Test
    void coveredBy_agreesWithBruteForceEnumeration() {
        Random random = new Random(20240611L);
        List<TypeShape> shapes = List.of(
                BooleanType.INSTANCE,
                new NullableType(BooleanType.INSTANCE),
                new EnumType("Color", List.of("RED", "GREEN", "BLUE")));

        for (int round = 0; round < 300; round++) {
            int referenceCount = 1 + random.nextInt(3);
            TypeEnvironment.Builder envBuilder = TypeEnvironment.builder();
            List<Reference> references = new ArrayList<>();
            for (int i = 0; i < referenceCount; i++) {
                Reference ref = Reference.of("r" + i);
                references.add(ref);
                envBuilder.declare(ref, shapes.get(random.nextInt(shapes.size())));
            }
            TypeEnvironment env = envBuilder.build();

            List<Conjunction> conditions = new ArrayList<>();
            int branchCount = random.nextInt(6);
            for (int b = 0; b < branchCount; b++) {
                List<AtomicPredicate> predicates = new ArrayList<>();
                for (Reference ref : references) {
                    if (random.nextInt(3) == 0) {
                        continue;
                    }
                    Set<ValueClass> subset = new LinkedHashSet<>();
                    for (ValueClass leaf : DomainModel.domainOf(env.typeOf(ref)).leaves()) {
                        if (random.nextBoolean()) {
                            subset.add(leaf);
                        }
                    }
                    predicates.add(AtomicPredicate.closing(ref, ref + " in " + subset, subset));
                }
                conditions.add(new Conjunction(predicates));
            }

            boolean expected = bruteForce(references, env, conditions);
            boolean actual = engine.coveredBy(new CoverageProblem(references, env, conditions));
            assertThat(actual)
                    .as("round %d: %s", round, conditions)
                    .isEqualTo(expected);
        }
    }

    private boolean bruteForce(List<Reference> references, TypeEnvironment env, List<Conjunction> conditions) {
        List<Map<Reference, ValueClass>> assignments = new ArrayList<>();
        assignments.add(new HashMap<>());
        for (Reference ref : references) {
            List<Map<Reference, ValueClass>> next = new ArrayList<>();
            for (Map<Reference, ValueClass> partial : assignments) {
                for (ValueClass leaf : DomainModel.domainOf(env.typeOf(ref)).leaves()) {
                    Map<Reference, ValueClass> extended = new HashMap<>(partial);
                    extended.put(ref, leaf);
                    next.add(extended);
                }
            }
            assignments = next;
        }
        for (Map<Reference, ValueClass> assignment : assignments) {
            boolean matched = conditions.stream().anyMatch(condition -> condition.predicates().stream()
                    .allMatch(p -> p.covers(assignment.get(p.reference()))));
            if (!matched) {
                return false;
            }
        }
        return true;
    }
}
