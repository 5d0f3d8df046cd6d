package io.matchscan.analysis;

import io.matchscan.condition.PredicateNormalizer;
import io.matchscan.config.AnalyzerConfig;
import io.matchscan.graph.ReferenceOrder;
import io.matchscan.graph.ReferenceOrderer;
import io.matchscan.model.AnalysisReport;
import io.matchscan.model.AnalysisResult;
import io.matchscan.model.BranchCondition;
import io.matchscan.model.BranchCondition.Conjunction;
import io.matchscan.model.ContractViolationException;
import io.matchscan.model.Counterexample;
import io.matchscan.model.MatchConstruct;
import io.matchscan.model.Reference;
import io.matchscan.model.Verdict;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;

/**
 * Entry point of the analysis: normalizes a construct's branches, orders its references,
 * runs the coverage engine and turns the outcome into a verdict.
 * <p>
 * Only {@link Verdict#EXHAUSTIVE} is a proof. Every other verdict is reported, never thrown;
 * exceptions are reserved for broken front-end contracts ({@link ContractViolationException}).
 */
public class ExhaustivenessAnalyzer {

    private final AnalyzerConfig config;
    private final PredicateNormalizer normalizer = new PredicateNormalizer();
    private final ReferenceOrderer orderer = new ReferenceOrderer();
    private final CoverageEngine engine;
    private final DiagnosticSynthesizer synthesizer;

    public ExhaustivenessAnalyzer() {
        this(AnalyzerConfig.loadDefault());
    }

    public ExhaustivenessAnalyzer(AnalyzerConfig config) {
        this.config = config;
        this.engine = new CoverageEngine(config.maxSteps());
        this.synthesizer = new DiagnosticSynthesizer(engine);
    }

    /**
     * Analyzes one construct.
     *
     * @throws ContractViolationException if the construct's type environment is incomplete or inconsistent
     */
    public AnalysisResult analyze(MatchConstruct construct) {
        List<BranchCondition> conditions = normalizer.normalizeAll(construct);
        ReferenceOrder order = orderer.order(construct.environment(), conditions);
        List<Reference> references = order.references();
        String name = construct.name();

        // Adding branches never removes coverage, so an unguarded else settles it
        if (conditions.stream().anyMatch(BranchCondition.Else.class::isInstance)) {
            return AnalysisResult.exhaustive(name, references);
        }

        if (!order.isAnalyzable()) {
            return new AnalysisResult(name, Verdict.UNANALYZABLE_BRANCH, references, null,
                    List.of(opaqueNote(construct, order.opaqueBranchIndex(), order.opaqueReason())));
        }

        if (references.size() > config.maxReferences()) {
            return new AnalysisResult(name, Verdict.BUDGET_EXCEEDED, references, null,
                    List.of(references.size() + " references exceed the limit of " + config.maxReferences()));
        }

        List<Conjunction> conjunctions = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        for (int i = 0; i < conditions.size(); i++) {
            BranchCondition condition = conditions.get(i);
            if (condition instanceof Conjunction conjunction) {
                if (!conjunction.isUnsatisfiable()) {
                    conjunctions.add(conjunction);
                }
            } else if (condition instanceof BranchCondition.Opaque opaque) {
                notes.add(opaqueNote(construct, i, opaque.reason()));
            }
        }
        boolean opaqueLast = !notes.isEmpty();

        CoverageProblem problem = new CoverageProblem(references, construct.environment(), conjunctions);
        Optional<Counterexample> counterexample;
        try {
            counterexample = synthesizer.counterexample(problem);
        } catch (BudgetExceededException e) {
            notes.add(e.getMessage());
            return new AnalysisResult(name, Verdict.BUDGET_EXCEEDED, references, null, notes);
        }

        if (counterexample.isEmpty()) {
            if (opaqueLast) {
                notes.add("the other branches are exhaustive on their own, but the opaque branch blocks the proof");
                return new AnalysisResult(name, Verdict.UNANALYZABLE_BRANCH, references, null, notes);
            }
            return AnalysisResult.exhaustive(name, references);
        }

        Counterexample missing = counterexample.get();
        Verdict verdict;
        if (opaqueLast) {
            notes.add("possibly uncovered: " + missing.describe());
            verdict = Verdict.UNANALYZABLE_BRANCH;
        } else if (missing.needsElse()) {
            verdict = Verdict.UNBOUNDED_DOMAIN;
        } else {
            verdict = Verdict.MISSING_CASES;
        }
        return new AnalysisResult(name, verdict, references, missing, notes);
    }

    /**
     * Analyzes constructs independently; results keep the input order.
     */
    public List<AnalysisResult> analyzeAll(List<MatchConstruct> constructs) {
        Stream<MatchConstruct> stream = config.parallel() ? constructs.parallelStream() : constructs.stream();
        return stream.map(this::analyze).toList();
    }

    /**
     * Analyzes the constructs of one input file, skipping those excluded by configuration.
     */
    public AnalysisReport analyzeFile(Path sourcePath, List<MatchConstruct> constructs) {
        Instant start = Instant.now();
        List<MatchConstruct> included = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (MatchConstruct construct : constructs) {
            if (config.isExcluded(construct.name())) {
                skipped.add(construct.name());
            } else {
                included.add(construct);
            }
        }
        List<AnalysisResult> results = analyzeAll(included);
        return new AnalysisReport(sourcePath, start, Duration.between(start, Instant.now()),
                results, skipped, snapshot());
    }

    public AnalysisReport.Configuration snapshot() {
        return new AnalysisReport.Configuration(config.maxReferences(), config.maxSteps(),
                config.parallel(), config.failOn());
    }

    public AnalyzerConfig config() {
        return config;
    }

    private static String opaqueNote(MatchConstruct construct, int index, String reason) {
        return "branch " + (index + 1) + " '" + construct.branches().get(index).describe()
                + "' is opaque: " + reason;
    }
}
