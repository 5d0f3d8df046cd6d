package io.matchscan.report;

import io.matchscan.model.AnalysisReport;
import io.matchscan.model.AnalysisResult;
import io.matchscan.model.Counterexample;
import io.matchscan.model.Reference;
import io.matchscan.model.ValueClass;
import io.matchscan.model.Verdict;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

final class ReportFixtures {

    private ReportFixtures() {
    }

    static AnalysisReport sampleReport() {
        Reference status = Reference.of("status");
        Reference problem = Reference.of("status.problem");
        Counterexample missing = new Counterexample(List.of(
                new Counterexample.Step(status, ValueClass.variant("Status", "Error"), false),
                new Counterexample.Step(problem, ValueClass.entry("Problem", "UNKNOWN"), false)));

        return new AnalysisReport(
                Path.of("/work/matches.yaml"),
                Instant.parse("2024-06-11T10:15:30Z"),
                Duration.ofMillis(1500),
                List.of(
                        AnalysisResult.exhaustive("Toggle.label", List.of(Reference.of("enabled"))),
                        new AnalysisResult("Renderer.renderPartial", Verdict.MISSING_CASES,
                                List.of(status, problem), missing, List.of()),
                        new AnalysisResult("Validator.check", Verdict.UNANALYZABLE_BRANCH,
                                List.of(Reference.of("input")), null,
                                List.of("branch 2 'isValid(input)' is opaque: call to isValid()"))),
                List.of("legacy.render"),
                new AnalysisReport.Configuration(32, 1_000_000L, false,
                        EnumSet.of(Verdict.MISSING_CASES, Verdict.UNBOUNDED_DOMAIN)));
    }
}
