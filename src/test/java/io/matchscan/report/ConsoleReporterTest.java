package io.matchscan.report;

import io.matchscan.model.AnalysisReport;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    @Test
    void write_showsSummaryAndUnprovenDetails() {
        String output = new ConsoleReporter(false).toString(ReportFixtures.sampleReport());

        assertThat(output).contains("MATCH-SCAN REPORT");
        assertThat(output).contains("Input: /work/matches.yaml");
        assertThat(output).contains("Analyzed: 3 constructs | skipped: 1");
        assertThat(output).contains("1 exhaustive", "1 missing cases", "1 unanalyzable branch");
        assertThat(output).contains("[OK] Toggle.label");
        assertThat(output).contains("[MISSING] Renderer.renderPartial");
        assertThat(output).contains("References: status -> status.problem");
        assertThat(output).contains("Missing: status is Error, status.problem == UNKNOWN");
        assertThat(output).contains("Suggestion: add a branch for status is Error && status.problem == UNKNOWN");
        assertThat(output).contains("Note: branch 2 'isValid(input)' is opaque");
        assertThat(output).contains("- legacy.render");
        assertThat(output).contains("ACTION REQUIRED: 2 construct(s) not proven exhaustive.");
    }

    @Test
    void write_withoutColorsHasNoEscapeCodes() {
        String plain = new ConsoleReporter(false).toString(ReportFixtures.sampleReport());
        String colored = new ConsoleReporter(true).toString(ReportFixtures.sampleReport());

        assertThat(plain).doesNotContain("\u001B[");
        assertThat(colored).contains("\u001B[");
    }

    @Test
    void write_detailedExpandsExhaustiveConstructs() {
        String output = new ConsoleReporter(false, true).toString(ReportFixtures.sampleReport());

        assertThat(output).contains("Verdict: Exhaustive");
        assertThat(output).contains("References: enabled");
    }

    @Test
    void write_allExhaustiveFooter() {
        AnalysisReport empty = new AnalysisReport(Path.of("m.yaml"), Instant.now(), Duration.ZERO,
                List.of(), List.of(), null);

        String output = new ConsoleReporter(false).toString(empty);

        assertThat(output).contains("All constructs are exhaustive.");
        assertThat(output).doesNotContain("CONSTRUCTS");
    }

    @Test
    void format_isConsole() {
        assertThat(new ConsoleReporter().format()).isEqualTo("console");
    }
}
