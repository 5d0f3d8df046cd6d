package io.matchscan.report;

import io.matchscan.model.AnalysisReport;
import io.matchscan.model.AnalysisResult;
import io.matchscan.model.Counterexample;
import io.matchscan.model.Reference;
import io.matchscan.model.Verdict;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Formats analysis results for console output with ANSI colors.
 * <p>
 * Layout: header, verdict counts, then one block per construct. Proven constructs are
 * listed on one line unless {@code detailed} is set.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private final boolean useColors;
    private final boolean detailed;

    public ConsoleReporter() {
        this(true, false);
    }

    public ConsoleReporter(boolean useColors) {
        this(useColors, false);
    }

    public ConsoleReporter(boolean useColors, boolean detailed) {
        this.useColors = useColors;
        this.detailed = detailed;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, report);
        printSummary(out, report);
        printResults(out, report);
        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out, AnalysisReport report) {
        out.println();
        out.println(line('=', 70));
        out.println(center("MATCH-SCAN REPORT", 70));
        out.println(line('=', 70));
        out.println();

        out.println("Input: " + report.sourcePath());
        out.println("Analysis Date: " + report.analysisDate());
        out.println();
    }

    private void printSummary(PrintWriter out, AnalysisReport report) {
        out.println(bold("SUMMARY"));
        out.println(line('-', 70));

        out.println(String.format("Analyzed: %d constructs | skipped: %d | %.1fs",
                report.totalConstructs(),
                report.skipped().size(),
                report.durationMs() / 1000.0));

        Map<Verdict, Long> counts = report.countsByVerdict();
        String verdicts = counts.entrySet().stream()
                .map(e -> {
                    String text = e.getValue() + " " + e.getKey().displayName().toLowerCase();
                    return e.getValue() > 0 ? color(verdictColor(e.getKey()), text) : text;
                })
                .collect(Collectors.joining(" | "));
        out.println("Verdicts: " + verdicts);
        out.println();
    }

    private void printResults(PrintWriter out, AnalysisReport report) {
        if (report.results().isEmpty()) {
            return;
        }
        out.println(bold("CONSTRUCTS"));
        out.println(line('=', 70));

        for (AnalysisResult result : report.results()) {
            if (result.isProvenExhaustive() && !detailed) {
                out.println(indicator(result.verdict()) + " " + result.constructName());
                continue;
            }
            printResult(out, result);
        }
        out.println();

        if (!report.skipped().isEmpty()) {
            out.println(bold("SKIPPED") + color(CYAN, " (" + report.skipped().size() + ")"));
            for (String name : report.skipped()) {
                out.println("  - " + name);
            }
            out.println();
        }
    }

    private void printResult(PrintWriter out, AnalysisResult result) {
        out.println(indicator(result.verdict()) + " " + bold(result.constructName()));
        out.println("    Verdict: " + result.verdict().displayName());
        if (!result.referenceOrder().isEmpty()) {
            out.println("    References: " + result.referenceOrder().stream()
                    .map(Reference::path)
                    .collect(Collectors.joining(" -> ")));
        }
        if (result.counterexample() != null) {
            Counterexample missing = result.counterexample();
            out.println("    Missing: " + missing.describe());
            if (result.verdict() != Verdict.UNANALYZABLE_BRANCH) {
                out.println("    " + color(GREEN, "Suggestion: " + missing.suggestion()));
            }
        }
        List<String> notes = result.notes();
        for (String note : notes) {
            out.println("    Note: " + note);
        }
    }

    private void printFooter(PrintWriter out, AnalysisReport report) {
        out.println(line('=', 70));

        List<AnalysisResult> unproven = report.unproven();
        if (report.hasAny(report.configuration() != null ? report.configuration().failOn() : Set.of())) {
            out.println(color(RED, bold("ACTION REQUIRED: " + unproven.size()
                    + " construct(s) not proven exhaustive.")));
        } else if (!unproven.isEmpty()) {
            out.println(color(YELLOW, "ATTENTION: " + unproven.size()
                    + " construct(s) not proven exhaustive."));
        } else {
            out.println(color(GREEN, "All constructs are exhaustive."));
        }
        out.println();
    }

    private String indicator(Verdict verdict) {
        return switch (verdict) {
            case EXHAUSTIVE -> color(GREEN, "[OK]");
            case MISSING_CASES -> color(RED, "[MISSING]");
            case UNBOUNDED_DOMAIN -> color(RED, "[UNBOUNDED]");
            case UNANALYZABLE_BRANCH -> color(YELLOW, "[OPAQUE]");
            case BUDGET_EXCEEDED -> color(YELLOW, "[BUDGET]");
        };
    }

    private String verdictColor(Verdict verdict) {
        return switch (verdict) {
            case EXHAUSTIVE -> GREEN;
            case MISSING_CASES, UNBOUNDED_DOMAIN -> RED;
            case UNANALYZABLE_BRANCH, BUDGET_EXCEEDED -> YELLOW;
        };
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
