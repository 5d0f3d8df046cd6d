package io.matchscan.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Results of analyzing every construct of one input file.
 *
 * @param sourcePath    The analyzed interchange file
 * @param startTime     When the analysis started
 * @param duration      How long it took
 * @param results       One result per analyzed construct, in input order
 * @param skipped       Names of constructs excluded by configuration
 * @param configuration Settings in effect
 */
public record AnalysisReport(
        Path sourcePath,
        Instant startTime,
        Duration duration,
        List<AnalysisResult> results,
        List<String> skipped,
        Configuration configuration
) {
    /**
     * Configuration snapshot used for the analysis.
     */
    public record Configuration(
            int maxReferences,
            long maxSteps,
            boolean parallel,
            Set<Verdict> failOn
    ) {}

    public AnalysisReport {
        if (sourcePath == null) {
            throw new IllegalArgumentException("sourcePath cannot be null");
        }
        results = results == null ? List.of() : List.copyOf(results);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
        if (startTime == null) {
            startTime = Instant.now();
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    /**
     * Returns count of results per verdict, every verdict present.
     */
    public Map<Verdict, Long> countsByVerdict() {
        Map<Verdict, Long> counts = new EnumMap<>(Verdict.class);
        for (Verdict verdict : Verdict.values()) {
            counts.put(verdict, 0L);
        }
        for (AnalysisResult result : results) {
            counts.merge(result.verdict(), 1L, Long::sum);
        }
        return counts;
    }

    public List<AnalysisResult> unproven() {
        return results.stream()
                .filter(r -> !r.isProvenExhaustive())
                .toList();
    }

    /**
     * Returns true if any result has one of the given verdicts.
     */
    public boolean hasAny(Set<Verdict> verdicts) {
        return results.stream().anyMatch(r -> verdicts.contains(r.verdict()));
    }

    public int totalConstructs() {
        return results.size();
    }

    public long durationMs() {
        return duration.toMillis();
    }

    public LocalDateTime analysisDate() {
        return LocalDateTime.ofInstant(startTime, ZoneId.systemDefault());
    }
}
