package io.matchscan.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.matchscan.model.AnalysisReport;
import io.matchscan.model.AnalysisResult;
import io.matchscan.model.Counterexample;
import io.matchscan.model.Reference;
import io.matchscan.model.Verdict;

import java.io.IOException;
import java.io.Writer;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formats analysis results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
    }

    private JsonReport toJsonReport(AnalysisReport report) {
        Map<String, Long> counts = new LinkedHashMap<>();
        report.countsByVerdict().forEach((verdict, count) -> counts.put(verdict.name(), count));

        AnalysisReport.Configuration config = report.configuration();
        return new JsonReport(
                new JsonReport.Metadata(
                        report.sourcePath().toString(),
                        report.analysisDate(),
                        report.durationMs(),
                        config != null ? config.maxReferences() : null,
                        config != null ? config.maxSteps() : null
                ),
                new JsonReport.Summary(
                        report.totalConstructs(),
                        report.unproven().size(),
                        counts,
                        report.skipped().isEmpty() ? null : report.skipped()
                ),
                report.results().stream()
                        .map(this::toJsonResult)
                        .toList()
        );
    }

    private JsonReport.Result toJsonResult(AnalysisResult result) {
        Counterexample missing = result.counterexample();
        return new JsonReport.Result(
                result.constructName(),
                result.verdict().name(),
                result.verdict().isProven(),
                result.referenceOrder().stream().map(Reference::path).toList(),
                missing != null ? missing.steps().stream()
                        .map(step -> new JsonReport.Step(step.reference().path(), step.render()))
                        .toList() : null,
                missing != null && result.verdict() != Verdict.UNANALYZABLE_BRANCH ? missing.suggestion() : null,
                result.notes().isEmpty() ? null : result.notes()
        );
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            Metadata metadata,
            Summary summary,
            List<Result> results
    ) {
        public record Metadata(
                String input,
                LocalDateTime analysisDate,
                long durationMs,
                Integer maxReferences,
                Long maxSteps
        ) {}

        public record Summary(
                int total,
                int unproven,
                Map<String, Long> verdicts,
                List<String> skipped
        ) {}

        public record Result(
                String construct,
                String verdict,
                boolean proven,
                List<String> referenceOrder,
                List<Step> missingCase,
                String suggestion,
                List<String> notes
        ) {}

        public record Step(
                String reference,
                String condition
        ) {}
    }
}
