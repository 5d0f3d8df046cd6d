package io.matchscan.config;

import io.matchscan.model.Verdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyzerConfigTest {

    @TempDir
    Path tempDir;

    private static AnalyzerConfig parse(String yaml) {
        return AnalyzerConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void loadDefault_hasShippedValues() {
        AnalyzerConfig config = AnalyzerConfig.loadDefault();

        assertThat(config.maxReferences()).isEqualTo(32);
        assertThat(config.maxSteps()).isEqualTo(1_000_000L);
        assertThat(config.parallel()).isFalse();
        assertThat(config.failOn()).containsExactlyInAnyOrder(
                Verdict.MISSING_CASES, Verdict.UNBOUNDED_DOMAIN,
                Verdict.UNANALYZABLE_BRANCH, Verdict.BUDGET_EXCEEDED);
        assertThat(config.excludeConstructs()).isEmpty();
    }

    @Test
    void loadFromFile_readsAllKeys() throws IOException {
        Path file = tempDir.resolve("match-scan.yaml");
        Files.writeString(file, """
                maxReferences: 8
                maxSteps: 500
                parallel: true
                failOn:
                  - missing_cases
                excludeConstructs:
                  - "generated\\\\..*"
                """);

        AnalyzerConfig config = AnalyzerConfig.loadFromFile(file);

        assertThat(config.maxReferences()).isEqualTo(8);
        assertThat(config.maxSteps()).isEqualTo(500L);
        assertThat(config.parallel()).isTrue();
        assertThat(config.failOn()).containsExactly(Verdict.MISSING_CASES);
        assertThat(config.isExcluded("generated.Parser:12")).isTrue();
        assertThat(config.isExcluded("Renderer:42")).isFalse();
    }

    @Test
    void merge_overridesPresentKeysAndUnionsExclusions() {
        AnalyzerConfig base = parse("""
                maxReferences: 16
                excludeConstructs: ["legacy.*"]
                """);
        AnalyzerConfig custom = parse("""
                maxSteps: 42
                failOn: [BUDGET_EXCEEDED]
                excludeConstructs: ["test.*"]
                """);

        AnalyzerConfig merged = base.merge(custom);

        assertThat(merged.maxReferences()).isEqualTo(16);
        assertThat(merged.maxSteps()).isEqualTo(42L);
        assertThat(merged.failOn()).containsExactly(Verdict.BUDGET_EXCEEDED);
        assertThat(merged.isExcluded("legacy.render")).isTrue();
        assertThat(merged.isExcluded("test.render")).isTrue();
    }

    @Test
    void merge_withDefaultsKeepsDefaultFailOnWhenAbsent() {
        AnalyzerConfig merged = AnalyzerConfig.loadDefault().merge(parse("parallel: true"));

        assertThat(merged.parallel()).isTrue();
        assertThat(merged.failOn()).contains(Verdict.MISSING_CASES);
    }

    @Test
    void load_emptyDocumentUsesFallbacks() {
        AnalyzerConfig config = parse("");

        assertThat(config.maxReferences()).isEqualTo(32);
        assertThat(config.failOn()).isEmpty();
    }

    @Test
    void load_invalidPatternIsSkipped() {
        AnalyzerConfig config = parse("""
                excludeConstructs: ["[unclosed", "ok.*"]
                """);

        assertThat(config.excludeConstructs()).hasSize(1);
        assertThat(config.isExcluded("ok.render")).isTrue();
    }

    @Test
    void load_rejectsInvalidValues() {
        assertThatThrownBy(() -> parse("maxReferences: 0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxReferences");
        assertThatThrownBy(() -> parse("failOn: [SOMETIMES]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown verdict");
        assertThatThrownBy(() -> parse("parallel: maybe"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("- just a list"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
