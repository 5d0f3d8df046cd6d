package io.matchscan;

import io.matchscan.analysis.ExhaustivenessAnalyzer;
import io.matchscan.config.AnalyzerConfig;
import io.matchscan.input.MatchFileLoader;
import io.matchscan.model.AnalysisReport;
import io.matchscan.model.ContractViolationException;
import io.matchscan.model.MatchConstruct;
import io.matchscan.model.Verdict;
import io.matchscan.report.ConsoleReporter;
import io.matchscan.report.JsonReporter;
import io.matchscan.report.Reporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the match-scan tool.
 */
@Command(
        name = "match-scan",
        mixinStandardHelpOptions = true,
        version = "match-scan 1.0.0",
        description = "Checks that guarded conditional-match constructs cover every possible input.",
        footer = {
                "",
                "Exit codes: 0 all good, 1 input or configuration error, 2 a verdict listed in failOn.",
                "",
                "Examples:",
                "  match-scan matches.yaml",
                "  match-scan matches.yaml --output-format json --output-file report.json",
                "  match-scan matches.yaml --config strict.yaml --verbose"
        }
)
public class MatchScanCli implements Callable<Integer> {

    @Parameters(
            index = "0",
            description = "Path to the YAML match file to analyze"
    )
    private Path inputFile;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file (defaults to match-scan.yaml next to the input)"
    )
    private Path configFile;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"-d", "--detailed"},
            description = "Show every construct in full, exhaustive ones included"
    )
    private boolean detailed;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        try {
            if (!Files.exists(inputFile)) {
                System.err.println("Error: Input file does not exist: " + inputFile);
                return 1;
            }
            if (!Files.isRegularFile(inputFile)) {
                System.err.println("Error: Input path is not a file: " + inputFile);
                return 1;
            }

            if (outputFormat != OutputFormat.json) {
                printBanner();
            }

            AnalyzerConfig config = loadConfig();

            log("Loading matches from: " + inputFile);
            List<MatchConstruct> constructs = new MatchFileLoader().load(inputFile);
            log("  Found " + constructs.size() + " constructs");

            log("Analyzing exhaustiveness...");
            ExhaustivenessAnalyzer analyzer = new ExhaustivenessAnalyzer(config);
            AnalysisReport report = analyzer.analyzeFile(inputFile.toAbsolutePath(), constructs);
            log("  " + report.unproven().size() + " of " + report.totalConstructs()
                    + " constructs not proven exhaustive"
                    + (report.skipped().isEmpty() ? "" : ", " + report.skipped().size() + " skipped"));

            Reporter reporter = createReporter();
            writeReport(report, reporter);

            Set<Verdict> failOn = config.failOn();
            if (report.hasAny(failOn)) {
                if (outputFormat == OutputFormat.console) {
                    System.err.println();
                    System.err.println("Failing due to verdicts in failOn: " + failOn);
                }
                return 2;
            }
            return 0;

        } catch (ContractViolationException e) {
            System.err.println("Error: Invalid match construct (" + e.kind() + "): " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private AnalyzerConfig loadConfig() throws IOException {
        AnalyzerConfig defaultConfig = AnalyzerConfig.loadDefault();

        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            return defaultConfig.merge(AnalyzerConfig.loadFromFile(configFile));
        }

        // Check for match-scan.yaml next to the input
        Path parent = inputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Path localConfig = parent.resolve("match-scan.yaml");
            if (Files.exists(localConfig) && !localConfig.equals(inputFile.toAbsolutePath())) {
                log("Loading configuration from: " + localConfig);
                return defaultConfig.merge(AnalyzerConfig.loadFromFile(localConfig));
            }
        }

        return defaultConfig;
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor, detailed);
            case json -> new JsonReporter(true);
        };
    }

    private void writeReport(AnalysisReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out));
            reporter.write(report, out);
            out.flush();
        }
    }

    private void log(String message) {
        if (verbose && outputFormat != OutputFormat.json) {
            System.out.println(message);
        }
    }

    private void printBanner() {
        System.out.println("""
                ╔═══════════════════════════════════════════════════════════════╗
                ║                         MATCH-SCAN                            ║
                ║       Exhaustiveness Checking for Guarded Match Branches      ║
                ╚═══════════════════════════════════════════════════════════════╝
                """);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MatchScanCli()).execute(args);
        System.exit(exitCode);
    }
}
