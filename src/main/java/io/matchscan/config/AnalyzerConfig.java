package io.matchscan.config;

import io.matchscan.model.Verdict;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Analyzer settings loaded from YAML.
 * <p>
 * The defaults ship as a classpath resource; a project file only needs the keys it changes.
 */
public class AnalyzerConfig {

    private static final String DEFAULT_CONFIG = "/match-scan-defaults.yaml";

    private static final int FALLBACK_MAX_REFERENCES = 32;
    private static final long FALLBACK_MAX_STEPS = 1_000_000L;

    private final Map<String, Object> raw;
    private final int maxReferences;
    private final long maxSteps;
    private final boolean parallel;
    private final Set<Verdict> failOn;
    private final List<Pattern> excludeConstructs;

    private AnalyzerConfig(Map<String, Object> config) {
        this.raw = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        this.maxReferences = getInt(config, "maxReferences", FALLBACK_MAX_REFERENCES);
        this.maxSteps = getLong(config, "maxSteps", FALLBACK_MAX_STEPS);
        this.parallel = getBoolean(config, "parallel", false);
        this.failOn = getVerdicts(config, "failOn");
        this.excludeConstructs = compilePatterns(getStrings(config, "excludeConstructs"));
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static AnalyzerConfig loadDefault() {
        try (InputStream is = AnalyzerConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads configuration from a file path.
     */
    public static AnalyzerConfig loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public static AnalyzerConfig load(InputStream is) {
        Yaml yaml = new Yaml();
        Object data = yaml.load(is);
        if (data != null && !(data instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Configuration must be a YAML mapping");
        }
        return fromMap(data == null ? Map.of() : asStringMap((Map<?, ?>) data));
    }

    /**
     * Builds a configuration from already-parsed keys; missing keys take built-in fallbacks.
     */
    public static AnalyzerConfig fromMap(Map<String, ?> config) {
        return new AnalyzerConfig(new LinkedHashMap<>(config));
    }

    /**
     * Merges this configuration with another; keys present in {@code other} win,
     * exclusion patterns are combined.
     */
    public AnalyzerConfig merge(AnalyzerConfig other) {
        Map<String, Object> merged = new LinkedHashMap<>(raw);
        merged.putAll(other.raw);
        Set<String> patterns = new LinkedHashSet<>();
        for (Pattern p : excludeConstructs) {
            patterns.add(p.pattern());
        }
        for (Pattern p : other.excludeConstructs) {
            patterns.add(p.pattern());
        }
        merged.put("excludeConstructs", new ArrayList<>(patterns));
        return new AnalyzerConfig(merged);
    }

    public int maxReferences() {
        return maxReferences;
    }

    public long maxSteps() {
        return maxSteps;
    }

    public boolean parallel() {
        return parallel;
    }

    /**
     * Verdicts that make the command line exit with a failure code.
     */
    public Set<Verdict> failOn() {
        return failOn;
    }

    public List<Pattern> excludeConstructs() {
        return excludeConstructs;
    }

    /**
     * True if a construct name matches one of the exclusion patterns.
     */
    public boolean isExcluded(String constructName) {
        for (Pattern pattern : excludeConstructs) {
            if (pattern.matcher(constructName).matches()) {
                return true;
            }
        }
        return false;
    }

    // ---- YAML helpers ----

    private static Map<String, Object> asStringMap(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static int getInt(Map<String, Object> config, String key, int fallback) {
        Object value = config.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n && n.intValue() > 0) {
            return n.intValue();
        }
        throw new IllegalArgumentException("'" + key + "' must be a positive integer, got: " + value);
    }

    private static long getLong(Map<String, Object> config, String key, long fallback) {
        Object value = config.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n && n.longValue() > 0) {
            return n.longValue();
        }
        throw new IllegalArgumentException("'" + key + "' must be a positive integer, got: " + value);
    }

    private static boolean getBoolean(Map<String, Object> config, String key, boolean fallback) {
        Object value = config.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("'" + key + "' must be true or false, got: " + value);
    }

    private static List<String> getStrings(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof String s && !s.isBlank()) {
                    result.add(s.trim());
                }
            }
            return List.copyOf(result);
        }
        return List.of();
    }

    private static Set<Verdict> getVerdicts(Map<String, Object> config, String key) {
        Set<Verdict> verdicts = EnumSet.noneOf(Verdict.class);
        for (String name : getStrings(config, key)) {
            try {
                verdicts.add(Verdict.valueOf(name.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown verdict in '" + key + "': " + name
                        + " (valid: " + Arrays.toString(Verdict.values()) + ")", e);
            }
        }
        return Collections.unmodifiableSet(verdicts);
    }

    /**
     * Compiles regex patterns. Invalid patterns are reported and skipped.
     */
    private static List<Pattern> compilePatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : patterns) {
            try {
                compiled.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                System.err.println("Warning: Invalid exclude pattern '" + regex + "': " + e.getMessage());
            }
        }
        return List.copyOf(compiled);
    }
}
