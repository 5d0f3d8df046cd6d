package io.matchscan.input;

import io.matchscan.condition.ConditionParser;
import io.matchscan.condition.ConditionSyntaxException;
import io.matchscan.model.MatchBranch;
import io.matchscan.model.MatchConstruct;
import io.matchscan.model.Reference;
import io.matchscan.model.TypeEnvironment;
import io.matchscan.model.TypeShape;
import io.matchscan.model.TypeShape.BooleanType;
import io.matchscan.model.TypeShape.EnumType;
import io.matchscan.model.TypeShape.NullableType;
import io.matchscan.model.TypeShape.OpenType;
import io.matchscan.model.TypeShape.SumType;
import io.matchscan.model.TypeShape.Variant;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Loads match constructs from a YAML match file.
 * <p>
 * Format:
 * <pre>
 * types:
 *   Status:
 *     sum:
 *       - { name: Loading, singleton: true }
 *       - Ok
 *       - Error
 *   Problem:
 *     enum: [CONNECTION, AUTHENTICATION, UNKNOWN]
 *     closed: true          # optional, default true
 *   Flag: boolean
 *   Id: open
 *
 * matches:
 *   - name: render
 *     subject: status       # optional
 *     references:
 *       status: Status
 *       status.problem: Problem
 *       retries: { type: Int?, stable: false }
 *     branches:
 *       - Loading
 *       - is Ok
 *       - is Error if status.problem == CONNECTION
 *       - else
 * </pre>
 * Branches starting with {@code !} must be quoted, since YAML reads {@code !} as a tag.
 * Only {@code true} and {@code false} are booleans; {@code ON}, {@code OFF}, {@code Yes}, {@code No}
 * and the like stay names.
 * {@code Boolean} and the open built-ins ({@code Int}, {@code Long}, {@code Double}, {@code String},
 * {@code Char}, {@code Any}) need no declaration. A trailing {@code ?} makes any type nullable.
 */
public class MatchFileLoader {

    private static final Set<String> OPEN_BUILTINS = Set.of("Int", "Long", "Short", "Byte",
            "Double", "Float", "String", "Char", "Any");

    /**
     * Loads every construct of a match file.
     */
    public List<MatchConstruct> load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    /**
     * Loads every construct from a stream.
     *
     * @param sourceName Name used in error messages
     */
    public List<MatchConstruct> load(InputStream in, String sourceName) throws MatchFileException {
        Object data;
        try {
            data = newYaml().load(in);
        } catch (YAMLException e) {
            throw new MatchFileException("Invalid YAML in " + sourceName + ": " + e.getMessage(), e);
        }
        if (!(data instanceof Map<?, ?> root)) {
            throw new MatchFileException("Empty or invalid match file: " + sourceName);
        }

        Map<String, TypeShape> types = parseTypes(root.get("types"), sourceName);

        Object matches = root.get("matches");
        if (!(matches instanceof List<?> entries)) {
            throw new MatchFileException("Match file must contain a 'matches' list: " + sourceName);
        }
        List<MatchConstruct> constructs = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            MatchConstruct construct = parseConstruct(entries.get(i), i, types, sourceName);
            if (!names.add(construct.name())) {
                throw new MatchFileException("Duplicate match name '" + construct.name() + "' in " + sourceName);
            }
            constructs.add(construct);
        }
        return constructs;
    }

    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        return new Yaml(new Constructor(loaderOptions), new Representer(dumperOptions),
                dumperOptions, loaderOptions, new NamesResolver());
    }

    /**
     * YAML 1.1 resolver without the yes/no/on/off booleans.
     */
    private static final class NamesResolver extends Resolver {

        private static final Pattern TRUE_OR_FALSE = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");

        @Override
        protected void addImplicitResolvers() {
            addImplicitResolver(Tag.BOOL, TRUE_OR_FALSE, "tTfF");
            addImplicitResolver(Tag.INT, INT, "-+0123456789");
            addImplicitResolver(Tag.FLOAT, FLOAT, "-+0123456789.");
            addImplicitResolver(Tag.MERGE, MERGE, "<");
            addImplicitResolver(Tag.NULL, NULL, "~nN\0");
            addImplicitResolver(Tag.NULL, EMPTY, null);
            addImplicitResolver(Tag.TIMESTAMP, TIMESTAMP, "0123456789");
            addImplicitResolver(Tag.YAML, YAML, "!&*");
        }
    }

    // ---- types ----

    private Map<String, TypeShape> parseTypes(Object section, String sourceName) throws MatchFileException {
        Map<String, TypeShape> types = new LinkedHashMap<>();
        if (section == null) {
            return types;
        }
        if (!(section instanceof Map<?, ?> declarations)) {
            throw new MatchFileException("'types' must be a mapping in " + sourceName);
        }
        for (Map.Entry<?, ?> entry : declarations.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (name.equals("Boolean") || OPEN_BUILTINS.contains(name)) {
                throw new MatchFileException("Type '" + name + "' is built in and cannot be redeclared");
            }
            types.put(name, parseTypeDeclaration(name, entry.getValue()));
        }
        return types;
    }

    private TypeShape parseTypeDeclaration(String name, Object declaration) throws MatchFileException {
        if ("boolean".equals(declaration)) {
            return BooleanType.INSTANCE;
        }
        if ("open".equals(declaration)) {
            return new OpenType(name);
        }
        if (!(declaration instanceof Map<?, ?> body)) {
            throw new MatchFileException("Type '" + name + "' must be 'boolean', 'open', or a mapping with 'sum' or 'enum'");
        }
        try {
            if (body.containsKey("sum")) {
                return new SumType(name, parseVariants(name, body.get("sum")));
            }
            if (body.containsKey("enum")) {
                List<String> entries = stringList(body.get("enum"), "enum entries of " + name);
                return new EnumType(name, entries, booleanValue(body.get("closed"), true, "closed of " + name));
            }
        } catch (IllegalArgumentException e) {
            throw new MatchFileException("Invalid type '" + name + "': " + e.getMessage(), e);
        }
        if (Boolean.TRUE.equals(body.get("boolean"))) {
            return BooleanType.INSTANCE;
        }
        if (Boolean.TRUE.equals(body.get("open"))) {
            return new OpenType(name);
        }
        throw new MatchFileException("Type '" + name + "' declares none of sum, enum, boolean, open");
    }

    private List<Variant> parseVariants(String owner, Object list) throws MatchFileException {
        if (!(list instanceof List<?> items) || items.isEmpty()) {
            throw new MatchFileException("Variants of '" + owner + "' must be a non-empty list");
        }
        List<Variant> variants = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof String variantName) {
                variants.add(Variant.of(variantName));
            } else if (item instanceof Map<?, ?> spec) {
                Object nameValue = spec.get("name");
                if (!(nameValue instanceof String name) || name.isBlank()) {
                    throw new MatchFileException("Variant of '" + owner + "' needs a name: " + spec);
                }
                boolean singleton = booleanValue(spec.get("singleton"), false, "singleton of " + name);
                List<Variant> subVariants = spec.containsKey("variants")
                        ? parseVariants(name, spec.get("variants"))
                        : List.of();
                variants.add(new Variant(name, singleton, subVariants));
            } else {
                throw new MatchFileException("Invalid variant of '" + owner + "': " + item);
            }
        }
        return variants;
    }

    // ---- constructs ----

    private MatchConstruct parseConstruct(Object entry, int index, Map<String, TypeShape> types,
                                          String sourceName) throws MatchFileException {
        if (!(entry instanceof Map<?, ?> spec)) {
            throw new MatchFileException("Match #" + (index + 1) + " in " + sourceName + " must be a mapping");
        }
        Object nameValue = spec.get("name");
        String name = nameValue != null ? String.valueOf(nameValue) : "match#" + (index + 1);

        Reference subject = null;
        Object subjectValue = spec.get("subject");
        if (subjectValue != null) {
            subject = reference(String.valueOf(subjectValue), name);
        }

        TypeEnvironment.Builder env = TypeEnvironment.builder();
        Object refs = spec.get("references");
        if (refs != null && !(refs instanceof Map<?, ?>)) {
            throw new MatchFileException("'references' of match '" + name + "' must be a mapping");
        }
        if (refs instanceof Map<?, ?> refMap) {
            for (Map.Entry<?, ?> ref : refMap.entrySet()) {
                declareReference(env, name, String.valueOf(ref.getKey()), ref.getValue(), types);
            }
        }

        Object branchValue = spec.get("branches");
        if (!(branchValue instanceof List<?> branchList)) {
            throw new MatchFileException("Match '" + name + "' must have a 'branches' list");
        }
        List<MatchBranch> branches = new ArrayList<>();
        for (Object branch : branchList) {
            // YAML reads a bare null branch as a missing value
            String text = branch == null ? "null" : String.valueOf(branch);
            try {
                branches.add(ConditionParser.parseBranch(text, subject));
            } catch (ConditionSyntaxException e) {
                throw new MatchFileException("Match '" + name + "', branch '" + text + "': " + e.getMessage(), e);
            }
        }

        try {
            return new MatchConstruct(name, subject, env.build(), branches);
        } catch (IllegalArgumentException e) {
            throw new MatchFileException("Invalid match '" + name + "': " + e.getMessage(), e);
        }
    }

    private void declareReference(TypeEnvironment.Builder env, String constructName, String path, Object spec,
                                  Map<String, TypeShape> types) throws MatchFileException {
        String typeSpec;
        boolean stable = true;
        if (spec instanceof String s) {
            typeSpec = s;
        } else if (spec instanceof Map<?, ?> map) {
            Object type = map.get("type");
            if (!(type instanceof String s)) {
                throw new MatchFileException("Reference '" + path + "' of match '" + constructName + "' needs a type");
            }
            typeSpec = s;
            stable = booleanValue(map.get("stable"), true, "stable of " + path);
        } else {
            throw new MatchFileException("Invalid type for reference '" + path + "' of match '" + constructName + "'");
        }
        env.declare(reference(path, constructName), resolveType(typeSpec.trim(), types, constructName), stable);
    }

    private TypeShape resolveType(String spec, Map<String, TypeShape> types, String constructName)
            throws MatchFileException {
        if (spec.endsWith("?")) {
            return new NullableType(resolveType(spec.substring(0, spec.length() - 1), types, constructName));
        }
        TypeShape declared = types.get(spec);
        if (declared != null) {
            return declared;
        }
        if (spec.equals("Boolean")) {
            return BooleanType.INSTANCE;
        }
        if (OPEN_BUILTINS.contains(spec)) {
            return new OpenType(spec);
        }
        throw new MatchFileException("Unknown type '" + spec + "' in match '" + constructName + "'");
    }

    private static Reference reference(String path, String constructName) throws MatchFileException {
        try {
            return Reference.of(path.trim());
        } catch (IllegalArgumentException e) {
            throw new MatchFileException("Invalid reference '" + path + "' in match '" + constructName + "'", e);
        }
    }

    // ---- YAML helpers ----

    private static List<String> stringList(Object value, String what) throws MatchFileException {
        if (!(value instanceof List<?> list)) {
            throw new MatchFileException("Expected a list for " + what);
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item == null || String.valueOf(item).isBlank()) {
                throw new MatchFileException("Blank item in " + what);
            }
            result.add(String.valueOf(item).trim());
        }
        return result;
    }

    private static boolean booleanValue(Object value, boolean fallback, String what) throws MatchFileException {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new MatchFileException("Expected true or false for " + what + ", got: " + value);
    }
}
