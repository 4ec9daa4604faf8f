package ai.querygraph.modules;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads {@code baseUrl} and {@code paths} from the tsconfig.json / jsconfig.json nearest to a file.
 * <p>
 * One instance belongs to one analysis run. Lookups are memoized in concurrent maps, so
 * classification workers can share it.
 */
public final class PathAliasLoader {

    private static final ObjectMapper LENIENT_JSON = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();

    private static final Comparator<AliasEntry> ENTRY_ORDER = Comparator
            .comparing(AliasEntry::wildcard)
            .thenComparing(e -> -e.pattern().length())
            .thenComparing(AliasEntry::pattern);

    private record ResolvedAliases(String baseUrl, Map<String, List<String>> paths) {
        static final ResolvedAliases EMPTY = new ResolvedAliases(null, Map.of());
    }

    private final Map<String, Optional<String>> nearestConfig = new ConcurrentHashMap<>();
    private final Map<String, ResolvedAliases> parsedConfigs = new ConcurrentHashMap<>();
    private final Map<String, List<AliasEntry>> entriesByConfig = new ConcurrentHashMap<>();
    private final List<String> warnings = new CopyOnWriteArrayList<>();

    /**
     * Alias entries that apply to {@code fromFile}: exact patterns first, then longer patterns, then by text.
     */
    public List<AliasEntry> entriesFor(String fromFile, String workspaceRoot) {
        final Optional<String> config = findNearestConfig(fromFile, workspaceRoot);
        if (config.isEmpty()) {
            return List.of();
        }
        final List<AliasEntry> cached = entriesByConfig.get(config.get());
        if (cached != null) {
            return cached;
        }

        final ResolvedAliases resolved = merge(config.get(), new HashSet<>());
        final List<AliasEntry> entries = new ArrayList<>();
        for (var e : resolved.paths().entrySet()) {
            entries.add(new AliasEntry(e.getKey(), e.getValue()));
        }
        entries.sort(ENTRY_ORDER);
        final List<AliasEntry> out = List.copyOf(entries);
        entriesByConfig.put(config.get(), out);
        return out;
    }

    /** Configuration files that could not be read or parsed, with the reason. */
    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    Optional<String> findNearestConfig(String fromFile, String workspaceRoot) {
        final String startDir = PosixPaths.dirname(fromFile);
        final String cacheKey = workspaceRoot + "::" + startDir;
        return nearestConfig.computeIfAbsent(cacheKey, k -> searchUpwards(startDir, workspaceRoot));
    }

    private static Optional<String> searchUpwards(String startDir, String workspaceRoot) {
        String cursor = startDir;
        while (true) {
            for (String name : List.of("tsconfig.json", "jsconfig.json")) {
                final Path candidate = Path.of(cursor, name);
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(PosixPaths.resolve(cursor, name));
                }
            }
            if (cursor.equals(workspaceRoot)) {
                return Optional.empty();
            }
            final String parent = PosixPaths.dirname(cursor);
            if (parent.equals(cursor)) {
                return Optional.empty();
            }
            cursor = parent;
        }
    }

    private ResolvedAliases merge(String configPath, Set<String> seen) {
        final ResolvedAliases cached = parsedConfigs.get(configPath);
        if (cached != null) {
            return cached;
        }
        // cyclic extends
        if (!seen.add(configPath)) {
            return ResolvedAliases.EMPTY;
        }

        final JsonNode root = readConfig(configPath);
        final String configDir = PosixPaths.dirname(configPath);

        ResolvedAliases parent = ResolvedAliases.EMPTY;
        final JsonNode extendsNode = root.path("extends");
        if (extendsNode.isTextual()) {
            final String extended = resolveExtends(configDir, extendsNode.asText());
            if (extended != null) {
                parent = merge(extended, seen);
            }
        }

        String baseUrl = parent.baseUrl();
        final Map<String, List<String>> paths = new LinkedHashMap<>(parent.paths());

        final JsonNode compilerOptions = root.path("compilerOptions");
        final JsonNode baseUrlNode = compilerOptions.path("baseUrl");
        if (baseUrlNode.isTextual()) {
            baseUrl = PosixPaths.resolve(configDir, baseUrlNode.asText());
        }

        final JsonNode pathsNode = compilerOptions.path("paths");
        if (pathsNode.isObject()) {
            final String base = baseUrl != null ? baseUrl : configDir;
            final Iterator<Map.Entry<String, JsonNode>> fields = pathsNode.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().isEmpty() || !field.getValue().isArray()) {
                    continue;
                }
                final List<String> targets = new ArrayList<>();
                for (JsonNode target : field.getValue()) {
                    if (target.isTextual()) {
                        targets.add(PosixPaths.resolve(base, target.asText()));
                    }
                }
                if (!targets.isEmpty()) {
                    paths.put(field.getKey(), targets);
                }
            }
        }

        final ResolvedAliases merged = new ResolvedAliases(baseUrl, Map.copyOf(paths));
        parsedConfigs.put(configPath, merged);
        return merged;
    }

    private JsonNode readConfig(String configPath) {
        try {
            final String text = Files.readString(Path.of(configPath)).trim();
            if (text.isEmpty()) {
                return LENIENT_JSON.createObjectNode();
            }
            final JsonNode node = LENIENT_JSON.readTree(text);
            return node != null && node.isObject() ? node : LENIENT_JSON.createObjectNode();
        } catch (IOException e) {
            warnings.add(configPath + ": " + e.getMessage());
            return LENIENT_JSON.createObjectNode();
        }
    }

    /** Relative and absolute specifiers resolve against the config dir; others are looked up in node_modules. */
    static String resolveExtends(String configDir, String rawValue) {
        final String value = rawValue.trim();
        if (value.isEmpty()) {
            return null;
        }

        if (value.startsWith("./") || value.startsWith("../") || PosixPaths.isAbsolute(value)) {
            final String base = PosixPaths.resolve(configDir, value);
            final List<String> candidates = base.endsWith(".json") ? List.of(base) : List.of(base, base + ".json");
            for (String candidate : candidates) {
                if (Files.isRegularFile(Path.of(candidate))) {
                    return candidate;
                }
            }
            return null;
        }

        String cursor = configDir;
        while (true) {
            final String modules = cursor.equals("/") ? "/node_modules" : cursor + "/node_modules";
            if (Files.isDirectory(Path.of(modules))) {
                for (String candidate : List.of(value, value + ".json", value + "/tsconfig.json")) {
                    final String file = PosixPaths.resolve(modules, candidate);
                    if (Files.isRegularFile(Path.of(file))) {
                        return file;
                    }
                }
            }
            final String parent = PosixPaths.dirname(cursor);
            if (parent.equals(cursor)) {
                return null;
            }
            cursor = parent;
        }
    }
}
