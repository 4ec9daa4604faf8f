package ai.querygraph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.querygraph.graph.Graph;
import ai.querygraph.graph.GraphBuilder;
import ai.querygraph.io.GraphWriter;
import ai.querygraph.model.Ids;
import ai.querygraph.modules.PosixPaths;
import ai.querygraph.modules.WorkspaceLayout;
import ai.querygraph.modules.WorkspaceRoot;
import ai.querygraph.scan.AnalysisPipeline;
import ai.querygraph.scan.AnalysisResult;
import ai.querygraph.scan.ScanOptions;

public final class Main {

    static final String DEFAULT_OUT_DIR = ".query-graph";

    private Main() {
    }

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        final CliArgs cli;
        try {
            cli = CliArgs.parse(args);
        } catch (UsageException ex) {
            System.err.println("ERROR: " + ex.getMessage());
            printUsage();
            return 2;
        }
        if (cli.help) {
            printUsage();
            return 0;
        }

        try {
            if (cli.config != null) {
                final Path configPath = cli.config.toAbsolutePath().normalize();
                if (!Files.isRegularFile(configPath)) {
                    throw new IOException("Config file not found: " + configPath);
                }
                cli.fillFrom(new ObjectMapper().readTree(configPath.toFile()));
            }

            final WorkspaceLayout layout = cli.layout();
            final ScanOptions options = cli.scanOptions();

            Path outDir = cli.outDir;
            final Path firstRoot = Paths.get(layout.roots().get(0).path());
            if (outDir == null) {
                outDir = firstRoot.resolve(DEFAULT_OUT_DIR);
            } else if (!outDir.isAbsolute()) {
                outDir = firstRoot.resolve(outDir).normalize();
            }

            final AnalysisResult result = new AnalysisPipeline(options).run(layout);
            final Graph graph = new GraphBuilder(layout).build(result.records(), result.parseErrors());

            final GraphWriter writer = new GraphWriter(outDir);
            writer.writeAll(graph, result.records(), result.skippedFiles(), layout, Instant.now().toString());

            System.out.println("Query graph written to: " + outDir);
            System.out.println("Schema: " + GraphWriter.SCHEMA_VERSION);
            System.out.println("Files scanned: " + result.scannedFiles().size()
                    + ", call sites: " + result.records().size()
                    + ", nodes: " + graph.nodes().size()
                    + " (files " + graph.summary().files()
                    + ", actions " + graph.summary().actions()
                    + ", keys " + graph.summary().queryKeys() + ")"
                    + ", edges: " + graph.edges().size());
            if (!result.parseErrors().isEmpty()) {
                System.err.println("WARN: parse errors: " + result.parseErrors().size());
            }
            if (!result.skippedFiles().isEmpty()) {
                System.err.println("WARN: skipped oversized files: " + result.skippedFiles().size());
            }
            return 0;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build query graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static void printUsage() {
        System.out.println("Usage: query-graph [root...] [options]");
        System.out.println("Options:");
        System.out.println("  --roots=<name=path,...>   Named workspace roots (added to positional roots)");
        System.out.println("  --folders=<f1,f2>         Folders to scan below each root (default: .)");
        System.out.println("  --include=<globs>         Include globs (default: " + ScanOptions.DEFAULT_INCLUDE + ")");
        System.out.println("  --exclude=<globs>         Exclude globs (default: node_modules, dist, build, ...)");
        System.out.println("  --useGitIgnore=<bool>     Honour .gitignore files (default: true)");
        System.out.println("  --maxFileSizeKB=<n>       Skip larger files (default: " + ScanOptions.DEFAULT_MAX_FILE_SIZE_KB + ")");
        System.out.println("  --threads=<n>             Worker threads (default: available processors)");
        System.out.println("  --outDir=<path>           Output directory (default: <first root>/" + DEFAULT_OUT_DIR + ")");
        System.out.println("  --config=<file.json>      JSON file with the same keys; command-line flags win");
        System.out.println("  --help, -h                Show this help");
    }

    static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    /**
     * Raw command-line settings. Unset values stay null so a config file can fill them.
     */
    static final class CliArgs {
        boolean help;
        final List<String> positionalRoots = new ArrayList<>();
        final List<String> namedRoots = new ArrayList<>();
        List<String> folders;
        String include;
        String exclude;
        Boolean useGitIgnore;
        Integer maxFileSizeKB;
        Integer threads;
        Path outDir;
        Path config;

        static CliArgs parse(String[] args) throws UsageException {
            final CliArgs cli = new CliArgs();
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    cli.help = true;
                    continue;
                }
                if (arg.startsWith("--roots=")) {
                    cli.namedRoots.addAll(splitList(arg.substring("--roots=".length())));
                    continue;
                }
                if (arg.startsWith("--folders=")) {
                    cli.folders = splitList(arg.substring("--folders=".length()));
                    continue;
                }
                if (arg.startsWith("--include=")) {
                    cli.include = arg.substring("--include=".length());
                    continue;
                }
                if (arg.startsWith("--exclude=")) {
                    cli.exclude = arg.substring("--exclude=".length());
                    continue;
                }
                if (arg.startsWith("--useGitIgnore=")) {
                    cli.useGitIgnore = Boolean.parseBoolean(arg.substring("--useGitIgnore=".length()));
                    continue;
                }
                if (arg.startsWith("--maxFileSizeKB=")) {
                    cli.maxFileSizeKB = parseInt("--maxFileSizeKB", arg.substring("--maxFileSizeKB=".length()));
                    continue;
                }
                if (arg.startsWith("--threads=")) {
                    cli.threads = parseInt("--threads", arg.substring("--threads=".length()));
                    continue;
                }
                if (arg.startsWith("--outDir=")) {
                    cli.outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--config=")) {
                    cli.config = Paths.get(arg.substring("--config=".length()));
                    continue;
                }
                if (arg.startsWith("-")) {
                    throw new UsageException("unknown argument: " + arg);
                }
                cli.positionalRoots.add(arg);
            }
            return cli;
        }

        /** Copies config values for every setting the command line left unset. */
        void fillFrom(JsonNode json) {
            if (json == null || !json.isObject()) {
                throw new IllegalArgumentException("config must be a JSON object");
            }
            if (positionalRoots.isEmpty() && namedRoots.isEmpty() && json.has("roots")) {
                final JsonNode roots = json.get("roots");
                if (roots.isObject()) {
                    final Iterator<Map.Entry<String, JsonNode>> fields = roots.fields();
                    while (fields.hasNext()) {
                        final Map.Entry<String, JsonNode> field = fields.next();
                        namedRoots.add(field.getKey() + "=" + field.getValue().asText());
                    }
                } else {
                    positionalRoots.addAll(textList(roots));
                }
            }
            if (folders == null && json.has("folders")) {
                folders = textList(json.get("folders"));
            }
            if (include == null && json.hasNonNull("include")) {
                include = json.get("include").asText();
            }
            if (exclude == null && json.hasNonNull("exclude")) {
                exclude = json.get("exclude").asText();
            }
            if (useGitIgnore == null && json.hasNonNull("useGitIgnore")) {
                useGitIgnore = json.get("useGitIgnore").asBoolean();
            }
            if (maxFileSizeKB == null && json.hasNonNull("maxFileSizeKB")) {
                maxFileSizeKB = json.get("maxFileSizeKB").asInt();
            }
            if (threads == null && json.hasNonNull("threads")) {
                threads = json.get("threads").asInt();
            }
            if (outDir == null && json.hasNonNull("outDir")) {
                outDir = Paths.get(json.get("outDir").asText());
            }
        }

        ScanOptions scanOptions() {
            ScanOptions options = ScanOptions.defaults();
            if (folders != null) {
                options = options.withFolders(folders);
            }
            if (include != null) {
                options = options.withInclude(include);
            }
            if (exclude != null) {
                options = options.withExclude(exclude);
            }
            if (useGitIgnore != null) {
                options = options.withUseGitIgnore(useGitIgnore);
            }
            if (maxFileSizeKB != null) {
                options = options.withMaxFileSizeKB(maxFileSizeKB);
            }
            if (threads != null) {
                options = options.withThreads(threads);
            }
            return options;
        }

        /**
         * Positional roots are named after their directory; duplicate names get a numeric suffix.
         * No roots at all means the current directory.
         */
        WorkspaceLayout layout() {
            if (positionalRoots.isEmpty() && namedRoots.isEmpty()) {
                return WorkspaceLayout.currentDirectory();
            }
            final List<WorkspaceRoot> roots = new ArrayList<>();
            final Set<String> names = new LinkedHashSet<>();
            final Set<String> paths = new LinkedHashSet<>();
            for (String spec : namedRoots) {
                final int eq = spec.indexOf('=');
                if (eq <= 0 || eq == spec.length() - 1) {
                    throw new IllegalArgumentException("expected name=path in --roots: " + spec);
                }
                addRoot(roots, names, paths, spec.substring(0, eq).trim(), spec.substring(eq + 1).trim());
            }
            for (String path : positionalRoots) {
                final String normalized = Ids.normalizePath(Paths.get(path));
                String name = PosixPaths.basename(normalized);
                if (name.isEmpty()) {
                    name = "workspace";
                }
                addRoot(roots, names, paths, name, path);
            }
            return new WorkspaceLayout(roots);
        }

        private static void addRoot(List<WorkspaceRoot> roots, Set<String> names, Set<String> paths,
                                    String name, String path) {
            final String normalized = Ids.normalizePath(Paths.get(path));
            if (!paths.add(normalized)) {
                return;
            }
            String unique = name;
            int suffix = 2;
            while (!names.add(unique)) {
                unique = name + "-" + suffix++;
            }
            roots.add(new WorkspaceRoot(unique, normalized));
        }

        private static List<String> splitList(String list) {
            final String trimmed = list.trim();
            if (trimmed.isEmpty()) {
                return List.of();
            }
            return Arrays.stream(trimmed.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }

        private static List<String> textList(JsonNode node) {
            final List<String> out = new ArrayList<>();
            if (node.isArray()) {
                for (JsonNode item : node) {
                    out.add(item.asText());
                }
            } else if (!node.isNull()) {
                out.addAll(splitList(node.asText()));
            }
            return out;
        }

        private static Integer parseInt(String flag, String value) throws UsageException {
            try {
                return Integer.valueOf(value.trim());
            } catch (NumberFormatException ex) {
                throw new UsageException(flag + " expects a number: " + value);
            }
        }
    }
}
