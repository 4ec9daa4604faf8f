package ai.querygraph.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import ai.querygraph.ast.SourceFile;
import ai.querygraph.classify.CallSiteClassifier;
import ai.querygraph.model.CallSiteRecord;
import ai.querygraph.model.ParseError;
import ai.querygraph.modules.ModuleResolver;
import ai.querygraph.modules.PathAliasLoader;
import ai.querygraph.modules.WorkspaceLayout;
import ai.querygraph.modules.WorkspaceRoot;
import ai.querygraph.parse.SourceParseException;
import ai.querygraph.parse.TsSourceParser;
import ai.querygraph.resolve.SymbolReferenceResolver;
import ai.querygraph.symbols.SymbolIndex;

/**
 * Runs one analysis over all workspace roots.
 * Phases, strictly in order:
 * 1) collect files per root (a file under several roots belongs to the longest one)
 * 2) parse every file on the worker pool; failures become {@link ParseError}s
 * 3) per root: build the symbol index on the calling thread
 * 4) per root: classify every parsed file on the worker pool, one resolver per file
 * Records are concatenated in file order, independent of scheduling.
 */
public final class AnalysisPipeline {

    private final ScanOptions options;
    private final TsSourceParser parser;

    public AnalysisPipeline(ScanOptions options) {
        this(options, new TsSourceParser());
    }

    public AnalysisPipeline(ScanOptions options, TsSourceParser parser) {
        this.options = Objects.requireNonNull(options, "options");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public AnalysisResult run(WorkspaceLayout layout) throws IOException {
        Objects.requireNonNull(layout, "layout");

        // Step 1: files per root
        final SourceFileCollector collector = new SourceFileCollector(options);
        final Map<WorkspaceRoot, List<String>> filesByRoot = new LinkedHashMap<>();
        final List<SkippedFile> skipped = new ArrayList<>();
        final List<String> scannedFiles = new ArrayList<>();
        for (WorkspaceRoot root : layout.roots()) {
            final SourceFileCollector.Collected collected = collector.collect(Path.of(root.path()));
            final List<String> owned = new ArrayList<>();
            for (String file : collected.files()) {
                if (root.equals(layout.bestRootFor(file))) {
                    owned.add(file);
                }
            }
            for (SkippedFile file : collected.skipped()) {
                if (root.equals(layout.bestRootFor(file.file()))) {
                    skipped.add(file);
                    System.err.println("WARN: skipped " + file.file() + " (" + (file.sizeBytes() / 1024)
                            + " KB > " + options.maxFileSizeKB() + " KB)");
                }
            }
            filesByRoot.put(root, owned);
            scannedFiles.addAll(owned);
        }

        final ExecutorService pool = Executors.newFixedThreadPool(options.threads());
        try {
            // Step 2: parse
            final List<Future<Parsed>> parseTasks = new ArrayList<>(scannedFiles.size());
            for (String file : scannedFiles) {
                parseTasks.add(pool.submit(() -> parse(file)));
            }
            final Map<String, SourceFile> parsed = new LinkedHashMap<>();
            final List<ParseError> parseErrors = new ArrayList<>();
            for (Future<Parsed> task : parseTasks) {
                final Parsed result = await(task);
                if (result.file() != null) {
                    parsed.put(result.file().path(), result.file());
                } else {
                    parseErrors.add(result.error());
                    System.err.println("WARN: parse failed for " + result.error().file() + " -> "
                            + SourceFileCollector.safeMsg(result.error().message()));
                }
            }

            // Steps 3 and 4, root by root
            final PathAliasLoader aliases = new PathAliasLoader();
            final List<CallSiteRecord> records = new ArrayList<>();
            for (var entry : filesByRoot.entrySet()) {
                final List<SourceFile> rootFiles = new ArrayList<>();
                for (String file : entry.getValue()) {
                    final SourceFile sourceFile = parsed.get(file);
                    if (sourceFile != null) {
                        rootFiles.add(sourceFile);
                    }
                }
                records.addAll(classifyAll(pool, entry.getKey(), rootFiles, aliases));
            }
            for (String warning : aliases.warnings()) {
                System.err.println("WARN: " + SourceFileCollector.safeMsg(warning));
            }
            return new AnalysisResult(records, parseErrors, scannedFiles, skipped);
        } finally {
            pool.shutdownNow();
        }
    }

    private List<CallSiteRecord> classifyAll(ExecutorService pool, WorkspaceRoot root, List<SourceFile> files,
                                             PathAliasLoader aliases) throws IOException {
        final SymbolIndex index = SymbolIndex.build(files);
        final ModuleResolver modules = new ModuleResolver(index.fileSet(), root.path(), aliases);

        final List<Future<List<CallSiteRecord>>> tasks = new ArrayList<>(files.size());
        for (SourceFile file : files) {
            final Callable<List<CallSiteRecord>> task = () -> new CallSiteClassifier(
                    new SymbolReferenceResolver(file.path(), index, modules)).classify(file);
            tasks.add(pool.submit(task));
        }
        final List<CallSiteRecord> out = new ArrayList<>();
        for (Future<List<CallSiteRecord>> task : tasks) {
            out.addAll(await(task));
        }
        return out;
    }

    private Parsed parse(String file) {
        final String text;
        try {
            text = new String(Files.readAllBytes(Path.of(file)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return Parsed.failed(new ParseError(file, String.valueOf(e.getMessage())));
        }
        try {
            return Parsed.ok(parser.parse(file, text));
        } catch (SourceParseException e) {
            return Parsed.failed(new ParseError(file, e.getMessage()));
        }
    }

    /** Waits for a worker result; worker failures are rethrown unwrapped. */
    private static <T> T await(Future<T> task) throws IOException {
        try {
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("analysis interrupted", e);
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }

    private record Parsed(SourceFile file, ParseError error) {
        static Parsed ok(SourceFile file) {
            return new Parsed(file, null);
        }

        static Parsed failed(ParseError error) {
            return new Parsed(null, error);
        }
    }
}
