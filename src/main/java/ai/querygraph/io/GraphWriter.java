package ai.querygraph.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.querygraph.graph.Graph;
import ai.querygraph.model.CallSiteRecord;
import ai.querygraph.modules.WorkspaceLayout;
import ai.querygraph.modules.WorkspaceRoot;
import ai.querygraph.scan.SkippedFile;

public final class GraphWriter {

    public static final String SCHEMA_VERSION = "query-graph/v1";

    public static final String GRAPH_FILE = "graph.json";
    public static final String INDEX_FILE = "index.json";
    public static final String RECORDS_FILE = "records.jsonl";

    private final Path outDir;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper jsonlMapper;

    public GraphWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.jsonlMapper = new ObjectMapper();
    }

    public void writeAll(Graph graph, List<CallSiteRecord> records, List<SkippedFile> skipped,
                         WorkspaceLayout layout, String generatedAt) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(skipped, "skipped");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);

        writeJson(outDir.resolve(GRAPH_FILE), graph);
        writeJsonl(outDir.resolve(RECORDS_FILE), records);

        final List<RootEntry> roots = new ArrayList<>(layout.roots().size());
        for (WorkspaceRoot root : layout.roots()) {
            roots.add(new RootEntry(root.name(), root.path()));
        }
        final List<SkippedEntry> skippedEntries = new ArrayList<>(skipped.size());
        for (SkippedFile file : skipped) {
            skippedEntries.add(new SkippedEntry(layout.displayPath(file.file()), file.sizeBytes()));
        }

        final MasterIndex idx = new MasterIndex(
                SCHEMA_VERSION,
                generatedAt,
                roots,
                GRAPH_FILE,
                RECORDS_FILE,
                new Summary(
                        graph.summary().files(),
                        graph.summary().actions(),
                        graph.summary().queryKeys(),
                        graph.edges().size(),
                        records.size(),
                        graph.summary().parseErrors()
                ),
                skippedEntries
        );
        writeJson(outDir.resolve(INDEX_FILE), idx);
    }

    private void writeJson(Path file, Object data) throws IOException {
        jsonMapper.writeValue(file.toFile(), data);
    }

    private <T> void writeJsonl(Path file, List<T> lines) throws IOException {
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {

            for (T line : lines) {
                bw.write(jsonlMapper.writeValueAsString(line));
                bw.newLine();
            }
        }
    }

    // --- index records ---

    public record MasterIndex(
            String schema,
            String generatedAt,
            List<RootEntry> roots,
            String graph,
            String records,
            Summary summary,
            List<SkippedEntry> skipped
    ) {
    }

    public record RootEntry(String name, String path) {
    }

    public record SkippedEntry(String file, long sizeBytes) {
    }

    public record Summary(
            int files,
            int actions,
            int queryKeys,
            int edges,
            int callSites,
            int parseErrors
    ) {
    }
}
