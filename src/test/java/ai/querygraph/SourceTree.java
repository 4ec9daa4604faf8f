package ai.querygraph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import ai.querygraph.graph.Graph;
import ai.querygraph.graph.GraphBuilder;
import ai.querygraph.model.CallSiteRecord;
import ai.querygraph.model.Ids;
import ai.querygraph.model.Relation;
import ai.querygraph.modules.WorkspaceLayout;
import ai.querygraph.modules.WorkspaceRoot;
import ai.querygraph.scan.AnalysisPipeline;
import ai.querygraph.scan.AnalysisResult;
import ai.querygraph.scan.ScanOptions;

/** A throwaway workspace on disk, written file by file and analysed end to end. */
public final class SourceTree {

    private final Path root;

    public SourceTree(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    public String path(String relative) {
        return Ids.normalizePath(root.resolve(relative));
    }

    public SourceTree write(String relative, String content) {
        try {
            final Path file = root.resolve(relative);
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public WorkspaceLayout layout() {
        return new WorkspaceLayout(List.of(new WorkspaceRoot("app", Ids.normalizePath(root))));
    }

    public AnalysisResult analyze() throws IOException {
        return analyze(ScanOptions.defaults().withThreads(2));
    }

    public AnalysisResult analyze(ScanOptions options) throws IOException {
        return new AnalysisPipeline(options).run(layout());
    }

    public Graph graph() throws IOException {
        final AnalysisResult result = analyze();
        return new GraphBuilder(layout()).build(result.records(), result.parseErrors());
    }

    /** "relation operation display" per record, in record order. */
    public static List<String> describe(List<CallSiteRecord> records) {
        return records.stream()
                .map(r -> r.relation().label() + " " + r.operation() + " " + r.queryKey().display())
                .collect(Collectors.toList());
    }

    public static List<CallSiteRecord> withRelation(List<CallSiteRecord> records, Relation relation) {
        return records.stream().filter(r -> r.relation() == relation).collect(Collectors.toList());
    }
}
