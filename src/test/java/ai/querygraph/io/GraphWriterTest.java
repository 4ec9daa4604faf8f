package ai.querygraph.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.querygraph.SourceTree;
import ai.querygraph.graph.Graph;
import ai.querygraph.graph.GraphBuilder;
import ai.querygraph.scan.AnalysisResult;
import ai.querygraph.scan.SkippedFile;

class GraphWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tmp;

    @Test
    void writesGraphRecordsAndIndex() throws IOException {
        final SourceTree tree = new SourceTree(tmp.resolve("ws"))
                .write("src/Todo.tsx", """
                        import { useQuery, useQueryClient } from '@tanstack/react-query';

                        export function Todo() {
                          const qc = useQueryClient();
                          useQuery({ queryKey: ['todos'] });
                          return () => qc.invalidateQueries({ queryKey: ['todos'], exact: true });
                        }
                        """);
        final AnalysisResult result = tree.analyze();
        final Graph graph = new GraphBuilder(tree.layout()).build(result.records(), result.parseErrors());
        final Path out = tmp.resolve("out");

        new GraphWriter(out).writeAll(graph, result.records(),
                List.of(new SkippedFile(tree.path("src/huge.ts"), 900_000)), tree.layout(), "2024-01-01T00:00:00Z");

        final JsonNode index = mapper.readTree(out.resolve(GraphWriter.INDEX_FILE).toFile());
        assertEquals(GraphWriter.SCHEMA_VERSION, index.get("schema").asText());
        assertEquals("2024-01-01T00:00:00Z", index.get("generatedAt").asText());
        assertEquals("app", index.get("roots").get(0).get("name").asText());
        assertEquals(tree.path(""), index.get("roots").get(0).get("path").asText());
        assertEquals(GraphWriter.GRAPH_FILE, index.get("graph").asText());
        assertEquals(GraphWriter.RECORDS_FILE, index.get("records").asText());
        assertEquals(2, index.get("summary").get("callSites").asInt());
        assertEquals(1, index.get("summary").get("queryKeys").asInt());
        assertEquals(graph.edges().size(), index.get("summary").get("edges").asInt());
        assertEquals("src/huge.ts", index.get("skipped").get(0).get("file").asText());
        assertEquals(900_000, index.get("skipped").get(0).get("sizeBytes").asLong());

        final JsonNode graphJson = mapper.readTree(out.resolve(GraphWriter.GRAPH_FILE).toFile());
        assertEquals(graph.nodes().size(), graphJson.get("nodes").size());
        JsonNode keyNode = null;
        for (JsonNode node : graphJson.get("nodes")) {
            if ("queryKey".equals(node.get("kind").asText())) {
                keyNode = node;
            }
        }
        assertNotNull(keyNode);
        assertEquals("qk:todos", keyNode.get("id").asText());
        assertNull(keyNode.get("file"));

        final List<String> lines = Files.readAllLines(out.resolve(GraphWriter.RECORDS_FILE));
        assertEquals(2, lines.size());
        final JsonNode invalidation = mapper.readTree(lines.get(1));
        assertEquals("invalidates", invalidation.get("relation").asText());
        assertEquals("exact", invalidation.get("queryKey").get("matchMode").asText());
        assertEquals("static", invalidation.get("resolution").asText());
        assertEquals(6, invalidation.get("loc").get("line").asInt());
    }

    @Test
    void rewritingReplacesPreviousOutput() throws IOException {
        final SourceTree tree = new SourceTree(tmp.resolve("ws"))
                .write("src/a.ts", "export const a = 1;\n");
        final Graph empty = new GraphBuilder(tree.layout()).build(List.of(), List.of());
        final Path out = tmp.resolve("out");
        Files.createDirectories(out);
        Files.writeString(out.resolve(GraphWriter.RECORDS_FILE), "{\"stale\":true}\n{\"stale\":true}\n");

        new GraphWriter(out).writeAll(empty, List.of(), List.of(), tree.layout(), "now");

        assertTrue(Files.readAllLines(out.resolve(GraphWriter.RECORDS_FILE)).isEmpty());
        assertEquals(0, mapper.readTree(out.resolve(GraphWriter.INDEX_FILE).toFile()).get("summary").get("files").asInt());
    }
}
