package ai.querygraph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.querygraph.io.GraphWriter;
import ai.querygraph.model.Ids;
import ai.querygraph.modules.WorkspaceLayout;
import ai.querygraph.modules.WorkspaceRoot;
import ai.querygraph.scan.ScanOptions;

class MainTest {

    private static final String TODO_SOURCE = """
            import { useQuery, useQueryClient } from '@tanstack/react-query';

            export function Todo() {
              const qc = useQueryClient();
              useQuery({ queryKey: ['todos'] });
              return () => qc.invalidateQueries({ queryKey: ['todos'] });
            }
            """;

    @TempDir
    Path tmp;

    @Test
    void helpAndUsageErrors() {
        assertEquals(0, Main.run(new String[] {"--help"}));
        assertEquals(2, Main.run(new String[] {"--verbose"}));
        assertEquals(2, Main.run(new String[] {"--threads=many"}));
    }

    @Test
    void missingRootIsAnIoFailure() {
        assertEquals(2, Main.run(new String[] {tmp.resolve("absent").toString(), "--threads=1"}));
    }

    @Test
    void malformedNamedRootFails() {
        assertEquals(1, Main.run(new String[] {"--roots=broken", "--threads=1"}));
    }

    @Test
    void writesOutputBelowTheFirstRootByDefault() throws IOException {
        new SourceTree(tmp.resolve("web")).write("src/Todo.tsx", TODO_SOURCE);

        assertEquals(0, Main.run(new String[] {tmp.resolve("web").toString(), "--threads=2"}));

        final Path out = tmp.resolve("web").resolve(Main.DEFAULT_OUT_DIR);
        assertTrue(Files.isRegularFile(out.resolve(GraphWriter.GRAPH_FILE)));
        assertTrue(Files.isRegularFile(out.resolve(GraphWriter.RECORDS_FILE)));
        final JsonNode index = new ObjectMapper().readTree(out.resolve(GraphWriter.INDEX_FILE).toFile());
        assertEquals("web", index.get("roots").get(0).get("name").asText());
        assertEquals(2, index.get("summary").get("callSites").asInt());
    }

    @Test
    void configFileFillsWhatTheCommandLineLeavesOut() throws IOException {
        new SourceTree(tmp.resolve("web")).write("src/Todo.tsx", TODO_SOURCE);
        final Path config = tmp.resolve("query-graph.json");
        Files.writeString(config, """
                {
                  "roots": { "frontend": "%s" },
                  "outDir": "graph-out",
                  "threads": 1,
                  "maxFileSizeKB": 64
                }
                """.formatted(Ids.normalizePath(tmp.resolve("web"))));

        assertEquals(0, Main.run(new String[] {"--config=" + config, "--outDir=" + tmp.resolve("cli-out")}));

        assertTrue(Files.isRegularFile(tmp.resolve("cli-out").resolve(GraphWriter.INDEX_FILE)));
        assertFalse(Files.exists(tmp.resolve("web").resolve("graph-out")));
        final JsonNode index = new ObjectMapper().readTree(tmp.resolve("cli-out").resolve(GraphWriter.INDEX_FILE).toFile());
        assertEquals("frontend", index.get("roots").get(0).get("name").asText());
    }

    @Test
    void missingConfigFileIsAnIoFailure() {
        assertEquals(2, Main.run(new String[] {"--config=" + tmp.resolve("none.json")}));
    }

    @Test
    void parseCollectsFlagsAndPositionalRoots() throws Main.UsageException {
        final Main.CliArgs cli = Main.CliArgs.parse(new String[] {
                "apps/web", "--folders=src, lib", "--include=**/*.{ts,tsx}", "--useGitIgnore=false",
                "--maxFileSizeKB=100", "--threads=4", "-h"});

        assertTrue(cli.help);
        assertEquals(List.of("apps/web"), cli.positionalRoots);
        assertNull(cli.exclude);

        final ScanOptions options = cli.scanOptions();
        assertEquals(List.of("src", "lib"), options.folders());
        assertEquals("**/*.{ts,tsx}", options.include());
        assertEquals(ScanOptions.DEFAULT_EXCLUDE, options.exclude());
        assertFalse(options.useGitIgnore());
        assertEquals(100, options.maxFileSizeKB());
        assertEquals(4, options.threads());
    }

    @Test
    void layoutNamesRootsAndDropsDuplicatePaths() throws Main.UsageException {
        final String a = Ids.normalizePath(tmp.resolve("one/app"));
        final String b = Ids.normalizePath(tmp.resolve("two/app"));
        final Main.CliArgs cli = Main.CliArgs.parse(new String[] {"--roots=main=" + a, a, b, b});

        final WorkspaceLayout layout = cli.layout();

        assertEquals(List.of(new WorkspaceRoot("main", a), new WorkspaceRoot("app", b)), layout.roots());
    }

    @Test
    void layoutSuffixesRepeatedNames() throws Main.UsageException {
        final String a = Ids.normalizePath(tmp.resolve("one/app"));
        final String b = Ids.normalizePath(tmp.resolve("two/app"));

        final WorkspaceLayout layout = Main.CliArgs.parse(new String[] {a, b}).layout();

        assertEquals(List.of("app", "app-2"), layout.roots().stream().map(WorkspaceRoot::name).toList());
        assertThrows(Main.UsageException.class, () -> Main.CliArgs.parse(new String[] {"--maxFileSizeKB=big"}));
    }
}
