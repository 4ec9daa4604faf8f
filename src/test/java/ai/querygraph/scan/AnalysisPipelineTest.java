package ai.querygraph.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.querygraph.SourceTree;
import ai.querygraph.graph.Graph;
import ai.querygraph.graph.GraphBuilder;
import ai.querygraph.model.CallSiteRecord;
import ai.querygraph.model.Ids;
import ai.querygraph.modules.WorkspaceLayout;
import ai.querygraph.modules.WorkspaceRoot;

class AnalysisPipelineTest {

    @TempDir
    Path tmp;

    private static final String TODO_LIST = """
            import { useQuery } from '@tanstack/react-query';
            import { todoKeys } from './keys';

            export function TodoList() {
              return useQuery({ queryKey: todoKeys.list('open'), queryFn: fetchTodos });
            }
            """;

    private static final String KEYS = """
            export const todoKeys = {
              all: ['todos'],
              list: (filter) => [...todoKeys.all, 'list', filter],
            };
            """;

    private static final String ADD_TODO = """
            import { useMutation, useQueryClient } from '@tanstack/react-query';
            import { todoKeys } from './keys';

            export function useAddTodo() {
              const queryClient = useQueryClient();
              return useMutation({
                mutationFn: addTodo,
                onSuccess: () => queryClient.invalidateQueries({ queryKey: todoKeys.all }),
              });
            }
            """;

    @Test
    void prefixInvalidationReachesFactoryDeclaredKey() throws IOException {
        final SourceTree tree = new SourceTree(tmp)
                .write("src/keys.ts", KEYS)
                .write("src/TodoList.tsx", TODO_LIST)
                .write("src/useAddTodo.ts", ADD_TODO);

        final Graph graph = tree.graph();

        assertEquals(new Graph.Summary(2, 2, 1, 0), graph.summary());
        final Graph.Node key = graph.nodesOfKind(Graph.NodeKind.QUERY_KEY).get(0);
        assertEquals("qk:todos|list|open", key.id());
        assertEquals("[todos, list, open]", key.label());

        final Set<String> keyEdges = graph.edges().stream()
                .filter(e -> e.target().equals(key.id()))
                .map(e -> e.relation().label())
                .collect(Collectors.toSet());
        assertEquals(Set.of("declares", "invalidates"), keyEdges);
        assertTrue(graph.node(Ids.fileNodeId(tree.path("src/useAddTodo.ts"))) != null);
    }

    @Test
    void parseFailuresAreRecordedAndOtherFilesStillAnalysed() throws IOException {
        final SourceTree tree = new SourceTree(tmp)
                .write("src/broken.ts", "export const = ;\n")
                .write("src/keys.ts", KEYS)
                .write("src/TodoList.tsx", TODO_LIST);

        final AnalysisResult result = tree.analyze();

        assertEquals(3, result.scannedFiles().size());
        assertEquals(1, result.parseErrors().size());
        assertEquals(tree.path("src/broken.ts"), result.parseErrors().get(0).file());
        assertEquals(List.of("declares useQuery [todos, list, open]"), SourceTree.describe(result.records()));
    }

    @Test
    void nestedRootsOwnTheirFilesAndRecordsFollowRootOrder() throws IOException {
        final SourceTree tree = new SourceTree(tmp)
                .write("src/keys.ts", KEYS)
                .write("src/TodoList.tsx", TODO_LIST)
                .write("packages/admin/keys.ts", KEYS)
                .write("packages/admin/useAddTodo.ts", ADD_TODO);
        final WorkspaceLayout layout = new WorkspaceLayout(List.of(
                new WorkspaceRoot("app", Ids.normalizePath(tmp)),
                new WorkspaceRoot("admin", tree.path("packages/admin"))));

        final AnalysisResult result = new AnalysisPipeline(ScanOptions.defaults().withThreads(3)).run(layout);

        assertEquals(List.of(
                tree.path("src/TodoList.tsx"),
                tree.path("src/keys.ts"),
                tree.path("packages/admin/keys.ts"),
                tree.path("packages/admin/useAddTodo.ts")), result.scannedFiles());
        final List<CallSiteRecord> records = result.records();
        assertEquals(List.of("declares useQuery [todos, list, open]", "invalidates invalidateQueries [todos]"),
                SourceTree.describe(records));
        assertEquals(tree.path("packages/admin/useAddTodo.ts"), records.get(1).file());

        final Graph graph = new GraphBuilder(layout).build(records, result.parseErrors());
        assertEquals("admin/useAddTodo.ts", graph.node(Ids.fileNodeId(records.get(1).file())).label());
    }

    @Test
    void oversizedFilesAreReportedNotParsed() throws IOException {
        final SourceTree tree = new SourceTree(tmp)
                .write("src/keys.ts", KEYS)
                .write("src/big.ts", "// " + "x".repeat(3000) + "\n");

        final AnalysisResult result = tree.analyze(ScanOptions.defaults().withThreads(1).withMaxFileSizeKB(2));

        assertEquals(List.of(tree.path("src/keys.ts")), result.scannedFiles());
        assertEquals(1, result.skippedFiles().size());
        assertTrue(result.records().isEmpty());
    }
}
