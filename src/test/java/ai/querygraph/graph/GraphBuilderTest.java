package ai.querygraph.graph;

import static ai.querygraph.ast.Ast.array;
import static ai.querygraph.ast.Ast.id;
import static ai.querygraph.ast.Ast.num;
import static ai.querygraph.ast.Ast.str;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.querygraph.ast.Expr;
import ai.querygraph.key.ActionKeyInference;
import ai.querygraph.key.QueryKeyNormalizer;
import ai.querygraph.key.QueryKeys;
import ai.querygraph.model.CallSiteRecord;
import ai.querygraph.model.Ids;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.model.ParseError;
import ai.querygraph.model.Relation;
import ai.querygraph.model.SourceLoc;
import ai.querygraph.modules.WorkspaceLayout;
import ai.querygraph.modules.WorkspaceRoot;

class GraphBuilderTest {

    private final QueryKeyNormalizer normalizer = new QueryKeyNormalizer(null);
    private final ActionKeyInference actions = new ActionKeyInference(normalizer);

    @TempDir
    Path tmp;

    private String root;
    private GraphBuilder builder;

    @BeforeEach
    void setUp() throws IOException {
        root = Ids.normalizePath(tmp);
        Files.createDirectories(tmp.resolve("apps/a"));
        Files.createDirectories(tmp.resolve("apps/b"));
        Files.writeString(tmp.resolve("apps/a/package.json"), "{}");
        Files.writeString(tmp.resolve("apps/b/package.json"), "{}");
        builder = new GraphBuilder(new WorkspaceLayout(List.of(new WorkspaceRoot("web", root))));
    }

    private NormalizedKey declared(Expr key) {
        return normalizer.normalize(key, MatchMode.EXACT, false);
    }

    private NormalizedKey mutation(Expr key) {
        return normalizer.normalize(key, MatchMode.PREFIX, false);
    }

    private CallSiteRecord record(Relation relation, String operation, String file, int line, NormalizedKey key) {
        return new CallSiteRecord(relation, operation, root + "/" + file, new SourceLoc(line, 3), key,
                key.resolution(), relation == Relation.DECLARES);
    }

    private static Set<String> edgeSummaries(Graph graph) {
        return graph.edges().stream()
                .map(e -> graph.node(e.source()).kind().label() + "->" + graph.node(e.target()).kind().label()
                        + ":" + e.relation().label())
                .collect(Collectors.toSet());
    }

    @Test
    void declarationAndPrefixInvalidationInOneFile() {
        final CallSiteRecord declaration = record(Relation.DECLARES, "useQuery", "apps/a/Todo.tsx", 4,
                declared(array(str("todos"), id("id"))));
        final CallSiteRecord invalidation = record(Relation.INVALIDATES, "invalidateQueries", "apps/a/Todo.tsx", 9,
                mutation(array(str("todos"))));

        final Graph graph = builder.build(List.of(declaration, invalidation), List.of());

        assertEquals(1, graph.nodesOfKind(Graph.NodeKind.FILE).size());
        assertEquals(2, graph.nodesOfKind(Graph.NodeKind.ACTION).size());
        final List<Graph.Node> keys = graph.nodesOfKind(Graph.NodeKind.QUERY_KEY);
        assertEquals(1, keys.size());
        assertEquals("[todos, $id]", keys.get(0).label());
        assertEquals("qk:todos|$id", keys.get(0).id());

        final String fileId = Ids.fileNodeId(root + "/apps/a/Todo.tsx");
        final String declarationId = Ids.actionNodeId(declaration, 0);
        final String invalidationId = Ids.actionNodeId(invalidation, 1);
        final Set<String> edges = graph.edges().stream().map(Graph.Edge::id).collect(Collectors.toSet());
        assertEquals(Set.of(
                fileId + "->" + declarationId + ":declares",
                declarationId + "->qk:todos|$id:declares",
                fileId + "->" + invalidationId + ":invalidates",
                invalidationId + "->qk:todos|$id:invalidates"), edges);

        assertEquals(new Graph.Summary(1, 2, 1, 0), graph.summary());
    }

    @Test
    void metricsDescribeNodes() {
        final Graph graph = builder.build(List.of(
                record(Relation.DECLARES, "useQuery", "apps/a/List.tsx", 1, declared(array(str("todos")))),
                record(Relation.DECLARES, "useQuery", "apps/a/Other.tsx", 1, declared(array(str("todos")))),
                record(Relation.INVALIDATES, "invalidateQueries", "apps/a/Save.tsx", 2,
                        mutation(array(str("todos"))))), List.of());

        final Graph.Node key = graph.node("qk:todos");
        assertEquals(3, key.metric("affectedFiles"));
        assertEquals(2, key.metric("declaredFiles"));
        assertEquals(2, key.metric("declaredCallsites"));
        assertEquals("todos", key.metric("rootSegment"));
        assertEquals("web:apps/a", key.metric("projectScope"));

        final Graph.Node file = graph.node(Ids.fileNodeId(root + "/apps/a/Save.tsx"));
        assertEquals("apps/a/Save.tsx", file.label());
        assertEquals(1, file.metric("affectedKeys"));

        final Graph.Node action = graph.nodesOfKind(Graph.NodeKind.ACTION).get(2);
        assertEquals(Relation.INVALIDATES, action.metric("relation"));
        assertEquals(0, action.metric("declaresDirectly"));
        assertEquals("apps/a/Save.tsx", action.metric("displayFile"));
    }

    @Test
    void wildcardStaysInsideItsProjectScope() {
        final NormalizedKey clearAll = actions.inferActionKey("clear", List.of());
        final Graph graph = builder.build(List.of(
                record(Relation.DECLARES, "useQuery", "apps/a/Items.tsx", 1, declared(array(str("items")))),
                record(Relation.DECLARES, "useQuery", "apps/b/Orders.tsx", 1, declared(array(str("orders")))),
                record(Relation.CLEARS, "clear", "apps/a/Reset.tsx", 5, clearAll)), List.of());

        final Set<String> clearedKeys = graph.edges().stream()
                .filter(e -> e.relation() == Relation.CLEARS && e.target().startsWith("qk:"))
                .map(Graph.Edge::target)
                .collect(Collectors.toSet());
        assertEquals(Set.of("qk:items"), clearedKeys);
        assertNull(graph.node("qk:" + QueryKeys.ALL_QUERY_CACHE_ID));
    }

    @Test
    void mutationDoesNotReachDeclarationsOfAnotherScope() {
        final Graph graph = builder.build(List.of(
                record(Relation.DECLARES, "useQuery", "apps/b/Items.tsx", 1, declared(array(str("items"), str("all")))),
                record(Relation.INVALIDATES, "invalidateQueries", "apps/a/Save.tsx", 5,
                        mutation(array(str("items"))))), List.of());

        assertNull(graph.node("qk:items"));
        assertEquals(Set.of("file->action:declares", "action->queryKey:declares", "file->action:invalidates"),
                edgeSummaries(graph));
        assertEquals(0, graph.node(Ids.fileNodeId(root + "/apps/a/Save.tsx")).metric("affectedKeys"));
    }

    @Test
    void undeclaredAndPassThroughKeysArePruned() {
        final Graph graph = builder.build(List.of(
                record(Relation.INVALIDATES, "invalidateQueries", "apps/a/A.tsx", 1, mutation(array(str("ghost")))),
                record(Relation.SETS, "setQueryData", "apps/a/A.tsx", 2, QueryKeys.passThrough(MatchMode.EXACT))),
                List.of());

        assertTrue(graph.nodesOfKind(Graph.NodeKind.QUERY_KEY).isEmpty());
        assertEquals(2, graph.nodesOfKind(Graph.NodeKind.ACTION).size());
        assertEquals(0, graph.summary().queryKeys());
    }

    @Test
    void concreteSetQueryDataKeepsItsKey() {
        final NormalizedKey key = actions.inferActionKey("setQueryData", List.of(array(str("todo"), num(1)), id("data")));
        final Graph graph = builder.build(List.of(
                record(Relation.SETS, "setQueryData", "apps/a/A.tsx", 1, key)), List.of());

        final Graph.Node node = graph.node("qk:todo|1");
        assertNotNull(node);
        assertEquals(1, node.metric("affectedFiles"));
        assertEquals(0, node.metric("declaredCallsites"));
    }

    @Test
    void parseErrorsUseDisplayPaths() {
        final Graph graph = builder.build(List.of(),
                List.of(new ParseError(root + "/apps/a/Broken.tsx", "Syntax error at 1:5")));

        assertEquals(List.of(new ParseError("apps/a/Broken.tsx", "Syntax error at 1:5")), graph.parseErrors());
        assertEquals(1, graph.summary().parseErrors());
    }
}
