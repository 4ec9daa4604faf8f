package ai.querygraph.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.querygraph.SourceTree;
import ai.querygraph.key.QueryKeys;
import ai.querygraph.model.CallSiteRecord;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.Relation;
import ai.querygraph.model.Resolution;

class CallSiteClassifierTest {

    @TempDir
    Path tmp;

    private SourceTree tree;

    @BeforeEach
    void setUp() {
        tree = new SourceTree(tmp);
    }

    private List<CallSiteRecord> records() throws IOException {
        return tree.analyze().records();
    }

    @Test
    void hookDeclaresAndClientInvalidates() throws IOException {
        tree.write("src/Todo.tsx", """
                import { useQuery, useQueryClient } from '@tanstack/react-query';

                export function Todo({ id }: { id: string }) {
                  const client = useQueryClient();
                  const { data } = useQuery({ queryKey: ['todos', id], queryFn: () => fetch(id) });
                  const save = () => client.invalidateQueries({ queryKey: ['todos'] });
                  return null;
                }
                """);

        final List<CallSiteRecord> records = records();

        assertEquals(List.of("declares useQuery [todos, $id]", "invalidates invalidateQueries [todos]"),
                SourceTree.describe(records));
        final CallSiteRecord declaration = records.get(0);
        assertEquals(MatchMode.EXACT, declaration.queryKey().matchMode());
        assertEquals(Resolution.DYNAMIC, declaration.resolution());
        assertTrue(declaration.declaresDirectly());
        assertEquals(tree.path("src/Todo.tsx"), declaration.file());
        assertEquals(5, declaration.loc().line());

        final CallSiteRecord invalidation = records.get(1);
        assertEquals(MatchMode.PREFIX, invalidation.queryKey().matchMode());
        assertEquals(Resolution.STATIC, invalidation.resolution());
    }

    @Test
    void factoryKeysResolveAcrossFilesThroughAliases() throws IOException {
        tree.write("tsconfig.json", """
                { "compilerOptions": { "baseUrl": ".", "paths": { "@/*": ["src/*"] } } }
                """);
        tree.write("src/keys.ts", """
                export const todoKeys = {
                  all: ['todos'] as const,
                  detail: (id: string) => ['todos', 'detail', id] as const,
                };
                """);
        tree.write("src/Page.tsx", """
                import { useQuery, useQueryClient } from '@tanstack/react-query';
                import { todoKeys } from '@/keys';

                export function Page({ id }) {
                  const qc = useQueryClient();
                  useQuery({ queryKey: todoKeys.detail(id), queryFn: load });
                  qc.invalidateQueries({ queryKey: todoKeys.all });
                }
                """);

        final List<CallSiteRecord> records = records();

        assertEquals(List.of("declares useQuery [todos, detail, $id]", "invalidates invalidateQueries [todos]"),
                SourceTree.describe(records));
        assertEquals(Resolution.STATIC, records.get(1).resolution());
    }

    @Test
    void predicatesAndWildcards() throws IOException {
        tree.write("src/sync.ts", """
                import { QueryClient } from '@tanstack/react-query';

                export const queryClient = new QueryClient();

                export function resync() {
                  queryClient.invalidateQueries({ predicate: (q) => q.queryKey[0] === 'todos' });
                  queryClient.refetchQueries();
                  queryClient.clear();
                }
                """);

        final List<CallSiteRecord> records = records();

        assertEquals("invalidates invalidateQueries [todos]", SourceTree.describe(records).get(0));
        assertEquals(MatchMode.ALL, records.get(1).queryKey().matchMode());
        assertEquals(QueryKeys.ALL_QUERY_CACHE_ID, records.get(1).queryKey().id());
        assertEquals(Relation.CLEARS, records.get(2).relation());
        assertEquals(QueryKeys.ALL_QUERY_CACHE_ID, records.get(2).queryKey().id());
    }

    @Test
    void iteratorCallbacksExpandOverKnownLists() throws IOException {
        tree.write("src/Bulk.tsx", """
                import { useQueryClient } from '@tanstack/react-query';

                export function useBulkRefresh() {
                  const qc = useQueryClient();
                  const ids = ['a', 'b'];
                  return () => ids.forEach((id) => qc.invalidateQueries({ queryKey: ['todo', id] }));
                }
                """);

        assertEquals(List.of("invalidates invalidateQueries [todo, a]", "invalidates invalidateQueries [todo, b]"),
                SourceTree.describe(records()));
    }

    @Test
    void forwardedQueryKeyParameterIsKeptAsPassThrough() throws IOException {
        tree.write("src/refresh.ts", """
                import { QueryClient, QueryKey } from '@tanstack/react-query';

                export function refresh(client: QueryClient, queryKey: QueryKey) {
                  client.invalidateQueries({ queryKey });
                }
                """);

        final List<CallSiteRecord> records = records();

        assertEquals(1, records.size());
        assertEquals(QueryKeys.PASS_THROUGH_ID, records.get(0).queryKey().id());
    }

    @Test
    void refetchIsAttributedToTheHookKey() throws IOException {
        tree.write("src/Lists.tsx", """
                import { useQuery } from '@tanstack/react-query';

                export function Lists() {
                  const todos = useQuery({ queryKey: ['todos'] });
                  const { refetch } = useQuery({ queryKey: ['user'] });
                  todos.refetch();
                  refetch();
                }
                """);

        final List<CallSiteRecord> records = records();

        assertEquals(List.of(
                "declares useQuery [todos]",
                "declares useQuery [user]",
                "refetches refetch [todos]",
                "refetches refetch [user]"), SourceTree.describe(records));
        assertEquals(Resolution.DYNAMIC, records.get(2).resolution());
    }

    @Test
    void invalidationPropListsKeys() throws IOException {
        tree.write("src/Edit.tsx", """
                export function Edit({ id }) {
                  return <SaveButton queryKeysToInvalidate={[['todos'], ['user', id]]} />;
                }
                """);

        final List<CallSiteRecord> records = records();

        assertEquals(List.of("invalidates invalidateQueries [todos]", "invalidates invalidateQueries [user, $id]"),
                SourceTree.describe(records));
        assertTrue(records.stream().allMatch(r -> r.resolution() == Resolution.DYNAMIC));
    }

    @Test
    void lookAlikeModulesAreDynamicAndUnknownObjectsIgnored() throws IOException {
        tree.write("src/Wrapped.tsx", """
                import { useQuery } from './lib/react-query';

                export function Wrapped(cache) {
                  useQuery({ queryKey: ['settings'] });
                  cache.invalidateQueries({ queryKey: ['settings'] });
                }
                """);

        final List<CallSiteRecord> records = records();

        assertEquals(List.of("declares useQuery [settings]"), SourceTree.describe(records));
        assertEquals(Resolution.DYNAMIC, records.get(0).resolution());
    }
}
