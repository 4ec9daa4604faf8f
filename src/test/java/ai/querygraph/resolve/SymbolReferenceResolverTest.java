package ai.querygraph.resolve;

import static ai.querygraph.ast.Ast.array;
import static ai.querygraph.ast.Ast.id;
import static ai.querygraph.ast.Ast.member;
import static ai.querygraph.ast.Ast.str;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ai.querygraph.ast.Expr;
import ai.querygraph.ast.SourceFile;
import ai.querygraph.modules.ModuleResolver;
import ai.querygraph.modules.PathAliasLoader;
import ai.querygraph.parse.TsSourceParser;
import ai.querygraph.symbols.SymbolIndex;

class SymbolReferenceResolverTest {

    private final TsSourceParser parser = new TsSourceParser();
    private final Map<String, String> sources = new LinkedHashMap<>();

    private SymbolReferenceResolverTest file(String path, String text) {
        sources.put("/w/" + path, text);
        return this;
    }

    private SymbolReferenceResolver resolverFor(String path) throws Exception {
        final List<SourceFile> files = new ArrayList<>();
        for (Map.Entry<String, String> e : sources.entrySet()) {
            files.add(parser.parse(e.getKey(), e.getValue()));
        }
        final SymbolIndex index = SymbolIndex.build(files);
        return new SymbolReferenceResolver("/w/" + path, index,
                new ModuleResolver(index.fileSet(), "/w", new PathAliasLoader()));
    }

    @Test
    void followsRenamedAndStarReExports() throws Exception {
        file("src/keys/todo.ts", "export const todoKeys = { all: ['todos'] as const };\n");
        file("src/keys/index.ts", "export * from './todo';\n");
        file("src/api.ts", "export { todoKeys as keys } from './keys';\n");
        file("src/page.tsx", "import { keys } from './api';\n");

        final Expr resolved = resolverFor("src/page.tsx").resolveReference(member(id("keys"), "all"));

        assertEquals(array(str("todos")), resolved);
    }

    @Test
    void resolvesDefaultAndNamespaceImports() throws Exception {
        file("src/settings.ts", "export default ['settings'];\n");
        file("src/keys/todo.ts", "export const todoKeys = { all: ['todos'] };\n");
        file("src/page.tsx", "import settingsKey from './settings';\nimport * as K from './keys/todo';\n");
        final SymbolReferenceResolver resolver = resolverFor("src/page.tsx");

        assertEquals(array(str("settings")), resolver.resolveReference(id("settingsKey")));
        assertInstanceOf(Expr.ObjectLit.class, resolver.resolveReference(member(id("K"), "todoKeys")));
    }

    @Test
    void resolvesImportedFactoryReturn() throws Exception {
        file("src/keys/user.ts", "export function userQueryKey(id: string) { return ['user', id]; }\n");
        file("src/page.tsx", "import { userQueryKey } from './keys/user';\n");

        final Expr result = resolverFor("src/page.tsx").resolveCallResult(id("userQueryKey"));

        assertEquals(array(str("user"), id("id")), result);
    }

    @Test
    void resolvesMethodOnKeyObject() throws Exception {
        file("src/keys.ts", "export const todoKeys = { detail: (id: number) => ['todos', 'detail', id] };\n");
        file("src/page.tsx", "import { todoKeys } from './keys';\n");

        final Expr result = resolverFor("src/page.tsx").resolveCallResult(member(id("todoKeys"), "detail"));

        assertEquals(array(str("todos"), str("detail"), id("id")), result);
    }

    @Test
    void equallyCloseFactoriesAreAmbiguous() throws Exception {
        file("src/a/keys.ts", "export function sharedQueryKey() { return ['a']; }\n");
        file("src/b/keys.ts", "export function sharedQueryKey() { return ['b']; }\n");
        file("src/page.tsx", "const x = 1;\n");
        file("src/a/page.tsx", "const y = 1;\n");

        assertNull(resolverFor("src/page.tsx").resolveCallResult(id("sharedQueryKey")));
        assertEquals(array(str("a")), resolverFor("src/a/page.tsx").resolveCallResult(id("sharedQueryKey")));
    }

    @Test
    void unrelatedFunctionNamesAreNotSearched() throws Exception {
        file("src/a/util.ts", "export function compute() { return ['a']; }\n");
        file("src/page.tsx", "const x = 1;\n");

        assertNull(resolverFor("src/page.tsx").resolveCallResult(id("compute")));
    }

    @Test
    void cyclicReExportsTerminate() throws Exception {
        file("src/a.ts", "export { x } from './b';\n");
        file("src/b.ts", "export { x } from './a';\n");
        file("src/page.tsx", "import { x } from './a';\n");

        assertNull(resolverFor("src/page.tsx").resolveReference(id("x")));
    }

    @Test
    void optionalMembersAreNotResolved() throws Exception {
        file("src/keys.ts", "export const todoKeys = { all: ['todos'] };\n");
        file("src/page.tsx", "import { todoKeys } from './keys';\n");

        final Expr optional = new Expr.Member(id("todoKeys"), id("all"), false, true);
        assertNull(resolverFor("src/page.tsx").resolveReference(optional));
    }

    @Test
    void identityWrappersAndIndexes() {
        assertTrue(SymbolReferenceResolver.isIdentityWrapperCall(id("queryOptions")));
        assertTrue(SymbolReferenceResolver.isIdentityWrapperCall(member(id("Object"), "freeze")));
        assertFalse(SymbolReferenceResolver.isIdentityWrapperCall(member(id("Reflect"), "freeze")));
        assertEquals(12, SymbolReferenceResolver.parseIndex("12px"));
        assertEquals(-1, SymbolReferenceResolver.parseIndex("x1"));
    }
}
