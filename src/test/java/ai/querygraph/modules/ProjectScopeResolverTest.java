package ai.querygraph.modules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.querygraph.model.Ids;

class ProjectScopeResolverTest {

    @TempDir
    Path tmp;

    @Test
    void nearestPackageJsonNamesTheScope() throws IOException {
        Files.createDirectories(tmp.resolve("mono/packages/web/src"));
        Files.writeString(tmp.resolve("mono/package.json"), "{}");
        Files.writeString(tmp.resolve("mono/packages/web/package.json"), "{}");
        final String root = Ids.normalizePath(tmp.resolve("mono"));
        final ProjectScopeResolver scopes = new ProjectScopeResolver(
                new WorkspaceLayout(List.of(new WorkspaceRoot("mono", root))));

        assertEquals("mono:packages/web", scopes.scopeOf(root + "/packages/web/src/App.tsx"));
        assertEquals("mono:.", scopes.scopeOf(root + "/scripts/seed.ts"));
    }

    @Test
    void withoutPackageJsonTheFirstSegmentNamesTheScope() {
        final String root = Ids.normalizePath(tmp);
        final ProjectScopeResolver scopes = new ProjectScopeResolver(
                new WorkspaceLayout(List.of(new WorkspaceRoot("app", root))));

        assertEquals("app:src", scopes.scopeOf(root + "/src/deep/File.ts"));
    }

    @Test
    void filesOutsideEveryRootUseTheirDirectoryName() {
        final String root = Ids.normalizePath(tmp.resolve("inside"));
        final ProjectScopeResolver scopes = new ProjectScopeResolver(
                new WorkspaceLayout(List.of(new WorkspaceRoot("app", root))));

        assertEquals("workspace:elsewhere", scopes.scopeOf(Ids.normalizePath(tmp) + "/elsewhere/File.ts"));
    }

    @Test
    void longestRootWinsAndDisplayPathsArePrefixedWhenSeveralRoots() {
        final WorkspaceLayout layout = new WorkspaceLayout(List.of(
                new WorkspaceRoot("outer", "/w"),
                new WorkspaceRoot("inner", "/w/packages/inner")));

        assertTrue(layout.multiRoot());
        assertEquals("inner", layout.bestRootFor("/w/packages/inner/src/a.ts").name());
        assertEquals("outer", layout.bestRootFor("/w/src/a.ts").name());
        assertEquals("inner/src/a.ts", layout.displayPath("/w/packages/inner/src/a.ts"));
        assertEquals("/elsewhere/a.ts", layout.displayPath("/elsewhere/a.ts"));
        assertFalse(new WorkspaceLayout(List.of(new WorkspaceRoot("only", "/w"))).multiRoot());
    }
}
