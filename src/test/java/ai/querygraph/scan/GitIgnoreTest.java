package ai.querygraph.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitIgnoreTest {

    @Test
    void toGlobTranslatesLines() {
        assertNull(GitIgnore.toGlob("   ", ""));
        assertNull(GitIgnore.toGlob("# comment", ""));
        assertNull(GitIgnore.toGlob("!keep.ts", ""));
        assertNull(GitIgnore.toGlob("/", ""));
        assertEquals("**/generated", GitIgnore.toGlob("generated", ""));
        assertEquals("**/out/**", GitIgnore.toGlob("out/", ""));
        assertEquals("build.ts", GitIgnore.toGlob("/build.ts", ""));
        assertEquals("src/gen/*.ts", GitIgnore.toGlob("src/gen/*.ts", ""));
        assertEquals("packages/web/**/tmp/**", GitIgnore.toGlob("tmp/", "packages/web"));
        assertEquals("packages/web/local.ts", GitIgnore.toGlob("/local.ts", "packages/web"));
    }

    @Test
    void loadCollectsNestedFilesAndSkipsExcludedDirectories(@TempDir Path root) throws IOException {
        Files.writeString(root.resolve(".gitignore"), "# top\ngenerated/\n");
        Files.createDirectories(root.resolve("packages/web"));
        Files.writeString(root.resolve("packages/web/.gitignore"), "/local.ts\n");
        Files.createDirectories(root.resolve("node_modules/pkg"));
        Files.writeString(root.resolve("node_modules/pkg/.gitignore"), "*.ts\n");

        final GitIgnore gitIgnore = GitIgnore.load(root, GlobPatterns.parse(ScanOptions.DEFAULT_EXCLUDE));

        assertEquals(2, gitIgnore.rules().size());
        assertTrue(gitIgnore.rules().containsAll(List.of("**/generated/**", "packages/web/local.ts")));
        assertTrue(gitIgnore.ignores("src/generated/api.ts"));
        assertTrue(gitIgnore.ignores("packages/web/local.ts"));
        assertFalse(gitIgnore.ignores("local.ts"));
        assertFalse(GitIgnore.NONE.ignores("anything.ts"));
    }
}
