package ai.querygraph.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class GlobPatternsTest {

    @Test
    void splitKeepsCommasInsideBraces() {
        assertEquals(List.of("**/*.{ts,tsx}", "src/**"), GlobPatterns.split(" **/*.{ts,tsx} , src/** ,, "));
        assertTrue(GlobPatterns.split(null).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"a.ts", "src/a.tsx", "src/deep/nested/b.mjs"})
    void defaultIncludeMatchesSourcesAtAnyDepth(String path) {
        assertTrue(GlobPatterns.parse(ScanOptions.DEFAULT_INCLUDE).matches(path));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a.d", "src/a.json", "src/a.ts.map", "README.md"})
    void defaultIncludeRejectsOtherFiles(String path) {
        assertFalse(GlobPatterns.parse(ScanOptions.DEFAULT_INCLUDE).matches(path));
    }

    @Test
    void defaultExcludeCoversDirectoryAndContents() {
        final GlobPatterns excludes = GlobPatterns.parse(ScanOptions.DEFAULT_EXCLUDE);
        assertTrue(excludes.matches("node_modules"));
        assertTrue(excludes.matches("node_modules/react/index.js"));
        assertTrue(excludes.matches("apps/web/dist/main.js"));
        assertFalse(excludes.matches("src/distance.ts"));
    }

    @Test
    void singleStarStopsAtSlashes() {
        final GlobPatterns globs = GlobPatterns.parse("src/*.ts");
        assertTrue(globs.matches("src/a.ts"));
        assertFalse(globs.matches("src/x/a.ts"));
    }

    @Test
    void characterClassesAndQuestionMarks() {
        final GlobPatterns globs = GlobPatterns.parse("v[0-9]/?.ts,[!_]*.js");
        assertTrue(globs.matches("v1/a.ts"));
        assertFalse(globs.matches("vx/a.ts"));
        assertTrue(globs.matches("main.js"));
        assertFalse(globs.matches("_private.js"));
    }

    @Test
    void regexMetacharactersAreLiteral() {
        final GlobPatterns globs = GlobPatterns.parse("./lib/(legacy)+.ts");
        assertTrue(globs.matches("lib/(legacy)+.ts"));
        assertFalse(globs.matches("lib/legacyy.ts"));
    }
}
