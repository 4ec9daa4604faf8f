package ai.querygraph.modules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.querygraph.model.Ids;

class ModuleResolverTest {

    @TempDir
    Path tmp;

    private String root;

    @BeforeEach
    void setUp() {
        root = Ids.normalizePath(tmp);
    }

    private String abs(String relative) {
        return root + "/" + relative;
    }

    private ModuleResolver resolver(PathAliasLoader aliases, String... files) {
        final Set<String> fileSet = new java.util.LinkedHashSet<>();
        for (String file : files) {
            fileSet.add(abs(file));
        }
        return new ModuleResolver(fileSet, root, aliases);
    }

    @Test
    void relativeSpecifiersTryExtensionsThenIndex() {
        final ModuleResolver modules = resolver(new PathAliasLoader(),
                "src/page.tsx", "src/api/users.ts", "src/keys/index.ts");

        assertEquals(abs("src/api/users.ts"), modules.resolve(abs("src/page.tsx"), "./api/users"));
        assertEquals(abs("src/keys/index.ts"), modules.resolve(abs("src/page.tsx"), "./keys"));
        assertEquals(abs("src/api/users.ts"), modules.resolve(abs("src/keys/index.ts"), "../api/users.ts"));
        assertNull(modules.resolve(abs("src/page.tsx"), "./missing"));
        assertNull(modules.resolve(abs("src/page.tsx"), "react"));
    }

    @Test
    void aliasesResolveThroughNearestConfig() throws IOException {
        Files.writeString(tmp.resolve("tsconfig.json"), """
                {
                  // comments and trailing commas are accepted
                  "compilerOptions": {
                    "baseUrl": ".",
                    "paths": { "@/*": ["src/*"], },
                  },
                }
                """);
        final ModuleResolver modules = resolver(new PathAliasLoader(), "src/feature/page.tsx", "src/api/users.ts");

        assertEquals(abs("src/api/users.ts"), modules.resolve(abs("src/feature/page.tsx"), "@/api/users"));
    }

    @Test
    void closestAliasTargetWins() throws IOException {
        Files.writeString(tmp.resolve("tsconfig.json"), """
                { "compilerOptions": { "paths": { "~shared/*": ["packages/shared/*", "src/shared/*"] } } }
                """);
        final ModuleResolver modules = resolver(new PathAliasLoader(),
                "src/feature/page.tsx", "src/shared/keys.ts", "packages/shared/keys.ts");

        assertEquals(abs("src/shared/keys.ts"), modules.resolve(abs("src/feature/page.tsx"), "~shared/keys"));
        assertEquals(abs("packages/shared/keys.ts"),
                modules.resolve(abs("packages/shared/other.ts"), "~shared/keys"));
    }

    @Test
    void moreSpecificAliasPatternWinsOverCloserTarget() throws IOException {
        Files.writeString(tmp.resolve("tsconfig.json"), """
                { "compilerOptions": { "paths": { "@/*": ["src/*"], "@/feature/*": ["libs/feature/*"] } } }
                """);
        final ModuleResolver modules = resolver(new PathAliasLoader(),
                "src/feature/page.ts", "src/feature/keys.ts", "libs/feature/keys.ts");

        assertEquals(abs("libs/feature/keys.ts"), modules.resolve(abs("src/feature/page.ts"), "@/feature/keys"));
    }

    @Test
    void lessSpecificPatternIsTriedWhenTheSpecificOneHasNoFile() throws IOException {
        Files.writeString(tmp.resolve("tsconfig.json"), """
                { "compilerOptions": { "paths": { "@/*": ["src/*"], "@/feature/*": ["libs/feature/*"] } } }
                """);
        final ModuleResolver modules = resolver(new PathAliasLoader(), "src/feature/page.ts", "src/feature/keys.ts");

        assertEquals(abs("src/feature/keys.ts"), modules.resolve(abs("src/feature/page.ts"), "@/feature/keys"));
    }

    @Test
    void extendedConfigsContributePaths() throws IOException {
        Files.writeString(tmp.resolve("tsconfig.base.json"), """
                { "compilerOptions": { "baseUrl": "src", "paths": { "@keys": ["keys/index.ts"] } } }
                """);
        Files.createDirectories(tmp.resolve("app"));
        Files.writeString(tmp.resolve("app/tsconfig.json"), """
                { "extends": "../tsconfig.base.json" }
                """);
        final ModuleResolver modules = resolver(new PathAliasLoader(), "app/main.ts", "src/keys/index.ts");

        assertEquals(abs("src/keys/index.ts"), modules.resolve(abs("app/main.ts"), "@keys"));
    }

    @Test
    void aliasEntriesPutExactAndLongerPatternsFirst() throws IOException {
        Files.writeString(tmp.resolve("tsconfig.json"), """
                { "compilerOptions": { "paths": { "@/*": ["src/*"], "@/api/*": ["src/services/api/*"], "config": ["src/config.ts"] } } }
                """);

        final List<AliasEntry> entries = new PathAliasLoader().entriesFor(abs("src/page.tsx"), root);

        assertEquals(List.of("config", "@/api/*", "@/*"), entries.stream().map(AliasEntry::pattern).toList());
        assertEquals(List.of(abs("src/services/api/*")), entries.get(1).targets());
    }

    @Test
    void unreadableConfigIsReportedNotThrown() throws IOException {
        Files.writeString(tmp.resolve("tsconfig.json"), "{ not json");
        final PathAliasLoader aliases = new PathAliasLoader();

        assertTrue(aliases.entriesFor(abs("src/page.tsx"), root).isEmpty());
        assertEquals(1, aliases.warnings().size());
    }

    @Test
    void aliasCapture() {
        final AliasEntry entry = new AliasEntry("@/*", List.of("/w/src/*"));
        assertEquals("api/users", entry.capture("@/api/users"));
        assertNull(entry.capture("~/api"));
        assertEquals("", new AliasEntry("config", List.of()).capture("config"));
    }
}
