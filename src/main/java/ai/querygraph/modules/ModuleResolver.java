package ai.querygraph.modules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves an import specifier to one of the indexed files.
 * Strategy:
 * 1) relative or absolute specifiers: extension and index-file search next to the importer
 * 2) bare specifiers: tsconfig/jsconfig path aliases, most specific pattern first, then closest target
 * 3) anything else (packages) stays unresolved
 */
public final class ModuleResolver {

    public static final List<String> EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx", ".mts", ".cts", ".mjs", ".cjs");

    private final Set<String> fileSet;
    private final String workspaceRoot;
    private final PathAliasLoader aliases;

    public ModuleResolver(Set<String> fileSet, String workspaceRoot, PathAliasLoader aliases) {
        this.fileSet = Objects.requireNonNull(fileSet, "fileSet");
        this.workspaceRoot = Objects.requireNonNull(workspaceRoot, "workspaceRoot");
        this.aliases = Objects.requireNonNull(aliases, "aliases");
    }

    /** The indexed file the specifier points at, or null. */
    public String resolve(String fromFile, String specifier) {
        final boolean relative = specifier.startsWith("./") || specifier.startsWith("../");
        final boolean absolute = PosixPaths.isAbsolute(specifier);
        if (relative || absolute) {
            final String base = absolute ? PosixPaths.resolve("/", specifier)
                    : PosixPaths.resolve(PosixPaths.dirname(fromFile), specifier);
            for (String candidate : candidates(base)) {
                if (fileSet.contains(candidate)) {
                    return candidate;
                }
            }
            return null;
        }
        return resolveAlias(fromFile, specifier);
    }

    /**
     * Entries arrive most specific first; the first entry with an existing target decides, and
     * only among that entry's targets does proximity to the importer break the tie.
     */
    private String resolveAlias(String fromFile, String specifier) {
        final String fromDir = PosixPaths.dirname(fromFile);
        for (AliasEntry entry : aliases.entriesFor(fromFile, workspaceRoot)) {
            final String captured = entry.capture(specifier);
            if (captured == null) {
                continue;
            }
            final Set<String> matches = new LinkedHashSet<>();
            for (String targetPattern : entry.targets()) {
                final String target = targetPattern.replace("*", captured);
                for (String candidate : candidates(target)) {
                    if (fileSet.contains(candidate)) {
                        matches.add(candidate);
                    }
                }
            }
            if (!matches.isEmpty()) {
                final List<String> ranked = new ArrayList<>(matches);
                ranked.sort(candidateOrder(fromDir));
                return ranked.get(0);
            }
        }
        return null;
    }

    /**
     * Closest first: shared directory prefix (desc), '..' steps (asc), relative distance (asc), length, text.
     */
    static Comparator<String> candidateOrder(String fromDir) {
        return Comparator
                .comparingInt((String c) -> -PosixPaths.commonPrefixLength(fromDir, PosixPaths.dirname(c)))
                .thenComparingInt(c -> upSteps(fromDir, c))
                .thenComparingInt(c -> PosixPaths.segments(PosixPaths.relative(fromDir, PosixPaths.dirname(c))).size())
                .thenComparingInt(String::length)
                .thenComparing(Comparator.naturalOrder());
    }

    private static int upSteps(String fromDir, String candidate) {
        int count = 0;
        for (String segment : PosixPaths.segments(PosixPaths.relative(fromDir, PosixPaths.dirname(candidate)))) {
            if ("..".equals(segment)) {
                count++;
            }
        }
        return count;
    }

    static List<String> candidates(String base) {
        final String normalized = PosixPaths.resolve("/", base);
        for (String ext : EXTENSIONS) {
            if (base.endsWith(ext)) {
                return List.of(normalized);
            }
        }
        final List<String> out = new ArrayList<>();
        for (String ext : EXTENSIONS) {
            out.add(normalized + ext);
        }
        for (String ext : EXTENSIONS) {
            out.add(normalized + "/index" + ext);
        }
        return out;
    }
}
