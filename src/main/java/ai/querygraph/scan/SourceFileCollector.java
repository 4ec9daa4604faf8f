package ai.querygraph.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.querygraph.model.Ids;
import ai.querygraph.modules.PosixPaths;

/**
 * Finds the source files to analyse below one workspace root:
 * - walks every configured folder (symbolic links are not followed)
 * - keeps files matching the include globs and none of the exclude globs or .gitignore rules
 * - hidden files and directories never match the include globs
 * - files over the size limit are reported as skipped instead
 * Results are unique and sorted by depth below the root, then by path.
 */
public final class SourceFileCollector {

    private final ScanOptions options;
    private final GlobPatterns includes;
    private final GlobPatterns excludes;

    public SourceFileCollector(ScanOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.includes = GlobPatterns.parse(options.include());
        this.excludes = GlobPatterns.parse(options.exclude());
    }

    public record Collected(List<String> files, List<SkippedFile> skipped) {
        public Collected {
            files = List.copyOf(files);
            skipped = List.copyOf(skipped);
        }
    }

    public Collected collect(Path root) throws IOException {
        final Path rootPath = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(rootPath)) {
            throw new IOException("Workspace root is not a directory: " + rootPath);
        }
        final GitIgnore gitIgnore = options.useGitIgnore() ? GitIgnore.load(rootPath, excludes) : GitIgnore.NONE;

        final Map<String, Long> sizes = new LinkedHashMap<>();
        for (String folder : options.folders()) {
            final Path cwd = resolveFolder(rootPath, folder);
            if (!Files.isDirectory(cwd)) {
                System.err.println("WARN: folder not found, skipped: " + cwd);
                continue;
            }
            final boolean underRoot = cwd.startsWith(rootPath);
            walk(rootPath, cwd, underRoot ? gitIgnore : GitIgnore.NONE, sizes);
        }

        final String rootId = Ids.normalizePath(rootPath);
        final long limit = options.maxFileSizeKB() * 1024L;
        final List<String> files = new ArrayList<>();
        final List<SkippedFile> skipped = new ArrayList<>();
        for (var e : sizes.entrySet()) {
            if (e.getValue() <= limit) {
                files.add(e.getKey());
            } else {
                skipped.add(new SkippedFile(e.getKey(), e.getValue()));
            }
        }
        final Comparator<String> order = Comparator
                .comparingInt((String f) -> depth(rootId, f))
                .thenComparing(Comparator.naturalOrder());
        files.sort(order);
        skipped.sort(Comparator.comparing(SkippedFile::file, order));
        return new Collected(files, skipped);
    }

    private void walk(Path root, Path cwd, GitIgnore gitIgnore, Map<String, Long> sizes) throws IOException {
        Files.walkFileTree(cwd, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(cwd)) {
                    return FileVisitResult.CONTINUE;
                }
                final String rel = relative(cwd, dir);
                if (dir.getFileName().toString().startsWith(".")
                        || excludes.matches(rel)
                        || gitIgnore.ignores(relative(root, dir))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile() || file.getFileName().toString().startsWith(".")) {
                    return FileVisitResult.CONTINUE;
                }
                final String rel = relative(cwd, file);
                if (includes.matches(rel) && !excludes.matches(rel) && !gitIgnore.ignores(relative(root, file))) {
                    sizes.putIfAbsent(Ids.normalizePath(file), attrs.size());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                System.err.println("WARN: cannot read " + file + " -> " + safeMsg(exc.getMessage()));
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static Path resolveFolder(Path root, String folder) {
        if (folder == null || folder.isBlank() || ".".equals(folder)) {
            return root;
        }
        final Path path = Path.of(folder);
        return (path.isAbsolute() ? path : root.resolve(path)).normalize();
    }

    private static int depth(String rootId, String file) {
        final int segments = PosixPaths.segments(PosixPaths.relative(rootId, file)).size();
        return Math.max(0, segments - 1);
    }

    /** '/'-separated path of {@code path} below {@code base}; empty for {@code base} itself. */
    static String relative(Path base, Path path) {
        return Ids.toPosix(base.relativize(path).toString());
    }

    static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
