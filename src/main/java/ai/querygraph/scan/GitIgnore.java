package ai.querygraph.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * The {@code .gitignore} rules found below a root, as root-relative globs.
 * Comments and negations are ignored; a leading '/' anchors a rule to its directory, a
 * trailing '/' makes it cover everything below, and a rule without '/' matches at any depth.
 */
final class GitIgnore {

    static final GitIgnore NONE = new GitIgnore(GlobPatterns.of(List.of()));

    private final GlobPatterns rules;

    private GitIgnore(GlobPatterns rules) {
        this.rules = rules;
    }

    static GitIgnore load(Path root, GlobPatterns excludes) throws IOException {
        final List<String> rules = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                final String rel = SourceFileCollector.relative(root, dir);
                if (!rel.isEmpty() && (excludes.matches(rel) || ".git".equals(dir.getFileName().toString()))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (".gitignore".equals(file.getFileName().toString()) && attrs.isRegularFile()) {
                    readRules(file, SourceFileCollector.relative(root, file.getParent()), rules);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                System.err.println("WARN: cannot read " + file + " -> " + SourceFileCollector.safeMsg(exc.getMessage()));
                return FileVisitResult.CONTINUE;
            }
        });
        return new GitIgnore(GlobPatterns.of(rules));
    }

    boolean ignores(String rootRelativePath) {
        return !rules.isEmpty() && rules.matches(rootRelativePath);
    }

    List<String> rules() {
        return rules.globs();
    }

    private static void readRules(Path file, String baseDir, List<String> out) {
        final List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("WARN: cannot read " + file + " -> " + SourceFileCollector.safeMsg(e.getMessage()));
            return;
        }
        for (String line : lines) {
            final String rule = toGlob(line, baseDir);
            if (rule != null) {
                out.add(rule);
            }
        }
    }

    /** Root-relative glob for one .gitignore line, or null for blanks, comments and negations. */
    static String toGlob(String line, String baseDir) {
        String pattern = line.replace('\\', '/').trim();
        if (pattern.isEmpty() || pattern.startsWith("#") || pattern.startsWith("!")) {
            return null;
        }
        final boolean anchored = pattern.startsWith("/");
        if (anchored) {
            pattern = pattern.substring(1);
        }
        final boolean directory = pattern.endsWith("/");
        if (directory) {
            pattern = pattern.substring(0, pattern.length() - 1);
        }
        if (pattern.isEmpty()) {
            return null;
        }
        if (!anchored && !pattern.contains("/")) {
            pattern = "**/" + pattern;
        }
        if (directory) {
            pattern = pattern + "/**";
        }
        return baseDir.isEmpty() ? pattern : baseDir + "/" + pattern;
    }
}
