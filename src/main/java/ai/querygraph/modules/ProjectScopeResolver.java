package ai.querygraph.modules;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a file to its project scope, the unit mutations may not link across.
 * Strategy:
 * 1) nearest package.json directory inside the file's root: "{root}:{relative dir}" ("." for the root)
 * 2) first path segment below the root: "{root}:{segment}"
 * 3) "{root}:*"
 * Files outside every root use "workspace:{package dir name}" or "workspace:{parent dir name}".
 */
public final class ProjectScopeResolver {

    public static final String DEFAULT_SCOPE = "workspace:*";

    private final WorkspaceLayout layout;
    private final Map<String, String> scopeByFile = new ConcurrentHashMap<>();
    private final Map<String, Boolean> packageJsonByDir = new ConcurrentHashMap<>();

    public ProjectScopeResolver(WorkspaceLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public String scopeOf(String file) {
        return scopeByFile.computeIfAbsent(file, this::computeScope);
    }

    private String computeScope(String file) {
        final WorkspaceRoot root = layout.bestRootFor(file);
        if (root == null) {
            final String boundary = nearestPackageBoundary(null, file);
            if (boundary != null) {
                return "workspace:" + PosixPaths.basename(boundary);
            }
            final String parentName = PosixPaths.basename(PosixPaths.dirname(file));
            return "workspace:" + (parentName.isEmpty() ? "*" : parentName);
        }

        final String boundary = nearestPackageBoundary(root.path(), file);
        if (boundary != null) {
            final String relative = PosixPaths.relative(root.path(), boundary);
            return root.name() + ":" + (relative.isEmpty() ? "." : relative);
        }

        final List<String> segments = PosixPaths.segments(PosixPaths.relative(root.path(), file));
        if (!segments.isEmpty()) {
            return root.name() + ":" + segments.get(0);
        }
        return root.name() + ":*";
    }

    /** Walks up from the file's directory; stops at {@code rootPath} when one is given. */
    private String nearestPackageBoundary(String rootPath, String file) {
        String cursor = PosixPaths.dirname(file);
        while (true) {
            if ((rootPath == null || PosixPaths.isWithin(rootPath, cursor)) && hasPackageJson(cursor)) {
                return cursor;
            }
            if (cursor.equals(rootPath)) {
                return null;
            }
            final String parent = PosixPaths.dirname(cursor);
            if (parent.equals(cursor)) {
                return null;
            }
            cursor = parent;
        }
    }

    private boolean hasPackageJson(String dir) {
        return packageJsonByDir.computeIfAbsent(dir, d -> Files.isRegularFile(Path.of(d, "package.json")));
    }
}
