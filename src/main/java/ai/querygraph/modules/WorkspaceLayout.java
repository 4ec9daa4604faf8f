package ai.querygraph.modules;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import ai.querygraph.model.Ids;

/**
 * The workspace roots of one run. A file belongs to the longest root that contains it.
 */
public final class WorkspaceLayout {

    private final List<WorkspaceRoot> roots;

    public WorkspaceLayout(List<WorkspaceRoot> roots) {
        this.roots = List.copyOf(Objects.requireNonNull(roots, "roots"));
    }

    /** Single root named "workspace" at the current directory. */
    public static WorkspaceLayout currentDirectory() {
        return new WorkspaceLayout(List.of(new WorkspaceRoot("workspace", Ids.normalizePath(Path.of("")))));
    }

    public List<WorkspaceRoot> roots() {
        return roots;
    }

    public boolean multiRoot() {
        return roots.size() > 1;
    }

    /** Longest root containing the file, or null. */
    public WorkspaceRoot bestRootFor(String file) {
        WorkspaceRoot best = null;
        int bestLen = -1;
        for (WorkspaceRoot root : roots) {
            if (PosixPaths.isWithin(root.path(), file) && root.path().length() > bestLen) {
                best = root;
                bestLen = root.path().length();
            }
        }
        return best;
    }

    /**
     * Root-relative path ("." for the root itself), prefixed by the root name when several roots are scanned.
     * Files outside every root keep their absolute path.
     */
    public String displayPath(String file) {
        final WorkspaceRoot root = bestRootFor(file);
        if (root == null) {
            return file;
        }
        String relative = PosixPaths.relative(root.path(), file);
        if (relative.isEmpty()) {
            relative = ".";
        }
        return multiRoot() ? root.name() + "/" + relative : relative;
    }
}
