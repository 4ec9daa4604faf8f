package ai.querygraph.modules;

import java.util.Objects;

/** A named workspace root; {@code path} is an absolute '/'-separated directory. */
public record WorkspaceRoot(String name, String path) {

    public WorkspaceRoot {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
    }
}
