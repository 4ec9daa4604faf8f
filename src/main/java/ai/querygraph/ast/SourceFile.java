package ai.querygraph.ast;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A successfully parsed source file: top-level statements plus the positions of the nodes
 * the parser created. Nodes built later during analysis have no position and report {@link Loc#START}.
 */
public final class SourceFile {

    private final String path;
    private final List<Stmt> body;
    private final Map<Object, Loc> locations;

    public SourceFile(String path, List<Stmt> body, IdentityHashMap<Object, Loc> locations) {
        this.path = Objects.requireNonNull(path, "path");
        this.body = List.copyOf(body);
        this.locations = Objects.requireNonNull(locations, "locations");
    }

    public SourceFile(String path, List<Stmt> body) {
        this(path, body, new IdentityHashMap<>());
    }

    public String path() {
        return path;
    }

    public List<Stmt> body() {
        return body;
    }

    public Loc locationOf(Object node) {
        if (node == null) {
            return Loc.START;
        }
        final Loc loc = locations.get(node);
        return loc != null ? loc : Loc.START;
    }
}
