package ai.querygraph.model;

import java.util.List;
import java.util.Objects;

/**
 * Canonical cache key.
 * <p>
 * id is derived from segments only; display is the human-readable rendering.
 */
public record NormalizedKey(
        String id,              // segments joined by "|" or a sentinel id
        String display,         // e.g. [todos, $id]
        List<String> segments,
        MatchMode matchMode,
        Resolution resolution,
        KeySource source
) {
    public NormalizedKey {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(display, "display");
        segments = List.copyOf(segments);
        Objects.requireNonNull(matchMode, "matchMode");
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(source, "source");
    }

    public NormalizedKey withMatchMode(MatchMode mode) {
        return new NormalizedKey(id, display, segments, mode, resolution, source);
    }
}
