package ai.querygraph.model;

import java.util.Objects;

/**
 * One recognized call site. Created during classification, consumed by the graph assembler.
 */
public record CallSiteRecord(
        Relation relation,
        String operation,        // source call name, e.g. invalidateQueries, useQuery
        String file,             // absolute, '/'-separated
        SourceLoc loc,
        NormalizedKey queryKey,
        Resolution resolution,
        boolean declaresDirectly // key written inline at the call site
) {
    public CallSiteRecord {
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(loc, "loc");
        Objects.requireNonNull(queryKey, "queryKey");
        Objects.requireNonNull(resolution, "resolution");
    }
}
