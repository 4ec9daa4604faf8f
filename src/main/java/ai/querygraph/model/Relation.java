package ai.querygraph.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relation between a call site and a cache key. DECLARES marks a declaration, everything else a mutation.
 */
public enum Relation {
    DECLARES,
    INVALIDATES,
    REFETCHES,
    CANCELS,
    RESETS,
    CLEARS,
    REMOVES,
    SETS;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
