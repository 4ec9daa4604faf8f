package ai.querygraph.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchMode {
    EXACT,
    PREFIX,
    ALL,
    PREDICATE,
    UNKNOWN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
