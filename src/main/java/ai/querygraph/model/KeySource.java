package ai.querygraph.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where a key came from: written as a literal, derived from an expression, or a wildcard. */
public enum KeySource {
    LITERAL,
    EXPRESSION,
    WILDCARD;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
