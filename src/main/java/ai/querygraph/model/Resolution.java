package ai.querygraph.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Certainty that a key's shape was fully determined without running code.
 * Forms a two-element lattice where DYNAMIC absorbs.
 */
public enum Resolution {
    STATIC,
    DYNAMIC;

    public static Resolution merge(Resolution a, Resolution b) {
        return a == DYNAMIC || b == DYNAMIC ? DYNAMIC : STATIC;
    }

    public static Resolution of(boolean isStatic) {
        return isStatic ? STATIC : DYNAMIC;
    }

    public boolean isStatic() {
        return this == STATIC;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
