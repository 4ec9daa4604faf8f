package ai.querygraph.key;

import java.util.Objects;

/** Rendered text of one key element plus whether it was statically determined. */
public record Segment(String text, boolean isStatic) {

    public Segment {
        Objects.requireNonNull(text, "text");
    }

    static Segment of(String text) {
        return new Segment(text, true);
    }

    static Segment dynamic(String text) {
        return new Segment(text, false);
    }
}
