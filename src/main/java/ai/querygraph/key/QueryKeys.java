package ai.querygraph.key;

import java.util.ArrayList;
import java.util.List;

import ai.querygraph.model.KeySource;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.model.Resolution;

/**
 * Sentinel keys and the segment-list to {@link NormalizedKey} conversion.
 */
public final class QueryKeys {

    public static final String UNRESOLVED_SEGMENT = "UNRESOLVED";
    public static final String UNRESOLVED_QUERY_KEY = "UNRESOLVED_QUERY_KEY";
    public static final String UNRESOLVED_QUERY_KEY_ID = "unresolved_query_key";
    public static final String ALL_QUERY_CACHE_ID = "all-query-cache";
    public static final String ALL_QUERY_CACHE_SEGMENT = "ALL_QUERY_CACHE";
    public static final String PASS_THROUGH_ID = "pass-through-query-key";
    public static final String PASS_THROUGH_SEGMENT = "$queryKey";
    public static final String EMPTY_ID = "empty";

    private QueryKeys() {
    }

    public static NormalizedKey allQueryCache(Resolution resolution, String display, MatchMode mode) {
        return new NormalizedKey(ALL_QUERY_CACHE_ID, display, List.of(ALL_QUERY_CACHE_SEGMENT), mode, resolution,
                KeySource.WILDCARD);
    }

    public static NormalizedKey unknown(MatchMode mode) {
        return new NormalizedKey(UNRESOLVED_QUERY_KEY_ID, UNRESOLVED_QUERY_KEY, List.of(UNRESOLVED_SEGMENT), mode,
                Resolution.DYNAMIC, KeySource.EXPRESSION);
    }

    public static NormalizedKey passThrough(MatchMode mode) {
        return new NormalizedKey(PASS_THROUGH_ID, PASS_THROUGH_SEGMENT, List.of(PASS_THROUGH_SEGMENT), mode,
                Resolution.DYNAMIC, KeySource.EXPRESSION);
    }

    /**
     * Array-shaped key: id joins the segments with '|', display renders them as a list.
     * A '|' or '\\' inside a segment is backslash-escaped in the id so that {@code ['a|b']} and
     * {@code ['a', 'b']} stay distinct.
     */
    public static NormalizedKey fromSegments(List<Segment> segments, MatchMode mode) {
        final List<String> raw = new ArrayList<>(segments.size());
        final List<String> escaped = new ArrayList<>(segments.size());
        boolean allStatic = true;
        for (Segment segment : segments) {
            final String text = segment.text().isEmpty() ? UNRESOLVED_SEGMENT : segment.text();
            raw.add(text);
            escaped.add(escapeIdSegment(text));
            allStatic = allStatic && segment.isStatic();
        }
        final String joined = String.join("|", escaped);
        final Resolution resolution = Resolution.of(allStatic);
        return new NormalizedKey(
                joined.isEmpty() ? EMPTY_ID : joined,
                "[" + String.join(", ", raw) + "]",
                raw,
                mode,
                resolution,
                resolution.isStatic() ? KeySource.LITERAL : KeySource.EXPRESSION);
    }

    static String escapeIdSegment(String text) {
        return text.replace("\\", "\\\\").replace("|", "\\|");
    }

    /** Key that is a single non-array value, such as a string. */
    public static NormalizedKey fromSingle(Segment segment, MatchMode mode) {
        final String text = segment.text().isEmpty() ? UNRESOLVED_SEGMENT : segment.text();
        final Resolution resolution = Resolution.of(segment.isStatic());
        return new NormalizedKey(escapeIdSegment(text), text, List.of(text), mode, resolution,
                resolution.isStatic() ? KeySource.LITERAL : KeySource.EXPRESSION);
    }

    public static boolean isUnresolved(NormalizedKey key) {
        return (key.segments().size() == 1 && UNRESOLVED_SEGMENT.equals(key.segments().get(0)))
                || UNRESOLVED_QUERY_KEY_ID.equals(key.id());
    }

    public static boolean isWildcard(NormalizedKey key) {
        return key.source() == KeySource.WILDCARD || "*".equals(key.id()) || ALL_QUERY_CACHE_ID.equals(key.id());
    }
}
