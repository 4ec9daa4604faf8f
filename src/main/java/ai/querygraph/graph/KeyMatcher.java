package ai.querygraph.graph;

import java.util.List;

import ai.querygraph.key.QueryKeys;
import ai.querygraph.model.KeySource;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;

/**
 * Decides whether a mutation key reaches a declared key.
 * Segments are compared pairwise; a dynamic segment on either side matches anything.
 */
public final class KeyMatcher {

    private KeyMatcher() {
    }

    public static boolean affects(NormalizedKey mutation, NormalizedKey declared) {
        // A forwarded { queryKey } parameter cannot be expanded; it stays its own node.
        if (QueryKeys.PASS_THROUGH_ID.equals(mutation.id())) {
            return false;
        }
        if (mutation.source() == KeySource.WILDCARD
                || mutation.matchMode() == MatchMode.ALL
                || mutation.matchMode() == MatchMode.PREDICATE) {
            return true;
        }
        if (mutation.id().equals(declared.id())) {
            return true;
        }

        // A key with nothing known about it anchors no comparison.
        if (QueryKeys.isUnresolved(mutation) || QueryKeys.isUnresolved(declared)) {
            return false;
        }

        // Positional: an UNRESOLVED element keeps its slot and matches like any dynamic segment.
        final List<String> mutationSegments = mutation.segments();
        final List<String> declaredSegments = declared.segments();
        if (mutationSegments.isEmpty() || declaredSegments.isEmpty()) {
            return false;
        }
        if (mutation.matchMode() == MatchMode.EXACT) {
            return mutationSegments.size() == declaredSegments.size()
                    && isPrefix(mutationSegments, declaredSegments);
        }
        return isPrefix(mutationSegments, declaredSegments);
    }

    /**
     * Reads dynamism off the rendered text, since a {@link NormalizedKey} keeps no per-segment certainty.
     * A static string literal that itself starts with {@code $} (say {@code '$admin'}) is therefore
     * indistinguishable from a captured parameter and matches anything in its slot.
     */
    public static boolean isDynamicSegment(String segment) {
        final String s = segment.trim();
        return s.isEmpty()
                || s.equals(QueryKeys.UNRESOLVED_SEGMENT)
                || s.startsWith("$")
                || s.contains("${")
                || s.contains(QueryKeys.UNRESOLVED_SEGMENT)
                || s.startsWith("call(")
                || s.startsWith("cond(");
    }

    public static boolean compatible(String left, String right) {
        return left.equals(right) || isDynamicSegment(left) || isDynamicSegment(right);
    }

    /** Concrete keys written by {@code setQueryData} keep their node even without a declaration. */
    public static boolean isConcreteSetAnchor(NormalizedKey key) {
        if (key.source() == KeySource.WILDCARD) {
            return false;
        }
        return !QueryKeys.PASS_THROUGH_ID.equals(key.id())
                && !QueryKeys.ALL_QUERY_CACHE_ID.equals(key.id())
                && !QueryKeys.UNRESOLVED_QUERY_KEY_ID.equals(key.id());
    }

    private static boolean isPrefix(List<String> prefix, List<String> value) {
        if (prefix.size() > value.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (!compatible(prefix.get(i), value.get(i))) {
                return false;
            }
        }
        return true;
    }
}
