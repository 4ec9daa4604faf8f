package ai.querygraph.classify;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import ai.querygraph.model.Relation;

/** Names of the query library surface the classifier recognizes. */
public final class QueryApi {

    public static final String TANSTACK_MODULE = "@tanstack/react-query";

    public static final Set<String> QUERY_HOOKS = Set.of(
            "useQuery",
            "useInfiniteQuery",
            "useSuspenseQuery",
            "useSuspenseInfiniteQuery",
            "useQueries",
            "useSuspenseQueries",
            "queryOptions",
            "usePrefetchQuery",
            "usePrefetchInfiniteQuery");

    public static final Set<String> CLIENT_DECLARE_METHODS = Set.of(
            "fetchQuery",
            "prefetchQuery",
            "ensureQueryData",
            "fetchInfiniteQuery",
            "prefetchInfiniteQuery",
            "ensureInfiniteQueryData");

    public static final Map<String, Relation> ACTION_RELATIONS = Map.of(
            "invalidateQueries", Relation.INVALIDATES,
            "refetchQueries", Relation.REFETCHES,
            "cancelQueries", Relation.CANCELS,
            "resetQueries", Relation.RESETS,
            "clear", Relation.CLEARS,
            "removeQueries", Relation.REMOVES,
            "setQueryData", Relation.SETS,
            "setQueriesData", Relation.SETS);

    /** JSX attribute through which components receive keys to invalidate. */
    public static final String INVALIDATION_PROP = "queryKeysToInvalidate";

    private static final Pattern QUERY_PATH_SEGMENT = Pattern.compile("(^|[/-])query([/-]|$)");

    private QueryApi() {
    }

    /** Module specifiers that plausibly re-export the query library. */
    public static boolean isQueryLikeModule(String source) {
        return source.contains("react-query") || source.contains("tanstack") || QUERY_PATH_SEGMENT.matcher(source).find();
    }
}
