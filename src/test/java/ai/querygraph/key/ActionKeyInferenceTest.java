package ai.querygraph.key;

import static ai.querygraph.ast.Ast.and;
import static ai.querygraph.ast.Ast.array;
import static ai.querygraph.ast.Ast.arrow;
import static ai.querygraph.ast.Ast.call;
import static ai.querygraph.ast.Ast.eq;
import static ai.querygraph.ast.Ast.id;
import static ai.querygraph.ast.Ast.index;
import static ai.querygraph.ast.Ast.member;
import static ai.querygraph.ast.Ast.num;
import static ai.querygraph.ast.Ast.object;
import static ai.querygraph.ast.Ast.prop;
import static ai.querygraph.ast.Ast.spread;
import static ai.querygraph.ast.Ast.str;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.querygraph.ast.Expr;
import ai.querygraph.model.KeySource;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;

class ActionKeyInferenceTest {

    private final ActionKeyInference inference = new ActionKeyInference(new QueryKeyNormalizer(null));

    @Test
    void clearTargetsTheWholeCache() {
        final NormalizedKey key = inference.inferActionKey("clear", List.of());

        assertEquals(QueryKeys.ALL_QUERY_CACHE_ID, key.id());
        assertEquals(MatchMode.ALL, key.matchMode());
        assertEquals(KeySource.WILDCARD, key.source());
    }

    @Test
    void invalidateWithoutArgumentsIsWildcard() {
        final NormalizedKey key = inference.inferActionKey("invalidateQueries", List.of());

        assertEquals(QueryKeys.ALL_QUERY_CACHE_ID, key.id());
        assertEquals(MatchMode.ALL, key.matchMode());
    }

    @Test
    void optionsObjectKeyDefaultsToPrefix() {
        final NormalizedKey key = inference.inferActionKey("invalidateQueries",
                List.of(object(prop("queryKey", array(str("todos"))))));

        assertEquals("[todos]", key.display());
        assertEquals(MatchMode.PREFIX, key.matchMode());
    }

    @Test
    void exactFlagNarrowsMatching() {
        final NormalizedKey key = inference.inferActionKey("invalidateQueries",
                List.of(object(prop("queryKey", array(str("todos"))), prop("exact", new Expr.Bool(true)))));

        assertEquals(MatchMode.EXACT, key.matchMode());
    }

    @Test
    void spreadFirstArgumentIsUnknown() {
        final NormalizedKey key = inference.inferActionKey("invalidateQueries", List.of(spread(id("args"))));

        assertEquals(QueryKeys.UNRESOLVED_QUERY_KEY_ID, key.id());
        assertEquals(MatchMode.UNKNOWN, key.matchMode());
    }

    @Test
    void setQueryDataWithForwardedKeyIsPassThrough() {
        final NormalizedKey key = inference.inferActionKey("setQueryData", List.of(id("queryKey"), id("data")));

        assertEquals(QueryKeys.PASS_THROUGH_ID, key.id());
        assertEquals(MatchMode.EXACT, key.matchMode());
    }

    @Test
    void setQueryDataWithLiteralKeyIsExact() {
        final NormalizedKey key = inference.inferActionKey("setQueryData",
                List.of(array(str("todo"), num(1)), id("data")));

        assertEquals("todo|1", key.id());
        assertEquals(MatchMode.EXACT, key.matchMode());
    }

    @Test
    void equalityPredicateBecomesPrefixKey() {
        final Expr keyOf = member(id("q"), "queryKey");
        final Expr predicate = arrow(List.of("q"), and(
                eq(index(keyOf, num(0)), str("todos")),
                eq(id("userId"), index(keyOf, num(1)))));

        final NormalizedKey key = inference.inferActionKey("invalidateQueries",
                List.of(object(prop("predicate", predicate))));

        assertEquals("[todos, $userId]", key.display());
        assertEquals(MatchMode.PREFIX, key.matchMode());
    }

    @Test
    void predicateWithGapStopsAtTheGap() {
        final Expr keyOf = member(id("q"), "queryKey");
        final Expr predicate = arrow(List.of("q"), and(
                eq(index(keyOf, num(0)), str("todos")),
                eq(index(keyOf, num(2)), str("open"))));

        final NormalizedKey key = inference.inferActionKey("removeQueries",
                List.of(object(prop("predicate", predicate))));

        assertEquals("[todos]", key.display());
    }

    @Test
    void otherPredicatesStayWildcards() {
        final Expr keyOf = member(id("q"), "queryKey");
        final Expr predicate = arrow(List.of("q"),
                call(member(keyOf, "includes"), str("todos")));

        final NormalizedKey key = inference.inferActionKey("invalidateQueries",
                List.of(object(prop("predicate", predicate))));

        assertEquals(QueryKeys.ALL_QUERY_CACHE_ID, key.id());
        assertEquals(MatchMode.ALL, key.matchMode());
    }
}
