package ai.querygraph.key;

import static ai.querygraph.ast.Ast.array;
import static ai.querygraph.ast.Ast.call;
import static ai.querygraph.ast.Ast.computed;
import static ai.querygraph.ast.Ast.cond;
import static ai.querygraph.ast.Ast.id;
import static ai.querygraph.ast.Ast.member;
import static ai.querygraph.ast.Ast.num;
import static ai.querygraph.ast.Ast.object;
import static ai.querygraph.ast.Ast.or;
import static ai.querygraph.ast.Ast.prop;
import static ai.querygraph.ast.Ast.spread;
import static ai.querygraph.ast.Ast.spreadProp;
import static ai.querygraph.ast.Ast.str;
import static ai.querygraph.ast.Ast.template;
import static ai.querygraph.ast.Ast.undefined;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ai.querygraph.ast.Expr;
import ai.querygraph.model.KeySource;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.model.Resolution;
import ai.querygraph.resolve.QueryKeyResolver;

class QueryKeyNormalizerTest {

    private final QueryKeyNormalizer plain = new QueryKeyNormalizer(null);

    @Test
    void normalizingTwiceGivesTheSameKey() {
        final Expr key = array(str("todos"), object(prop("page", num(2))), id("filter"));

        final NormalizedKey first = plain.normalize(key);
        final NormalizedKey second = plain.normalize(key);

        assertEquals(first.id(), second.id());
        assertEquals(first.display(), second.display());
    }

    @Test
    void objectKeysAreSortedWithoutSpreadOrComputedKeys() {
        final NormalizedKey ab = plain.normalize(object(prop("a", num(1)), prop("b", num(2))));
        final NormalizedKey ba = plain.normalize(object(prop("b", num(2)), prop("a", num(1))));

        assertEquals("{a: 1, b: 2}", ab.display());
        assertEquals(ab.display(), ba.display());
        assertEquals(ab.id(), ba.id());
    }

    @Test
    void undefinedPropertiesAreDropped() {
        final NormalizedKey withUndefined = plain.normalize(object(prop("a", num(1)), prop("b", undefined())));
        final NormalizedKey without = plain.normalize(object(prop("a", num(1))));

        assertEquals(without.display(), withUndefined.display());
        assertEquals(without.id(), withUndefined.id());
    }

    @Test
    void spreadKeepsWrittenOrder() {
        final NormalizedKey first = plain.normalize(object(prop("b", num(2)), spreadProp(id("rest")), prop("a", num(1))));
        final NormalizedKey second = plain.normalize(object(prop("a", num(1)), spreadProp(id("rest")), prop("b", num(2))));

        assertEquals("{b: 2, ...$rest, a: 1}", first.display());
        assertNotEquals(first.display(), second.display());
    }

    @Test
    void computedKeyKeepsWrittenOrder() {
        final NormalizedKey key = plain.normalize(object(prop("b", num(2)), computed(str("a"), num(1))));

        assertEquals("{b: 2, [a]: 1}", key.display());
    }

    @Test
    void arrayKeyWithLocalVariableIsDynamicPrefix() {
        final NormalizedKey key = plain.normalize(array(str("todos"), id("id")));

        assertEquals("todos|$id", key.id());
        assertEquals("[todos, $id]", key.display());
        assertEquals(List.of("todos", "$id"), key.segments());
        assertEquals(MatchMode.PREFIX, key.matchMode());
        assertEquals(Resolution.DYNAMIC, key.resolution());
        assertEquals(KeySource.EXPRESSION, key.source());
    }

    @Test
    void pipeInsideSegmentDoesNotCollideWithSegmentBoundary() {
        final NormalizedKey joined = plain.normalize(array(str("a|b")));
        final NormalizedKey split = plain.normalize(array(str("a"), str("b")));

        assertEquals("a\\|b", joined.id());
        assertEquals("a|b", split.id());
        assertEquals(List.of("a|b"), joined.segments());
        assertEquals("a\\|b", plain.normalize(str("a|b")).id());
    }

    @Test
    void literalArrayKeyIsStatic() {
        final NormalizedKey key = plain.normalize(array(str("todos"), str("list"), num(3)), MatchMode.EXACT, false);

        assertEquals("todos|list|3", key.id());
        assertEquals(MatchMode.EXACT, key.matchMode());
        assertEquals(Resolution.STATIC, key.resolution());
        assertEquals(KeySource.LITERAL, key.source());
    }

    @Test
    void spreadArrayElementsAreInlined() {
        final NormalizedKey key = plain.normalize(array(spread(array(str("a"), str("b"))), str("c")));

        assertEquals("[a, b, c]", key.display());
    }

    @Test
    void templateKeepsPlaceholders() {
        final NormalizedKey key = plain.normalize(array(template(List.of("todo-", ""), id("id"))));

        assertEquals("[todo-${$id}]", key.display());
        assertEquals(Resolution.DYNAMIC, key.resolution());
    }

    @Test
    void conditionalAndEmptyFallbackSegments() {
        final NormalizedKey key = plain.normalize(array(cond(id("x"), str("a"), str("b")), or(id("tab"), str(""))));

        assertEquals(List.of("cond(...)", "$tab"), key.segments());
    }

    @Test
    void missingKeyIsWildcardOrUnknown() {
        final NormalizedKey wildcard = plain.normalize(null, null, true);
        assertEquals(QueryKeys.ALL_QUERY_CACHE_ID, wildcard.id());
        assertEquals(MatchMode.ALL, wildcard.matchMode());
        assertEquals(KeySource.WILDCARD, wildcard.source());

        final NormalizedKey unknown = plain.normalize(null, null, false);
        assertEquals(QueryKeys.UNRESOLVED_QUERY_KEY_ID, unknown.id());
        assertEquals(MatchMode.UNKNOWN, unknown.matchMode());
    }

    @Test
    void emptyArrayHasEmptyId() {
        final NormalizedKey key = plain.normalize(array());

        assertEquals(QueryKeys.EMPTY_ID, key.id());
        assertEquals("[]", key.display());
    }

    @Test
    void wrappedQueryKeyObjectIsUnwrapped() {
        final NormalizedKey key = plain.normalize(array(object(prop("queryKey", array(str("users"), str("me"))))));

        assertEquals("[users, me]", key.display());
    }

    @Test
    void referencesAreFollowedThroughTheResolver() {
        final MapResolver resolver = new MapResolver();
        resolver.values.put("todoKeys", object(prop("all", array(str("todos")))));
        resolver.values.put("STATUS", str("open"));
        final QueryKeyNormalizer normalizer = new QueryKeyNormalizer(resolver);

        final NormalizedKey key = normalizer.normalize(array(spread(member(id("todoKeys"), "all")), id("STATUS")));

        assertEquals("[todos, open]", key.display());
        assertEquals(Resolution.STATIC, key.resolution());
    }

    @Test
    void factoryCallResultIsNormalized() {
        final MapResolver resolver = new MapResolver();
        resolver.calls.put("userKey", array(str("user"), id("userId")));
        final QueryKeyNormalizer normalizer = new QueryKeyNormalizer(resolver);

        final NormalizedKey key = normalizer.normalize(call(id("userKey"), num(7)));

        assertEquals("[user, $userId]", key.display());
    }

    /** Resolves identifiers and call results by callee name. */
    static final class MapResolver implements QueryKeyResolver {
        final Map<String, Expr> values = new HashMap<>();
        final Map<String, Expr> calls = new HashMap<>();

        @Override
        public Expr resolveReference(Expr expression) {
            return expression instanceof Expr.Ident id ? values.get(id.name()) : null;
        }

        @Override
        public Expr resolveCallResult(Expr callee) {
            return callee instanceof Expr.Ident id ? calls.get(id.name()) : null;
        }
    }
}
