package ai.querygraph.graph;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import ai.querygraph.key.QueryKeys;
import ai.querygraph.key.Segment;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.model.Resolution;

class KeyMatcherTest {

    private static NormalizedKey key(MatchMode mode, String... segments) {
        return QueryKeys.fromSegments(
                Arrays.stream(segments).map(s -> new Segment(s, !s.startsWith("$"))).toList(),
                mode);
    }

    private final NormalizedKey todosList = key(MatchMode.EXACT, "todos", "list");

    @Test
    void prefixMatchesLongerDeclaredKey() {
        assertTrue(KeyMatcher.affects(key(MatchMode.PREFIX, "todos"), todosList));
    }

    @Test
    void differentSegmentDoesNotMatch() {
        assertFalse(KeyMatcher.affects(key(MatchMode.PREFIX, "todos", "detail"), todosList));
    }

    @Test
    void dynamicSegmentMatchesAnything() {
        assertTrue(KeyMatcher.affects(key(MatchMode.PREFIX, "todos", "$id"), todosList));
    }

    @Test
    void exactRequiresSameLength() {
        assertFalse(KeyMatcher.affects(key(MatchMode.EXACT, "todos"), todosList));
        assertTrue(KeyMatcher.affects(key(MatchMode.EXACT, "todos", "$which"), todosList));
    }

    @Test
    void longerMutationNeverMatchesShorterDeclaration() {
        assertFalse(KeyMatcher.affects(key(MatchMode.PREFIX, "todos", "list", "1"), todosList));
    }

    @Test
    void wildcardAndPredicateModesMatchEverything() {
        assertTrue(KeyMatcher.affects(QueryKeys.allQueryCache(Resolution.STATIC, "ALL", MatchMode.ALL), todosList));
        assertTrue(KeyMatcher.affects(key(MatchMode.PREDICATE, "users"), todosList));
    }

    @Test
    void passThroughNeverMatches() {
        assertFalse(KeyMatcher.affects(QueryKeys.passThrough(MatchMode.EXACT), todosList));
        assertFalse(KeyMatcher.isConcreteSetAnchor(QueryKeys.passThrough(MatchMode.EXACT)));
    }

    @Test
    void wholeUnresolvedKeyNeverMatches() {
        assertFalse(KeyMatcher.affects(QueryKeys.unknown(MatchMode.PREFIX), todosList));
    }

    @Test
    void unresolvedSegmentKeepsItsPosition() {
        final NormalizedKey declared = key(MatchMode.EXACT, "todos", "UNRESOLVED", "list");

        assertTrue(KeyMatcher.affects(key(MatchMode.PREFIX, "todos", "5", "list"), declared));
        assertTrue(KeyMatcher.affects(key(MatchMode.EXACT, "todos", "5", "list"), declared));
        assertFalse(KeyMatcher.affects(key(MatchMode.PREFIX, "todos", "5", "detail"), declared));
        assertFalse(KeyMatcher.affects(key(MatchMode.EXACT, "todos", "5"), declared));
    }

    @Test
    void unresolvedMutationSegmentMatchesOnlyItsSlot() {
        final NormalizedKey mutation = key(MatchMode.EXACT, "todos", "UNRESOLVED");

        assertTrue(KeyMatcher.affects(mutation, todosList));
        assertFalse(KeyMatcher.affects(mutation, key(MatchMode.EXACT, "users", "list")));
    }

    @Test
    void dollarPrefixedLiteralIsTreatedAsDynamic() {
        // Rendered segments carry no certainty flag; a static '$admin' reads like a captured parameter.
        final NormalizedKey literal = QueryKeys.fromSegments(
                List.of(new Segment("users", true), new Segment("$admin", true)), MatchMode.EXACT);

        assertTrue(KeyMatcher.affects(literal, key(MatchMode.EXACT, "users", "guest")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "UNRESOLVED", "$id", "todo-${$id}", "call(fetchId)", "cond(...)", "x.UNRESOLVED"})
    void dynamicSegments(String segment) {
        assertTrue(KeyMatcher.isDynamicSegment(segment));
    }

    @ParameterizedTest
    @ValueSource(strings = {"todos", "1", "{a: 1}", "null"})
    void concreteSegments(String segment) {
        assertFalse(KeyMatcher.isDynamicSegment(segment));
    }

    @Test
    void concreteSetAnchor() {
        assertTrue(KeyMatcher.isConcreteSetAnchor(key(MatchMode.EXACT, "todo", "1")));
        assertFalse(KeyMatcher.isConcreteSetAnchor(QueryKeys.unknown(MatchMode.EXACT)));
        assertFalse(KeyMatcher.isConcreteSetAnchor(QueryKeys.allQueryCache(Resolution.STATIC, "ALL", MatchMode.ALL)));
    }
}
