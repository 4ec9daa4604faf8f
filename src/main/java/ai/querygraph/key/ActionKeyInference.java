package ai.querygraph.key;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import ai.querygraph.ast.Expr;
import ai.querygraph.model.KeySource;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.model.Resolution;
import ai.querygraph.resolve.SymbolReferenceResolver;
import ai.querygraph.symbols.FunctionReturns;

/**
 * Keys targeted by query-client actions ({@code invalidateQueries}, {@code setQueryData}, ...).
 * <p>
 * Match mode comes from the options object: {@code exact: true} narrows to exact matching,
 * otherwise keys match by prefix. A {@code predicate} is turned into a prefix key when it
 * compares {@code query.queryKey[i]} against values for a contiguous run of indices from 0.
 * Anything that cannot be pinned down becomes a project-scoped wildcard.
 */
public final class ActionKeyInference {

    private static final Pattern PASS_THROUGH_NAME = Pattern.compile("^querykeys?$", Pattern.CASE_INSENSITIVE);

    private final QueryKeyNormalizer normalizer;

    public ActionKeyInference(QueryKeyNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public NormalizedKey inferActionKey(String method, List<Expr> args) {
        if ("clear".equals(method)) {
            return QueryKeys.allQueryCache(Resolution.STATIC, "ALL_QUERY_CACHE (clear all)", MatchMode.ALL);
        }
        if (args.isEmpty()) {
            return normalizer.normalize(null, MatchMode.ALL, true);
        }
        final Expr first = args.get(0);
        if (first instanceof Expr.Spread) {
            return normalizer.normalize(null, MatchMode.UNKNOWN, false);
        }

        if ("setQueryData".equals(method)) {
            final NormalizedKey normalized = normalizer.normalize(normalizer.resolveKeyExpression(first), MatchMode.EXACT, false);
            if (isWildcardish(normalized) || isUnresolvedPassThrough(first, normalized)) {
                return QueryKeys.passThrough(MatchMode.EXACT);
            }
            return normalized;
        }

        Expr.ObjectLit options = normalizer.resolveOptionsObject(first);
        if (options == null) {
            final Expr resolved = normalizer.resolveKeyExpression(first);
            if (!(resolved instanceof Expr.ObjectLit object)) {
                return keyOrWildcard(resolved, MatchMode.PREFIX);
            }
            options = object;
        }

        final Boolean exact = QueryKeyNormalizer.readBoolean(options, "exact");
        final MatchMode mode = Boolean.TRUE.equals(exact) ? MatchMode.EXACT : MatchMode.PREFIX;
        final Expr keyNode = QueryKeyNormalizer.findProperty(options, "queryKey");
        if (keyNode != null) {
            return keyOrWildcard(keyNode, mode);
        }

        final Expr predicate = QueryKeyNormalizer.findProperty(options, "predicate");
        if (predicate != null) {
            final NormalizedKey fromPredicate = inferFromPredicate(predicate);
            if (fromPredicate != null) {
                return Boolean.TRUE.equals(exact) ? fromPredicate.withMatchMode(MatchMode.EXACT) : fromPredicate;
            }
        }
        return normalizer.normalize(null, MatchMode.ALL, true);
    }

    /** A key argument named {@code queryKey} that stays unresolved is the caller's own key passed along. */
    public static boolean isPassThroughReference(Expr node) {
        if (node instanceof Expr.Ident id) {
            return PASS_THROUGH_NAME.matcher(id.name()).matches();
        }
        if (node instanceof Expr.Member member) {
            final String property = member.propertyName();
            return property != null && PASS_THROUGH_NAME.matcher(property).matches();
        }
        return false;
    }

    static boolean isWildcardish(NormalizedKey key) {
        if (QueryKeys.EMPTY_ID.equals(key.id()) && key.segments().isEmpty()) {
            return true;
        }
        if (QueryKeys.UNRESOLVED_QUERY_KEY_ID.equals(key.id())) {
            return true;
        }
        return key.segments().size() == 1 && QueryKeys.UNRESOLVED_SEGMENT.equals(key.segments().get(0));
    }

    private static boolean isUnresolvedPassThrough(Expr node, NormalizedKey key) {
        return isPassThroughReference(node)
                && key.source() == KeySource.EXPRESSION
                && key.segments().size() == 1
                && !key.display().startsWith("[");
    }

    private NormalizedKey keyOrWildcard(Expr node, MatchMode mode) {
        final NormalizedKey normalized = normalizer.normalize(node, mode, false);
        if (isUnresolvedPassThrough(node, normalized)) {
            return QueryKeys.passThrough(mode);
        }
        if (isWildcardish(normalized)) {
            if (isPassThroughReference(node)) {
                return QueryKeys.passThrough(mode);
            }
            return QueryKeys.allQueryCache(Resolution.DYNAMIC, "ALL_QUERY_CACHE (unresolved key)", MatchMode.ALL);
        }
        return normalized;
    }

    // ---------------------------------------------------------------------
    // predicates

    NormalizedKey inferFromPredicate(Expr predicate) {
        final Expr resolved = normalizer.resolveKeyExpression(predicate);
        final Expr condition = resolved instanceof Expr.FunctionExpr fn ? FunctionReturns.extract(fn) : resolved;
        if (condition == null) {
            return null;
        }

        final Map<Integer, Segment> constraints = new HashMap<>();
        collectConstraints(condition, 0, constraints);

        final List<Segment> segments = new ArrayList<>();
        for (int index = 0; constraints.containsKey(index); index++) {
            segments.add(QueryKeyNormalizer.normalizeSegment(constraints.get(index)));
        }
        if (segments.isEmpty()) {
            return null;
        }
        return QueryKeys.fromSegments(segments, MatchMode.PREFIX);
    }

    private void collectConstraints(Expr expression, int depth, Map<Integer, Segment> constraints) {
        if (depth >= QueryKeyNormalizer.MAX_DEPTH) {
            return;
        }
        if (expression instanceof Expr.Unary unary) {
            collectConstraints(unary.argument(), depth + 1, constraints);
            return;
        }
        if (expression instanceof Expr.Logical logical) {
            if ("&&".equals(logical.operator())) {
                collectConstraints(logical.left(), depth + 1, constraints);
                collectConstraints(logical.right(), depth + 1, constraints);
            }
            return;
        }
        if (!(expression instanceof Expr.Binary binary)
                || !("===".equals(binary.operator()) || "==".equals(binary.operator()))) {
            return;
        }

        final int leftIndex = keyIndex(binary.left(), depth + 1);
        final int rightIndex = keyIndex(binary.right(), depth + 1);
        if (leftIndex >= 0 && rightIndex >= 0) {
            return;
        }
        if (leftIndex >= 0) {
            setConstraint(constraints, leftIndex, valueSegment(binary.right(), depth + 1));
        } else if (rightIndex >= 0) {
            setConstraint(constraints, rightIndex, valueSegment(binary.left(), depth + 1));
        }
    }

    private Segment valueSegment(Expr value, int depth) {
        final Expr resolved = QueryKeyNormalizer.orSelf(normalizer.resolveKeyExpression(value, depth), value);
        return QueryKeyNormalizer.normalizeSegment(normalizer.segment(resolved, depth));
    }

    private static void setConstraint(Map<Integer, Segment> constraints, int index, Segment segment) {
        final Segment normalized = QueryKeyNormalizer.normalizeSegment(segment);
        if (QueryKeys.UNRESOLVED_SEGMENT.equals(normalized.text())) {
            return;
        }
        final Segment existing = constraints.get(index);
        if (existing == null) {
            constraints.put(index, normalized);
        } else if (existing.text().equals(normalized.text())) {
            constraints.put(index, new Segment(existing.text(), existing.isStatic() && normalized.isStatic()));
        }
    }

    /** Index {@code i} of an access {@code x.queryKey[i]}, or -1. */
    private int keyIndex(Expr expression, int depth) {
        if (depth >= QueryKeyNormalizer.MAX_DEPTH
                || !(expression instanceof Expr.Member access) || !access.computed()
                || !(access.object() instanceof Expr.Member keyAccess)
                || !"queryKey".equals(keyAccess.propertyName())) {
            return -1;
        }

        final Expr index = access.property();
        if (index instanceof Expr.Num n) {
            return integerIndex(n.value());
        }
        if (index instanceof Expr.Str s) {
            return SymbolReferenceResolver.parseIndex(s.value());
        }
        final Expr resolved = QueryKeyNormalizer.orSelf(normalizer.resolveKeyExpression(index, depth + 1), index);
        if (resolved instanceof Expr.Num n) {
            return integerIndex(n.value());
        }
        if (resolved instanceof Expr.Str s) {
            return SymbolReferenceResolver.parseIndex(s.value());
        }
        final Segment segment = QueryKeyNormalizer.normalizeSegment(normalizer.segment(resolved, depth + 1));
        return SymbolReferenceResolver.parseIndex(segment.text());
    }

    private static int integerIndex(double value) {
        if (value < 0 || value != Math.rint(value) || value > Integer.MAX_VALUE) {
            return -1;
        }
        return (int) value;
    }
}
