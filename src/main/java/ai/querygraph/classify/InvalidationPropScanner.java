package ai.querygraph.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ai.querygraph.ast.Expr;
import ai.querygraph.key.QueryKeyNormalizer;
import ai.querygraph.key.QueryKeys;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.resolve.QueryKeyResolver;

/**
 * Reads the keys listed in a {@code queryKeysToInvalidate={...}} JSX attribute.
 * The value may be a single key or a list of keys, possibly behind references, conditionals or spreads.
 */
final class InvalidationPropScanner {

    private static final int MAX_DEPTH = 16;

    /**
     * One listed key.
     *
     * @param locationNode node whose position the record reports: the element itself when it is
     *                     written in the attribute, otherwise the attribute value
     */
    record KeyExpression(Expr expression, Expr locationNode) {
    }

    private final QueryKeyResolver resolver;
    private final QueryKeyNormalizer normalizer;

    InvalidationPropScanner(QueryKeyResolver resolver, QueryKeyNormalizer normalizer) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    List<KeyExpression> keyExpressions(Expr value) {
        return collect(value, 0);
    }

    /** Single-segment {@code undefined} or {@code null} keys come from optional props and are not reported. */
    static boolean isIgnorable(NormalizedKey key) {
        if (key.segments().size() != 1) {
            return false;
        }
        final String segment = key.segments().get(0);
        return segment.equals("undefined") || segment.equals("$undefined") || segment.equals("null") || segment.equals("$null");
    }

    private List<KeyExpression> collect(Expr expression, int depth) {
        if (depth >= MAX_DEPTH) {
            return List.of(new KeyExpression(expression, expression));
        }
        if (expression instanceof Expr.Conditional c) {
            return concat(collect(c.consequent(), depth + 1), collect(c.alternate(), depth + 1));
        }
        if (expression instanceof Expr.Logical l) {
            if ("&&".equals(l.operator())) {
                return collect(l.right(), depth + 1);
            }
            return concat(collect(l.left(), depth + 1), collect(l.right(), depth + 1));
        }

        final Expr resolved = resolve(expression, depth + 1);
        if (!(resolved instanceof Expr.ArrayLit collection) || !isLikelyKeyCollection(collection, depth + 1)) {
            return List.of(new KeyExpression(expression, expression));
        }

        final boolean fromElsewhere = resolved != expression;
        final List<KeyExpression> out = new ArrayList<>();
        for (Expr element : collection.elements()) {
            if (element instanceof Expr.Hole) {
                continue;
            }
            final Expr item = element instanceof Expr.Spread spread ? spread.argument() : element;
            final Expr location = fromElsewhere ? expression : item;
            final Expr itemResolved = resolve(item, depth + 1);
            if (itemResolved instanceof Expr.ArrayLit nested && isLikelyKeyCollection(nested, depth + 1)) {
                for (KeyExpression candidate : collect(nested, depth + 1)) {
                    out.add(new KeyExpression(candidate.expression(), location));
                }
            } else {
                out.add(new KeyExpression(item, location));
            }
        }
        return out;
    }

    private Expr resolve(Expr expression, int depth) {
        if (depth >= MAX_DEPTH) {
            return expression;
        }
        if (expression instanceof Expr.Ident || expression instanceof Expr.Member m && !m.optional()) {
            final Expr resolved = resolver.resolveReference(expression);
            return resolved != null ? resolve(resolved, depth + 1) : expression;
        }
        if (expression instanceof Expr.Call call && !call.optional()) {
            final Expr calleeValue = resolver.resolveReference(call.callee());
            if (calleeValue != null) {
                return resolve(calleeValue, depth + 1);
            }
            final Expr returned = resolver.resolveCallResult(call.callee());
            if (returned != null) {
                return resolve(returned, depth + 1);
            }
        }
        return expression;
    }

    /** A list counts as a list of keys when it is empty or at least one element looks like a key array. */
    private boolean isLikelyKeyCollection(Expr.ArrayLit array, int depth) {
        if (depth >= MAX_DEPTH) {
            return false;
        }
        int comparable = 0;
        int arrayLike = 0;
        for (Expr element : array.elements()) {
            if (element instanceof Expr.Spread || element instanceof Expr.Hole) {
                continue;
            }
            comparable++;
            if (looksLikeKeyArray(element, depth + 1)) {
                arrayLike++;
            }
        }
        return comparable == 0 || arrayLike > 0;
    }

    private boolean looksLikeKeyArray(Expr expression, int depth) {
        if (depth >= MAX_DEPTH) {
            return false;
        }
        if (resolve(expression, depth + 1) instanceof Expr.ArrayLit) {
            return true;
        }
        final NormalizedKey key = normalizer.normalize(expression, MatchMode.PREFIX, false);
        if (QueryKeys.isUnresolved(key) || QueryKeys.isWildcard(key)) {
            return false;
        }
        return key.display().startsWith("[") && key.display().endsWith("]");
    }

    private static List<KeyExpression> concat(List<KeyExpression> a, List<KeyExpression> b) {
        final List<KeyExpression> out = new ArrayList<>(a);
        out.addAll(b);
        return out;
    }
}
