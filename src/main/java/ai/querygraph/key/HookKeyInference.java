package ai.querygraph.key;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.querygraph.ast.Expr;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.symbols.FunctionReturns;

/**
 * Keys declared by hook calls such as {@code useQuery(...)} and {@code useQueries(...)}.
 */
public final class HookKeyInference {

    private static final int MAX_DIRECT_CHECK_DEPTH = 16;

    private static final Set<String> PASSTHROUGH_METHODS = Set.of("filter", "slice", "sort", "reverse", "toSorted", "flat");

    private final QueryKeyNormalizer normalizer;

    public HookKeyInference(QueryKeyNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    /** Key of a single-query hook: the first argument, or its {@code queryKey} property. */
    public NormalizedKey inferHookKey(List<Expr> args) {
        final Expr first = args.isEmpty() ? null : args.get(0);
        if (first == null || first instanceof Expr.Spread) {
            return normalizer.normalize(null, MatchMode.UNKNOWN, false);
        }
        final Expr resolved = normalizer.resolveKeyExpression(first);
        if (resolved instanceof Expr.ObjectLit options) {
            return normalizer.normalize(QueryKeyNormalizer.findProperty(options, "queryKey"), MatchMode.EXACT, false);
        }
        return normalizer.normalize(resolved, MatchMode.EXACT, false);
    }

    /**
     * Every key declared by a hook call. Collection hooks yield one key per entry of their
     * {@code queries} list, de-duplicated; other hooks yield exactly one key.
     */
    public List<NormalizedKey> inferHookKeys(String hookName, List<Expr> args) {
        if (!isCollectionHook(hookName)) {
            return List.of(inferHookKey(args));
        }
        final Expr first = args.isEmpty() ? null : args.get(0);
        if (first == null || first instanceof Expr.Spread) {
            return List.of(normalizer.normalize(null, MatchMode.UNKNOWN, false));
        }

        final Expr resolvedFirst = normalizer.resolveKeyExpression(first);
        List<Expr> keyExpressions = List.of();
        if (resolvedFirst instanceof Expr.ObjectLit options) {
            final Expr queries = QueryKeyNormalizer.findProperty(options, "queries");
            if (queries != null) {
                keyExpressions = fromCollection(queries, 0);
            }
        } else if (resolvedFirst instanceof Expr.ArrayLit) {
            keyExpressions = fromCollection(resolvedFirst, 0);
        }

        final Map<String, NormalizedKey> deduped = new LinkedHashMap<>();
        for (Expr expression : keyExpressions) {
            final NormalizedKey key = normalizer.normalize(expression, MatchMode.EXACT, false);
            deduped.putIfAbsent(key.id() + "|" + key.display() + "|" + key.matchMode() + "|" + key.resolution(), key);
        }
        if (deduped.isEmpty()) {
            return List.of(inferHookKey(args));
        }
        return List.copyOf(deduped.values());
    }

    public static boolean isCollectionHook(String hookName) {
        final String lower = hookName.toLowerCase(Locale.ROOT);
        return lower.equals("usequeries") || lower.equals("usesuspensequeries");
    }

    private List<Expr> fromEntry(Expr expression, int depth) {
        if (depth >= QueryKeyNormalizer.MAX_DEPTH) {
            return List.of();
        }
        final Expr resolved = QueryKeyNormalizer.orSelf(normalizer.resolveKeyExpression(expression, depth + 1), expression);
        if (resolved instanceof Expr.Conditional c) {
            return concat(fromEntry(c.consequent(), depth + 1), fromEntry(c.alternate(), depth + 1));
        }
        if (resolved instanceof Expr.Logical l) {
            if ("&&".equals(l.operator())) {
                return fromEntry(l.right(), depth + 1);
            }
            return concat(fromEntry(l.left(), depth + 1), fromEntry(l.right(), depth + 1));
        }
        if (resolved instanceof Expr.ObjectLit object) {
            final Expr queryKey = QueryKeyNormalizer.findProperty(object, "queryKey");
            if (queryKey != null) {
                return List.of(queryKey);
            }
            final Expr nested = QueryKeyNormalizer.findProperty(object, "queries");
            return nested != null ? fromCollection(nested, depth + 1) : List.of();
        }
        if (resolved instanceof Expr.ArrayLit) {
            // options helpers can resolve straight to the key array
            return List.of(resolved);
        }
        if (resolved instanceof Expr.Call call && !call.optional()) {
            return fromCollectionCall(call, depth + 1);
        }
        return List.of();
    }

    private List<Expr> fromCollection(Expr expression, int depth) {
        if (depth >= QueryKeyNormalizer.MAX_DEPTH) {
            return List.of();
        }
        final Expr resolved = QueryKeyNormalizer.orSelf(normalizer.resolveKeyExpression(expression, depth + 1), expression);
        if (resolved instanceof Expr.Conditional c) {
            return concat(fromCollection(c.consequent(), depth + 1), fromCollection(c.alternate(), depth + 1));
        }
        if (resolved instanceof Expr.Logical l) {
            if ("&&".equals(l.operator())) {
                return fromCollection(l.right(), depth + 1);
            }
            return concat(fromCollection(l.left(), depth + 1), fromCollection(l.right(), depth + 1));
        }
        if (resolved instanceof Expr.Call call && !call.optional()) {
            return fromCollectionCall(call, depth + 1);
        }
        if (!(resolved instanceof Expr.ArrayLit array)) {
            return fromEntry(resolved, depth + 1);
        }

        final List<Expr> out = new ArrayList<>();
        for (Expr element : array.elements()) {
            if (element instanceof Expr.Hole) {
                continue;
            }
            if (element instanceof Expr.Spread spread) {
                out.addAll(fromCollection(spread.argument(), depth + 1));
            } else {
                out.addAll(fromEntry(element, depth + 1));
            }
        }
        return out;
    }

    /** {@code list.map(fn)}, {@code flatMap}, {@code concat} and order/filter methods over a queries list. */
    private List<Expr> fromCollectionCall(Expr.Call call, int depth) {
        if (depth >= QueryKeyNormalizer.MAX_DEPTH || !(call.callee() instanceof Expr.Member callee)) {
            return List.of();
        }
        final String method = callee.propertyName();
        if (method == null) {
            return List.of();
        }
        final List<Expr> source = fromCollection(callee.object(), depth + 1);

        switch (method) {
            case "map", "flatMap" -> {
                final Expr mapper = QueryKeyNormalizer.firstArgument(call);
                final Expr mapped = mapper != null ? mapperResult(mapper, depth + 1) : null;
                if (mapped == null) {
                    return source;
                }
                return method.equals("map") ? fromEntry(mapped, depth + 1) : fromCollection(mapped, depth + 1);
            }
            case "concat" -> {
                final List<Expr> combined = new ArrayList<>(source);
                for (Expr arg : call.arguments()) {
                    if (!(arg instanceof Expr.Spread)) {
                        combined.addAll(fromCollection(arg, depth + 1));
                    }
                }
                return combined;
            }
            default -> {
                return PASSTHROUGH_METHODS.contains(method) ? source : List.of();
            }
        }
    }

    private Expr mapperResult(Expr mapper, int depth) {
        if (depth >= QueryKeyNormalizer.MAX_DEPTH) {
            return null;
        }
        if (mapper instanceof Expr.FunctionExpr fn) {
            return FunctionReturns.extract(fn);
        }
        final boolean reference = mapper instanceof Expr.Ident || mapper instanceof Expr.Member;
        if (!reference || normalizer.resolver() == null) {
            return null;
        }
        final Expr resolved = normalizer.resolver().resolveReference(mapper);
        if (resolved instanceof Expr.FunctionExpr fn) {
            return FunctionReturns.extract(fn);
        }
        return resolved;
    }

    /**
     * True when the key is written at the call site itself rather than obtained from a
     * factory or options helper.
     */
    public static boolean declaresKeyDirectly(List<Expr> args, String hookName) {
        final Expr first = args.isEmpty() ? null : args.get(0);
        if (first == null || first instanceof Expr.Spread) {
            return false;
        }
        if (first instanceof Expr.ObjectLit options) {
            if (QueryKeyNormalizer.findProperty(options, "queryKey") != null) {
                return true;
            }
            final Expr queries = QueryKeyNormalizer.findProperty(options, "queries");
            return queries != null && isInlineCollection(queries, 0);
        }
        if (first instanceof Expr.ArrayLit) {
            return !hookName.toLowerCase(Locale.ROOT).equals("usequeries") || isInlineCollection(first, 0);
        }
        return first instanceof Expr.Str || first instanceof Expr.Template;
    }

    private static boolean isInlineObject(Expr expression, int depth) {
        if (depth >= MAX_DIRECT_CHECK_DEPTH || !(expression instanceof Expr.ObjectLit object)) {
            return false;
        }
        if (QueryKeyNormalizer.findProperty(object, "queryKey") != null) {
            return true;
        }
        final Expr queries = QueryKeyNormalizer.findProperty(object, "queries");
        return queries != null && isInlineCollection(queries, depth + 1);
    }

    private static boolean isInlineCollection(Expr expression, int depth) {
        if (depth >= MAX_DIRECT_CHECK_DEPTH) {
            return false;
        }
        if (expression instanceof Expr.Conditional c) {
            return isInlineCollection(c.consequent(), depth + 1) || isInlineCollection(c.alternate(), depth + 1);
        }
        if (expression instanceof Expr.Logical l) {
            return isInlineCollection(l.left(), depth + 1) || isInlineCollection(l.right(), depth + 1);
        }
        if (!(expression instanceof Expr.ArrayLit array)) {
            return isInlineObject(expression, depth + 1);
        }
        for (Expr element : array.elements()) {
            if (!(element instanceof Expr.Spread) && isInlineObject(element, depth + 1)) {
                return true;
            }
        }
        return false;
    }

    private static List<Expr> concat(List<Expr> a, List<Expr> b) {
        final List<Expr> out = new ArrayList<>(a);
        out.addAll(b);
        return out;
    }
}
