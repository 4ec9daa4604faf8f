package ai.querygraph.classify;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.querygraph.ast.Binding;
import ai.querygraph.ast.Expr;
import ai.querygraph.ast.FileScopes;
import ai.querygraph.ast.Pattern;
import ai.querygraph.ast.Scope;
import ai.querygraph.ast.Substitution;
import ai.querygraph.key.HookKeyInference;
import ai.querygraph.key.QueryKeyNormalizer;
import ai.querygraph.key.QueryKeys;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.symbols.FunctionReturns;

/**
 * Expands a key template over the values of a statically known list.
 * <p>
 * {@code ids.forEach(id => client.invalidateQueries({ queryKey: ['todo', id] }))} with
 * {@code const ids = ['a', 'b']} yields {@code [todo, a]} and {@code [todo, b]}. The same applies
 * to {@code useQueries({ queries: ids.map(id => ({ queryKey: ['todo', id] })) })}. All methods
 * return an empty list when nothing could be expanded.
 */
final class IteratorExpansion {

    private static final int MAX_DEPTH = LocalArgResolver.MAX_DEPTH;
    private static final Set<String> ITERATOR_METHODS = Set.of("forEach", "map", "flatMap");
    private static final Set<String> PASSTHROUGH_METHODS = Set.of("filter", "slice", "sort", "reverse", "toSorted", "flat");

    /** A key template inside a {@code list.map(param => ...)} callback. */
    private record Candidate(Expr iterable, String param, Expr template) {
    }

    private final FileScopes scopes;
    private final LocalArgResolver locals;
    private final QueryKeyNormalizer normalizer;

    IteratorExpansion(FileScopes scopes, LocalArgResolver locals, QueryKeyNormalizer normalizer) {
        this.scopes = Objects.requireNonNull(scopes, "scopes");
        this.locals = Objects.requireNonNull(locals, "locals");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    // ---------------------------------------------------------------------
    // client actions

    /** Keys of an action whose key mentions exactly one parameter of an iterator callback. */
    List<NormalizedKey> actionKeys(Scope scope, String method, List<Expr> actionArgs) {
        if (actionArgs.isEmpty() || actionArgs.get(0) instanceof Expr.Spread) {
            return List.of();
        }
        final Expr first = actionArgs.get(0);

        final Expr template;
        final MatchMode mode;
        if ("setQueryData".equals(method)) {
            template = first;
            mode = MatchMode.EXACT;
        } else {
            if (!(first instanceof Expr.ObjectLit options)) {
                return List.of();
            }
            template = QueryKeyNormalizer.findProperty(options, "queryKey");
            mode = Boolean.TRUE.equals(QueryKeyNormalizer.readBoolean(options, "exact")) ? MatchMode.EXACT : MatchMode.PREFIX;
        }
        if (template == null) {
            return List.of();
        }

        final List<String> params = new ArrayList<>();
        for (String name : Substitution.referencedNames(template)) {
            final Binding binding = scope.lookup(name);
            if (binding != null && binding.kind() == Binding.Kind.PARAM) {
                params.add(name);
            }
        }
        if (params.size() != 1) {
            return List.of();
        }

        final String param = params.get(0);
        final List<Expr> values = iteratorParamValues(scope, scope.lookup(param));
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        final Map<String, NormalizedKey> deduped = new LinkedHashMap<>();
        for (Expr value : values) {
            addResolved(deduped, normalizer.normalize(Substitution.replaceIdentifier(template, param, value), mode, false));
        }
        return List.copyOf(deduped.values());
    }

    /** Values the parameter takes when its function is the callback of {@code list.forEach/map/flatMap}. */
    private List<Expr> iteratorParamValues(Scope scope, Binding binding) {
        if (binding.kind() != Binding.Kind.PARAM || binding.function() == null) {
            return null;
        }
        final Expr.Call iteratorCall = scopes.callbackCall(binding.function());
        if (iteratorCall == null || !(iteratorCall.callee() instanceof Expr.Member member)
                || !ITERATOR_METHODS.contains(member.propertyName())) {
            return null;
        }
        return staticIterableValues(scope, member.object(), 0);
    }

    /** Elements of a list known at analysis time, or null when any part is unknown. */
    private List<Expr> staticIterableValues(Scope scope, Expr expression, int depth) {
        if (expression == null || depth >= MAX_DEPTH) {
            return null;
        }
        if (expression instanceof Expr.ArrayLit array) {
            final List<Expr> out = new ArrayList<>();
            for (Expr element : array.elements()) {
                if (element instanceof Expr.Hole) {
                    continue;
                }
                if (element instanceof Expr.Spread spread) {
                    final List<Expr> spreadValues = staticIterableValues(scope, spread.argument(), depth + 1);
                    if (spreadValues != null) {
                        out.addAll(spreadValues);
                    }
                    continue;
                }
                Expr value = locals.resolve(scope, element, depth + 1);
                if (value == null) {
                    value = locals.resolver().resolveReference(element);
                }
                out.add(value != null ? value : element);
            }
            return out;
        }
        if (expression instanceof Expr.Ident || expression instanceof Expr.Member) {
            final Expr local = locals.resolve(scope, expression, depth + 1);
            final Expr resolved = local != null ? local : locals.resolver().resolveReference(expression);
            return resolved != null ? staticIterableValues(scope, resolved, depth + 1) : null;
        }
        if (expression instanceof Expr.Call call) {
            final Expr returned = locals.resolver().resolveCallResult(call.callee());
            return returned != null ? staticIterableValues(scope, returned, depth + 1) : null;
        }
        if (expression instanceof Expr.Conditional conditional) {
            final List<Expr> consequent = staticIterableValues(scope, conditional.consequent(), depth + 1);
            final List<Expr> alternate = staticIterableValues(scope, conditional.alternate(), depth + 1);
            if (consequent == null || alternate == null) {
                return null;
            }
            final List<Expr> both = new ArrayList<>(consequent);
            both.addAll(alternate);
            return both;
        }
        if (expression instanceof Expr.Logical logical
                && ("||".equals(logical.operator()) || "??".equals(logical.operator()))) {
            final List<Expr> left = staticIterableValues(scope, logical.left(), depth + 1);
            return left != null ? left : staticIterableValues(scope, logical.right(), depth + 1);
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // collection hooks

    /** {@code useQueries({ queries: ids.map(id => ...) })} with a static {@code ids}. */
    List<NormalizedKey> hookIteratorKeys(Scope scope, String hookName, List<Expr> hookArgs) {
        if (!HookKeyInference.isCollectionHook(hookName) || hookArgs.isEmpty() || hookArgs.get(0) instanceof Expr.Spread) {
            return List.of();
        }
        final Map<String, NormalizedKey> deduped = new LinkedHashMap<>();
        for (Candidate candidate : candidates(scope, hookArgs.get(0), 0)) {
            final List<Expr> values = staticIterableValues(scope, candidate.iterable(), 0);
            if (values == null) {
                continue;
            }
            for (Expr value : values) {
                final Expr replaced = Substitution.replaceIdentifier(candidate.template(), candidate.param(), value);
                addResolved(deduped, normalizer.normalize(replaced, MatchMode.EXACT, false));
            }
        }
        return List.copyOf(deduped.values());
    }

    /** Every key template of a collection hook whose queries list can be followed statically. */
    List<NormalizedKey> hookStaticCollectionKeys(Scope scope, String hookName, List<Expr> hookArgs) {
        if (!HookKeyInference.isCollectionHook(hookName) || hookArgs.isEmpty() || hookArgs.get(0) instanceof Expr.Spread) {
            return List.of();
        }
        final Map<String, NormalizedKey> deduped = new LinkedHashMap<>();
        for (Expr template : fromCollection(scope, hookArgs.get(0), 0)) {
            addResolved(deduped, normalizer.normalize(template, MatchMode.EXACT, false));
        }
        return List.copyOf(deduped.values());
    }

    private static void addResolved(Map<String, NormalizedKey> deduped, NormalizedKey key) {
        if (QueryKeys.isWildcard(key) || QueryKeys.isUnresolved(key)) {
            return;
        }
        deduped.putIfAbsent(key.id() + ":" + key.display() + ":" + key.matchMode(), key);
    }

    private Expr resolveCollection(Scope scope, Expr expression, int depth) {
        if (depth >= MAX_DEPTH) {
            return expression;
        }
        final Expr local = locals.resolve(scope, expression, depth + 1);
        if (local != null) {
            return local;
        }
        final Expr reference = locals.resolver().resolveReference(expression);
        return reference != null ? reference : expression;
    }

    private List<Expr> fromEntry(Scope scope, Expr expression, int depth) {
        if (depth >= MAX_DEPTH) {
            return List.of();
        }
        final Expr resolved = resolveCollection(scope, expression, depth + 1);
        if (resolved instanceof Expr.Conditional c) {
            return concat(fromEntry(scope, c.consequent(), depth + 1), fromEntry(scope, c.alternate(), depth + 1));
        }
        if (resolved instanceof Expr.Logical l) {
            if ("&&".equals(l.operator())) {
                return fromEntry(scope, l.right(), depth + 1);
            }
            return concat(fromEntry(scope, l.left(), depth + 1), fromEntry(scope, l.right(), depth + 1));
        }
        if (resolved instanceof Expr.ObjectLit object) {
            final Expr queryKey = QueryKeyNormalizer.findProperty(object, "queryKey");
            if (queryKey != null) {
                return List.of(queryKey);
            }
            final Expr queries = QueryKeyNormalizer.findProperty(object, "queries");
            return queries != null ? fromCollection(scope, queries, depth + 1) : List.of();
        }
        if (resolved instanceof Expr.ArrayLit) {
            return List.of(resolved);
        }
        if (resolved instanceof Expr.Call call && !call.optional()) {
            if (isQueryOptionsCall(call.callee())) {
                final Expr options = QueryKeyNormalizer.firstArgument(call);
                return options != null ? fromEntry(scope, options, depth + 1) : List.of();
            }
            return fromCollection(scope, call, depth + 1);
        }
        return List.of();
    }

    private List<Expr> fromCollection(Scope scope, Expr expression, int depth) {
        if (depth >= MAX_DEPTH) {
            return List.of();
        }
        final Expr resolved = resolveCollection(scope, expression, depth + 1);
        if (resolved instanceof Expr.Conditional c) {
            return concat(fromCollection(scope, c.consequent(), depth + 1), fromCollection(scope, c.alternate(), depth + 1));
        }
        if (resolved instanceof Expr.Logical l) {
            if ("&&".equals(l.operator())) {
                return fromCollection(scope, l.right(), depth + 1);
            }
            return concat(fromCollection(scope, l.left(), depth + 1), fromCollection(scope, l.right(), depth + 1));
        }
        if (resolved instanceof Expr.Call call && !call.optional()) {
            final List<Expr> fromCall = fromCollectionCall(scope, call, depth);
            if (fromCall != null) {
                return fromCall;
            }
        }
        if (resolved instanceof Expr.ArrayLit array) {
            final List<Expr> out = new ArrayList<>();
            for (Expr element : array.elements()) {
                if (element instanceof Expr.Hole) {
                    continue;
                }
                if (element instanceof Expr.Spread spread) {
                    out.addAll(fromCollection(scope, spread.argument(), depth + 1));
                } else {
                    out.addAll(fromEntry(scope, element, depth + 1));
                }
            }
            return out;
        }
        return fromEntry(scope, resolved, depth + 1);
    }

    /** Null when the call is not a recognized list method and should be read as a single entry. */
    private List<Expr> fromCollectionCall(Scope scope, Expr.Call call, int depth) {
        if (!(call.callee() instanceof Expr.Member member) || member.propertyName() == null) {
            return fromEntry(scope, call, depth + 1);
        }
        final String method = member.propertyName();
        if ("map".equals(method) || "flatMap".equals(method)) {
            final Expr mapper = QueryKeyNormalizer.firstArgument(call);
            final Expr mapped = mapper != null ? mapperReturn(scope, mapper, depth + 1) : null;
            if (mapped == null) {
                return fromCollection(scope, member.object(), depth + 1);
            }
            return "flatMap".equals(method) ? fromCollection(scope, mapped, depth + 1) : fromEntry(scope, mapped, depth + 1);
        }
        if (PASSTHROUGH_METHODS.contains(method)) {
            return fromCollection(scope, member.object(), depth + 1);
        }
        if ("concat".equals(method)) {
            final List<Expr> combined = new ArrayList<>(fromCollection(scope, member.object(), depth + 1));
            for (Expr arg : call.arguments()) {
                if (!(arg instanceof Expr.Spread)) {
                    combined.addAll(fromCollection(scope, arg, depth + 1));
                }
            }
            return combined;
        }
        return null;
    }

    private Expr mapperReturn(Scope scope, Expr mapper, int depth) {
        if (depth >= MAX_DEPTH) {
            return null;
        }
        if (mapper instanceof Expr.FunctionExpr fn) {
            return FunctionReturns.extract(fn);
        }
        if (!(mapper instanceof Expr.Ident) && !(mapper instanceof Expr.Member)) {
            return null;
        }
        return resolveCollection(scope, mapper, depth + 1) instanceof Expr.FunctionExpr fn
                ? FunctionReturns.extract(fn)
                : null;
    }

    private List<Candidate> candidates(Scope scope, Expr expression, int depth) {
        if (depth >= MAX_DEPTH) {
            return List.of();
        }
        final Expr resolved = resolveCollection(scope, expression, depth + 1);
        if (resolved instanceof Expr.Conditional c) {
            return concat(candidates(scope, c.consequent(), depth + 1), candidates(scope, c.alternate(), depth + 1));
        }
        if (resolved instanceof Expr.Logical l) {
            if ("&&".equals(l.operator())) {
                return candidates(scope, l.right(), depth + 1);
            }
            return concat(candidates(scope, l.left(), depth + 1), candidates(scope, l.right(), depth + 1));
        }
        if (resolved instanceof Expr.ObjectLit object) {
            final Expr queries = QueryKeyNormalizer.findProperty(object, "queries");
            return queries != null ? candidates(scope, queries, depth + 1) : List.of();
        }
        if (resolved instanceof Expr.ArrayLit array) {
            final List<Candidate> out = new ArrayList<>();
            for (Expr element : array.elements()) {
                if (!(element instanceof Expr.Spread) && !(element instanceof Expr.Hole)) {
                    out.addAll(candidates(scope, element, depth + 1));
                }
            }
            return out;
        }
        if (!(resolved instanceof Expr.Call call) || call.optional()
                || !(call.callee() instanceof Expr.Member member) || member.propertyName() == null) {
            return List.of();
        }

        final String method = member.propertyName();
        if ("map".equals(method) || "flatMap".equals(method)) {
            final Expr mapper = QueryKeyNormalizer.firstArgument(call);
            if (!(mapper instanceof Expr.FunctionExpr fn) || fn.params().isEmpty()
                    || !(fn.params().get(0) instanceof Pattern.Binding param)) {
                return List.of();
            }
            final Expr mapped = FunctionReturns.extract(fn);
            if (mapped == null) {
                return List.of();
            }
            final List<Expr> templates = "flatMap".equals(method)
                    ? fromCollection(scope, mapped, depth + 1)
                    : fromEntry(scope, mapped, depth + 1);
            final List<Candidate> out = new ArrayList<>(templates.size());
            for (Expr template : templates) {
                out.add(new Candidate(member.object(), param.name(), template));
            }
            return out;
        }
        if (PASSTHROUGH_METHODS.contains(method)) {
            return candidates(scope, member.object(), depth + 1);
        }
        if ("concat".equals(method)) {
            final List<Candidate> out = new ArrayList<>(candidates(scope, member.object(), depth + 1));
            for (Expr arg : call.arguments()) {
                if (!(arg instanceof Expr.Spread)) {
                    out.addAll(candidates(scope, arg, depth + 1));
                }
            }
            return out;
        }
        return List.of();
    }

    private static boolean isQueryOptionsCall(Expr callee) {
        final String name = QueryKeyNormalizer.calleeName(callee);
        return "queryOptions".equals(name) || "infiniteQueryOptions".equals(name);
    }

    private static <T> List<T> concat(List<T> a, List<T> b) {
        final List<T> out = new ArrayList<>(a);
        out.addAll(b);
        return out;
    }
}
