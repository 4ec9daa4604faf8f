package ai.querygraph.key;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import ai.querygraph.ast.Expr;
import ai.querygraph.ast.Substitution;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.model.Resolution;
import ai.querygraph.resolve.QueryKeyResolver;
import ai.querygraph.resolve.SymbolReferenceResolver;
import ai.querygraph.symbols.FunctionReturns;

/**
 * Folds an expression into a canonical {@link NormalizedKey}.
 * <p>
 * Every element becomes a {@link Segment}; certainty is static only when every part of the
 * element was determined without running code. Object literals without spread or computed
 * keys render with their keys sorted, so key order does not change the id.
 * <p>
 * The resolver is optional: without one, only literal structure is normalized.
 */
public final class QueryKeyNormalizer {

    public static final int MAX_DEPTH = 25;

    private static final Set<String> COLLECTION_TRANSFORM_METHODS = Set.of(
            "join", "sort", "slice", "map", "filter", "flat", "flatMap", "concat", "reverse", "toSorted");

    private static final Pattern QUERY_KEY_LIKE_NAME = Pattern.compile("^query.?keys?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUERY_KEY_MARKER = Pattern.compile("^\\$querykeys?$", Pattern.CASE_INSENSITIVE);

    private final QueryKeyResolver resolver;

    public QueryKeyNormalizer(QueryKeyResolver resolver) {
        this.resolver = resolver;
    }

    public QueryKeyResolver resolver() {
        return resolver;
    }

    // ---------------------------------------------------------------------
    // keys

    public NormalizedKey normalize(Expr node) {
        return normalize(node, null, false);
    }

    /**
     * @param defaultMode       match mode to report; null picks prefix for arrays and exact otherwise
     * @param wildcardIfMissing a missing key means "every cached query" rather than "unknown"
     */
    public NormalizedKey normalize(Expr node, MatchMode defaultMode, boolean wildcardIfMissing) {
        if (node == null) {
            if (wildcardIfMissing) {
                return QueryKeys.allQueryCache(Resolution.DYNAMIC, QueryKeys.ALL_QUERY_CACHE_SEGMENT, MatchMode.ALL);
            }
            return QueryKeys.unknown(defaultMode != null ? defaultMode : MatchMode.UNKNOWN);
        }

        final Expr resolved = orSelf(resolveKeyExpression(node, 0), node);

        final Expr embedded = embeddedQueryKey(resolved);
        if (embedded != null) {
            return normalize(embedded, defaultMode, wildcardIfMissing);
        }

        if (resolved instanceof Expr.ArrayLit array) {
            final List<Segment> segments = new ArrayList<>();
            for (Expr element : array.elements()) {
                segments.addAll(segmentsFromArrayElement(element, 0));
            }
            return QueryKeys.fromSegments(segments, defaultMode != null ? defaultMode : MatchMode.PREFIX);
        }

        final Segment segment = normalizeSegment(segment(resolved, 0));
        return QueryKeys.fromSingle(segment, defaultMode != null ? defaultMode : MatchMode.EXACT);
    }

    /** {@code [{ queryKey: k }]} as written by key helper wrappers stands for {@code k}. */
    private static Expr embeddedQueryKey(Expr resolved) {
        if (!(resolved instanceof Expr.ArrayLit array) || array.elements().isEmpty()) {
            return null;
        }
        if (array.elements().get(0) instanceof Expr.ObjectLit object
                && object.properties().size() == 1
                && object.properties().get(0) instanceof Expr.Property p
                && "queryKey".equals(p.staticKey())) {
            return p.value();
        }
        return null;
    }

    public Segment segmentOf(Expr node) {
        return normalizeSegment(segment(node, 0));
    }

    /** Maps placeholder renderings to the {@code UNRESOLVED} segment. */
    public static Segment normalizeSegment(Segment segment) {
        final String text = segment.text();
        if (text.isEmpty() || "...spread".equals(text) || "expr".equals(text) || "call(expr)".equals(text)
                || QUERY_KEY_MARKER.matcher(text).matches()) {
            return Segment.dynamic(QueryKeys.UNRESOLVED_SEGMENT);
        }
        return segment;
    }

    List<Segment> segmentsFromArrayElement(Expr element, int depth) {
        if (element instanceof Expr.Hole) {
            return List.of(Segment.dynamic(QueryKeys.UNRESOLVED_SEGMENT));
        }
        if (!(element instanceof Expr.Spread spread)) {
            return List.of(normalizeSegment(segment(element, depth + 1)));
        }

        final Expr source = orSelf(resolveKeyExpression(spread.argument(), depth + 1), spread.argument());
        if (source instanceof Expr.ArrayLit array) {
            final List<Segment> expanded = new ArrayList<>();
            for (Expr nested : array.elements()) {
                expanded.addAll(segmentsFromArrayElement(nested, depth + 1));
            }
            return expanded.isEmpty() ? List.of(Segment.dynamic(QueryKeys.UNRESOLVED_SEGMENT)) : expanded;
        }
        return List.of(normalizeSegment(segment(source, depth + 1)));
    }

    // ---------------------------------------------------------------------
    // segments

    Segment segment(Expr node, int depth) {
        if (depth >= MAX_DEPTH) {
            return Segment.dynamic("expr");
        }
        if (node instanceof Expr.Spread) {
            return Segment.dynamic("...spread");
        }
        if (node instanceof Expr.PrivateName p) {
            return Segment.dynamic("#" + p.name());
        }
        if (node instanceof Expr.Ident id) {
            return identifierSegment(id, depth);
        }

        final Expr resolved = resolveWithResolver(node, depth);
        if (resolved != null) {
            return segment(resolved, depth + 1);
        }

        return switch (node.kind()) {
            case STRING -> Segment.of(((Expr.Str) node).value());
            case NUMBER -> Segment.of(((Expr.Num) node).text());
            case BOOLEAN -> Segment.of(String.valueOf(((Expr.Bool) node).value()));
            case BIGINT -> Segment.of(((Expr.BigInt) node).digits());
            case NULL -> Segment.of("null");
            case TEMPLATE -> templateSegment((Expr.Template) node, depth);
            case FUNCTION -> functionSegment((Expr.FunctionExpr) node, depth);
            case MEMBER -> memberSegment((Expr.Member) node, depth);
            case CALL -> callSegment((Expr.Call) node, depth);
            case ARRAY -> arraySegment((Expr.ArrayLit) node, depth);
            case OBJECT -> {
                final Expr.ObjectLit object = (Expr.ObjectLit) node;
                final Expr queryKey = findProperty(object, "queryKey");
                yield queryKey != null ? segment(queryKey, depth + 1) : objectSegment(object, depth + 1);
            }
            case UNARY -> {
                final Expr.Unary unary = (Expr.Unary) node;
                final Segment argument = segment(unary.argument(), depth + 1);
                yield new Segment(unary.operator() + argument.text(), argument.isStatic());
            }
            case LOGICAL -> logicalSegment((Expr.Logical) node, depth);
            case CONDITIONAL -> Segment.dynamic("cond(...)");
            case IDENTIFIER, PRIVATE_NAME, SPREAD, HOLE, NEW, BINARY, UPDATE, ASSIGNMENT, SEQUENCE, AWAIT, CLASS, JSX,
                 OPAQUE -> Segment.dynamic("expr");
        };
    }

    private Segment identifierSegment(Expr.Ident id, int depth) {
        if ("undefined".equals(id.name())) {
            return Segment.of("undefined");
        }
        final String marker = "$" + id.name();
        final Expr resolved = resolver != null ? resolver.resolveReference(id) : null;
        if (resolved == null) {
            return Segment.dynamic(marker);
        }
        if (resolved instanceof Expr.Call call && !call.optional()) {
            // memoized values and method results are runtime values
            if (isMemoLikeCall(call) || call.callee() instanceof Expr.Member) {
                return Segment.dynamic(marker);
            }
            return segment(resolved, depth + 1);
        }
        if (resolved instanceof Expr.Member) {
            return Segment.dynamic(marker);
        }
        return segment(resolved, depth + 1);
    }

    private Expr resolveWithResolver(Expr node, int depth) {
        if (resolver == null || depth >= MAX_DEPTH) {
            return null;
        }
        if (node instanceof Expr.Call call && !call.optional()) {
            final Expr firstArg = firstArgument(call);
            if (firstArg != null && call.arguments().size() == 1
                    && (SymbolReferenceResolver.isIdentityWrapperCall(call.callee())
                    || firstArg instanceof Expr.ObjectLit || firstArg instanceof Expr.ArrayLit)) {
                return firstArg;
            }
            final Expr callResult = resolver.resolveCallResult(call.callee());
            if (callResult != null) {
                return callResult;
            }
            return resolver.resolveReference(call.callee());
        }
        if (node instanceof Expr.Member member && !member.optional()) {
            return resolver.resolveReference(member);
        }
        return null;
    }

    private Segment templateSegment(Expr.Template template, int depth) {
        final StringBuilder text = new StringBuilder();
        boolean isStatic = true;
        for (int i = 0; i < template.quasis().size(); i++) {
            text.append(template.quasis().get(i));
            if (i < template.expressions().size()) {
                final Segment part = segment(template.expressions().get(i), depth + 1);
                text.append("${").append(part.text()).append('}');
                isStatic = isStatic && part.isStatic();
            }
        }
        return new Segment(text.toString(), isStatic);
    }

    private Segment functionSegment(Expr.FunctionExpr function, int depth) {
        final Expr returned = FunctionReturns.extract(function);
        if (returned == null) {
            return Segment.dynamic("expr");
        }
        final Expr resolvedReturn = orSelf(resolveKeyExpression(returned, depth + 1), returned);
        if (resolvedReturn instanceof Expr.ArrayLit array) {
            if (array.elements().isEmpty()) {
                return Segment.dynamic(QueryKeys.UNRESOLVED_SEGMENT);
            }
            final List<Segment> first = segmentsFromArrayElement(array.elements().get(0), depth + 1);
            return first.isEmpty() ? Segment.dynamic(QueryKeys.UNRESOLVED_SEGMENT) : normalizeSegment(first.get(0));
        }
        return segment(resolvedReturn, depth + 1);
    }

    private Segment memberSegment(Expr.Member member, int depth) {
        if (member.optional()) {
            final Segment object = segment(member.object(), depth + 1);
            final Segment property = propertySegment(member, depth + 1);
            if (property == null) {
                return Segment.dynamic(object.text() + "?.?");
            }
            final String text = member.computed()
                    ? object.text() + "?.[" + property.text() + "]"
                    : object.text() + "?." + property.text();
            return new Segment(text, object.isStatic() && property.isStatic());
        }

        final Segment property = propertySegment(member, depth + 1);
        Expr.ObjectLit objectExpression = null;
        if (member.object() instanceof Expr.ObjectLit literal) {
            objectExpression = literal;
        } else if (resolveKeyExpression(member.object(), depth + 1) instanceof Expr.ObjectLit resolvedObject) {
            objectExpression = resolvedObject;
        }
        if (property != null && objectExpression != null) {
            final Expr resolved = resolveObjectProperty(objectExpression, property.text(), depth + 1);
            if (resolved != null) {
                return segment(resolved, depth + 1);
            }
        }

        final Segment object = segment(member.object(), depth + 1);
        if (property == null) {
            return Segment.dynamic(object.text() + ".?");
        }
        return new Segment(object.text() + "." + property.text(), object.isStatic() && property.isStatic());
    }

    private Segment callSegment(Expr.Call call, int depth) {
        if (!call.optional()) {
            final Expr memoReturn = memoLikeCallReturn(call);
            if (memoReturn != null) {
                return segment(memoReturn, depth + 1);
            }
            final Expr resolvedCallee = resolver != null ? resolver.resolveReference(call.callee()) : null;
            if (resolvedCallee != null) {
                if (resolvedCallee instanceof Expr.FunctionExpr fn) {
                    final Expr returned = FunctionReturns.extract(fn);
                    if (returned != null) {
                        return segment(returned, depth + 1);
                    }
                }
                final Segment value = segment(resolvedCallee, depth + 1);
                if (!"expr".equals(value.text())) {
                    return value;
                }
            }
        }

        if (call.callee() instanceof Expr.Ident id) {
            return Segment.dynamic("call(" + id.name() + ")");
        }
        if (!(call.callee() instanceof Expr.Member callee)) {
            return Segment.dynamic("call(expr)");
        }

        final Segment object = segment(callee.object(), depth + 1);
        final Segment property = propertySegment(callee, depth + 1);
        if (property != null && COLLECTION_TRANSFORM_METHODS.contains(property.text())) {
            return object;
        }
        final Segment args = argumentsSegment(call.arguments(), depth + 1);
        final String propertyText = property != null ? property.text() : "?";
        final String access = call.optional() && callee.optional() ? "?." : ".";
        final String target = callee.computed()
                ? object.text() + (access.equals("?.") ? "?.[" : "[") + propertyText + "]"
                : object.text() + access + propertyText;
        return new Segment(target + "(" + args.text() + ")",
                object.isStatic() && property != null && property.isStatic() && args.isStatic());
    }

    private Segment argumentsSegment(List<Expr> arguments, int depth) {
        final List<String> texts = new ArrayList<>();
        boolean isStatic = true;
        for (Expr argument : arguments) {
            final Segment part;
            if (argument instanceof Expr.Spread spread) {
                final Segment inner = normalizeSegment(segment(spread.argument(), depth + 1));
                part = new Segment("..." + inner.text(), inner.isStatic());
            } else {
                part = normalizeSegment(segment(argument, depth + 1));
            }
            texts.add(part.text());
            isStatic = isStatic && part.isStatic();
        }
        return new Segment(String.join(", ", texts), isStatic);
    }

    private Segment arraySegment(Expr.ArrayLit array, int depth) {
        final List<String> texts = new ArrayList<>();
        boolean isStatic = true;
        for (Expr element : array.elements()) {
            final Segment part = element instanceof Expr.Hole ? Segment.of("undefined") : segment(element, depth + 1);
            texts.add(part.text());
            isStatic = isStatic && part.isStatic();
        }
        return new Segment("[" + String.join(", ", texts) + "]", isStatic);
    }

    private Segment logicalSegment(Expr.Logical logical, int depth) {
        final Segment left = normalizeSegment(segment(logical.left(), depth + 1));
        final Segment right = normalizeSegment(segment(logical.right(), depth + 1));
        final boolean fallback = "||".equals(logical.operator()) || "??".equals(logical.operator());
        if (fallback && (isEmptyFallback(logical.right()) || QueryKeys.UNRESOLVED_SEGMENT.equals(right.text()))) {
            return left;
        }
        return new Segment(left.text() + " " + logical.operator() + " " + right.text(),
                left.isStatic() && right.isStatic());
    }

    private static boolean isEmptyFallback(Expr node) {
        return switch (node.kind()) {
            case STRING -> ((Expr.Str) node).value().isEmpty();
            case TEMPLATE -> {
                final Expr.Template t = (Expr.Template) node;
                yield t.expressions().isEmpty() && t.quasis().size() == 1 && t.quasis().get(0).isEmpty();
            }
            case OBJECT -> ((Expr.ObjectLit) node).properties().isEmpty();
            case ARRAY -> ((Expr.ArrayLit) node).elements().isEmpty();
            case NULL -> true;
            case IDENTIFIER -> "undefined".equals(((Expr.Ident) node).name());
            default -> false;
        };
    }

    // ---------------------------------------------------------------------
    // objects

    private Segment objectSegment(Expr.ObjectLit object, int depth) {
        final List<String> entries = new ArrayList<>();
        final List<Map.Entry<String, Segment>> sortable = new ArrayList<>();
        boolean isStatic = true;
        boolean canonical = true;

        for (Expr.Prop prop : object.properties()) {
            if (prop instanceof Expr.SpreadProp spread) {
                canonical = false;
                final Expr source = orSelf(resolveKeyExpression(spread.argument(), depth + 1), spread.argument());
                if (source instanceof Expr.ObjectLit nested) {
                    final Segment nestedSegment = objectSegment(nested, depth + 1);
                    final String text = nestedSegment.text().trim();
                    if (text.startsWith("{") && text.endsWith("}")) {
                        final String inner = text.substring(1, text.length() - 1).trim();
                        if (!inner.isEmpty()) {
                            entries.add(inner);
                        }
                    } else {
                        entries.add("..." + nestedSegment.text());
                    }
                    isStatic = isStatic && nestedSegment.isStatic();
                    continue;
                }
                final Segment spreadSegment = normalizeSegment(segment(source, depth + 1));
                entries.add("..." + spreadSegment.text());
                isStatic = false;
            } else if (prop instanceof Expr.Property property) {
                if (property.computed()) {
                    canonical = false;
                }
                final Segment key = keySegment(property, depth + 1);
                final Segment value = normalizeSegment(segment(property.value(), depth + 1));
                final String keyText = property.computed() ? "[" + key.text() + "]" : key.text();
                entries.add(keyText + ": " + value.text());
                sortable.add(Map.entry(keyText, value));
                isStatic = isStatic && key.isStatic() && value.isStatic();
            } else {
                canonical = false;
                entries.add("[method]");
                isStatic = false;
            }
        }

        if (entries.isEmpty()) {
            return Segment.of("{}");
        }
        if (!canonical) {
            return new Segment("{" + String.join(", ", entries) + "}", isStatic);
        }

        // later duplicates win; keys whose value is a known undefined are dropped
        final Map<String, Segment> byKey = new LinkedHashMap<>();
        for (Map.Entry<String, Segment> entry : sortable) {
            if (entry.getValue().isStatic() && "undefined".equals(entry.getValue().text())) {
                byKey.remove(entry.getKey());
            } else {
                byKey.put(entry.getKey(), entry.getValue());
            }
        }
        final List<String> sorted = new ArrayList<>();
        byKey.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> sorted.add(e.getKey() + ": " + e.getValue().text()));
        return new Segment("{" + String.join(", ", sorted) + "}", isStatic);
    }

    private Segment keySegment(Expr.Property property, int depth) {
        final Expr key = property.key();
        if (!property.computed() && key instanceof Expr.Ident id) {
            return Segment.of(id.name());
        }
        if (key instanceof Expr.BigInt big) {
            return Segment.of(big.digits());
        }
        return normalizeSegment(segment(key, depth + 1));
    }

    /** Static name of a member property; computed properties are evaluated. Null for private names. */
    private Segment propertySegment(Expr.Member member, int depth) {
        final Expr property = member.property();
        if (!member.computed() && property instanceof Expr.Ident id) {
            return Segment.of(id.name());
        }
        if (property instanceof Expr.Str s) {
            return Segment.of(s.value());
        }
        if (property instanceof Expr.Num n) {
            return Segment.of(n.text());
        }
        if (property instanceof Expr.PrivateName) {
            return null;
        }
        return segment(property, depth + 1);
    }

    /** Value of the last property named {@code name}, looking through resolvable spreads. */
    Expr resolveObjectProperty(Expr.ObjectLit object, String name, int depth) {
        if (depth >= MAX_DEPTH) {
            return null;
        }
        final List<Expr.Prop> properties = object.properties();
        for (int i = properties.size() - 1; i >= 0; i--) {
            final Expr.Prop prop = properties.get(i);
            if (prop instanceof Expr.Property property) {
                final String key = property.computed()
                        ? segment(property.key(), depth + 1).text()
                        : property.staticKey();
                if (name.equals(key)) {
                    return property.value();
                }
            } else if (prop instanceof Expr.SpreadProp spread) {
                final Expr source = orSelf(resolveKeyExpression(spread.argument(), depth + 1), spread.argument());
                if (source instanceof Expr.ObjectLit nested) {
                    final Expr found = resolveObjectProperty(nested, name, depth + 1);
                    if (found != null) {
                        return found;
                    }
                }
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // key expression resolution

    /** Follows references, factory calls and {@code queryKey} properties towards the key literal. */
    public Expr resolveKeyExpression(Expr node) {
        return orSelf(resolveKeyExpression(node, 0), node);
    }

    Expr resolveKeyExpression(Expr node, int depth) {
        if (node == null || depth >= MAX_DEPTH) {
            return null;
        }

        if (node instanceof Expr.ObjectLit object) {
            final Expr queryKey = findProperty(object, "queryKey");
            if (queryKey != null) {
                return orSelf(resolveKeyExpression(queryKey, depth + 1), queryKey);
            }
            return object;
        }

        if (node instanceof Expr.Call call && !call.optional()) {
            return resolveCallKey(call, depth);
        }

        final boolean plainMember = node instanceof Expr.Member m && !m.optional();
        if (node instanceof Expr.Ident || plainMember) {
            final Expr resolved = resolver != null ? resolver.resolveReference(node) : null;
            if (resolved != null) {
                return orSelf(resolveKeyExpression(resolved, depth + 1), resolved);
            }
        }

        if (plainMember) {
            final Expr.Member member = (Expr.Member) node;
            final Segment property = propertySegment(member, depth + 1);
            if (property == null) {
                return member;
            }
            final Expr object = member.object() instanceof Expr.ObjectLit
                    ? member.object()
                    : resolveKeyExpression(member.object(), depth + 1);
            if (object instanceof Expr.ObjectLit literal) {
                final Expr resolved = resolveObjectProperty(literal, property.text(), depth + 1);
                if (resolved != null) {
                    return orSelf(resolveKeyExpression(resolved, depth + 1), resolved);
                }
            }
        }
        return node;
    }

    private Expr resolveCallKey(Expr.Call call, int depth) {
        final Expr firstArg = firstArgument(call);
        final boolean single = firstArg != null && call.arguments().size() == 1;
        final Expr resolvedFirstArg = single ? orSelf(resolveKeyExpression(firstArg, depth + 1), firstArg) : null;

        if (single) {
            if (resolvedFirstArg instanceof Expr.ObjectLit options) {
                final Expr queryKey = findProperty(options, "queryKey");
                if (queryKey != null) {
                    return orSelf(resolveKeyExpression(queryKey, depth + 1), queryKey);
                }
            }
            if (SymbolReferenceResolver.isIdentityWrapperCall(call.callee())) {
                return orSelf(resolveKeyExpression(resolvedFirstArg, depth + 1), resolvedFirstArg);
            }
        }

        final Expr resolvedCall = resolver != null ? resolver.resolveCallResult(call.callee()) : null;
        if (resolvedCall != null) {
            final Expr hinted = applyCallArgumentHints(call, resolvedCall, depth + 1);
            return orSelf(resolveKeyExpression(hinted, depth + 1), hinted);
        }

        if (resolvedFirstArg instanceof Expr.ObjectLit || resolvedFirstArg instanceof Expr.ArrayLit) {
            return resolvedFirstArg;
        }
        return call;
    }

    /**
     * Carries call-site information into a factory's returned expression: an object argument's
     * properties replace same-named identifiers, and a {@code queryKey} identifier becomes the first argument.
     */
    Expr applyCallArgumentHints(Expr.Call call, Expr resolvedCall, int depth) {
        final Expr firstArg = firstArgument(call);
        if (firstArg == null) {
            return resolvedCall;
        }

        final String calleeName = calleeName(call.callee());
        if (resolvedCall instanceof Expr.Ident id && QUERY_KEY_LIKE_NAME.matcher(id.name()).matches()
                && calleeName != null && QUERY_KEY_LIKE_NAME.matcher(calleeName).matches()) {
            return orSelf(resolveKeyExpression(firstArg, depth + 1), firstArg);
        }

        final Expr resolvedFirstArg = orSelf(resolveKeyExpression(firstArg, depth + 1), firstArg);
        if (resolvedFirstArg instanceof Expr.ObjectLit options) {
            final Map<String, Expr> substitutions = new LinkedHashMap<>();
            collectObjectSubstitutions(options, depth + 1, substitutions);
            Expr hinted = resolvedCall;
            for (Map.Entry<String, Expr> e : substitutions.entrySet()) {
                if (Substitution.containsIdentifier(hinted, e.getKey())) {
                    hinted = Substitution.replaceIdentifier(hinted, e.getKey(), e.getValue());
                }
            }
            if (hinted != resolvedCall) {
                return hinted;
            }
        }

        if (!Substitution.containsIdentifier(resolvedCall, "queryKey")) {
            return resolvedCall;
        }
        return Substitution.replaceIdentifier(resolvedCall, "queryKey", firstArg);
    }

    private void collectObjectSubstitutions(Expr.ObjectLit object, int depth, Map<String, Expr> target) {
        if (depth >= MAX_DEPTH) {
            return;
        }
        for (Expr.Prop prop : object.properties()) {
            if (prop instanceof Expr.Property property) {
                final String key = property.computed()
                        ? segment(property.key(), depth + 1).text()
                        : property.staticKey();
                if (key != null) {
                    target.put(key, property.value());
                }
            } else if (prop instanceof Expr.SpreadProp spread) {
                final Expr source = orSelf(resolveKeyExpression(spread.argument(), depth + 1), spread.argument());
                if (source instanceof Expr.ObjectLit nested) {
                    collectObjectSubstitutions(nested, depth + 1, target);
                }
            }
        }
    }

    /** The options object passed to a mutation, followed through references and factory calls. */
    public Expr.ObjectLit resolveOptionsObject(Expr node) {
        return resolveOptionsObject(node, 0);
    }

    private Expr.ObjectLit resolveOptionsObject(Expr node, int depth) {
        if (node == null || depth >= MAX_DEPTH) {
            return null;
        }
        if (node instanceof Expr.ObjectLit object) {
            return object;
        }
        if (node instanceof Expr.Call call && !call.optional()) {
            final Expr firstArg = firstArgument(call);
            if (firstArg != null && call.arguments().size() == 1
                    && SymbolReferenceResolver.isIdentityWrapperCall(call.callee())) {
                return resolveOptionsObject(firstArg, depth + 1);
            }
            final Expr resolvedCall = resolver != null ? resolver.resolveCallResult(call.callee()) : null;
            if (resolvedCall != null) {
                return resolveOptionsObject(applyCallArgumentHints(call, resolvedCall, depth + 1), depth + 1);
            }
            return null;
        }
        final boolean plainMember = node instanceof Expr.Member m && !m.optional();
        if ((node instanceof Expr.Ident || plainMember) && resolver != null) {
            final Expr resolved = resolver.resolveReference(node);
            if (resolved != null) {
                return resolveOptionsObject(resolved, depth + 1);
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // helpers

    /** First property named {@code name} with an identifier or string key. */
    public static Expr findProperty(Expr.ObjectLit object, String name) {
        for (Expr.Prop prop : object.properties()) {
            if (prop instanceof Expr.Property p && !p.computed()
                    && (p.key() instanceof Expr.Ident || p.key() instanceof Expr.Str)
                    && name.equals(p.staticKey())) {
                return p.value();
            }
        }
        return null;
    }

    /** Boolean literal value of the first property named {@code name}, or null. */
    public static Boolean readBoolean(Expr.ObjectLit object, String name) {
        return findProperty(object, name) instanceof Expr.Bool b ? b.value() : null;
    }

    public static Expr firstArgument(Expr.Call call) {
        final Expr first = call.firstArgument();
        return first instanceof Expr.Spread ? null : first;
    }

    /** Identifier callee name, or the property name of a non-computed member callee. */
    public static String calleeName(Expr callee) {
        if (callee instanceof Expr.Ident id) {
            return id.name();
        }
        if (callee instanceof Expr.Member member) {
            return member.propertyName();
        }
        return null;
    }

    private static boolean isMemoLikeCall(Expr.Call call) {
        final String name = calleeName(call.callee());
        return "useMemo".equals(name) || "useCallback".equals(name);
    }

    private static Expr memoLikeCallReturn(Expr.Call call) {
        if (!isMemoLikeCall(call)) {
            return null;
        }
        final Expr first = firstArgument(call);
        if (first instanceof Expr.FunctionExpr fn) {
            return FunctionReturns.extract(fn);
        }
        return first;
    }

    static Expr orSelf(Expr resolved, Expr self) {
        return resolved != null ? resolved : self;
    }
}
