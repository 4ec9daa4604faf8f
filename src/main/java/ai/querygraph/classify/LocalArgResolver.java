package ai.querygraph.classify;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import ai.querygraph.ast.Binding;
import ai.querygraph.ast.Expr;
import ai.querygraph.ast.Scope;
import ai.querygraph.ast.Substitution;
import ai.querygraph.ast.TypeNode;
import ai.querygraph.key.QueryKeyNormalizer;
import ai.querygraph.resolve.QueryKeyResolver;
import ai.querygraph.resolve.SymbolReferenceResolver;
import ai.querygraph.symbols.FunctionReturns;

/**
 * Resolves call arguments through the bindings visible at the call site.
 * <p>
 * The symbol index only knows module-level names; this class adds what the enclosing function
 * scopes say: local constants, local helper functions (inlined with their arguments),
 * parameters typed as {@code ReturnType<typeof factory>}, and {@code xQueryKey} properties
 * that name a key factory.
 */
final class LocalArgResolver {

    static final int MAX_DEPTH = 12;

    private static final Pattern QUERY_KEY_PROPERTY = Pattern.compile("^querykeys?$", Pattern.CASE_INSENSITIVE);
    private static final String QUERY_KEY_SUFFIX = "QueryKey";

    private final QueryKeyResolver resolver;

    LocalArgResolver(QueryKeyResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    QueryKeyResolver resolver() {
        return resolver;
    }

    /** Resolved value of {@code expression} as seen from {@code scope}, or null. */
    Expr resolve(Scope scope, Expr expression) {
        return resolve(scope, expression, 0, new HashSet<>());
    }

    Expr resolve(Scope scope, Expr expression, int depth) {
        return resolve(scope, expression, depth, new HashSet<>());
    }

    /**
     * Call arguments with the first one resolved locally. When the first argument is an options
     * object only its {@code queryKey} property is replaced.
     */
    List<Expr> resolveArguments(Scope scope, List<Expr> args) {
        if (args.isEmpty() || args.get(0) instanceof Expr.Spread) {
            return args;
        }
        final Expr first = args.get(0);
        final Expr resolvedFirst = resolve(scope, first);
        final Expr candidate = resolvedFirst != null ? resolvedFirst : first;

        final Expr replacement;
        if (candidate instanceof Expr.ObjectLit options) {
            replacement = withResolvedQueryKey(scope, options);
        } else if (resolvedFirst != null) {
            replacement = resolvedFirst;
        } else {
            return args;
        }
        final List<Expr> out = new ArrayList<>(args.size());
        out.add(replacement);
        out.addAll(args.subList(1, args.size()));
        return out;
    }

    private Expr.ObjectLit withResolvedQueryKey(Scope scope, Expr.ObjectLit options) {
        final List<Expr.Prop> properties = new ArrayList<>(options.properties().size());
        for (Expr.Prop prop : options.properties()) {
            if (prop instanceof Expr.Property property && "queryKey".equals(property.staticKey())) {
                final Expr resolved = resolve(scope, property.value());
                if (resolved != null) {
                    final boolean shorthand = property.shorthand()
                            && resolved instanceof Expr.Ident id && id.name().equals("queryKey");
                    properties.add(new Expr.Property(property.key(), resolved, property.computed(), shorthand));
                    continue;
                }
            }
            properties.add(prop);
        }
        return new Expr.ObjectLit(properties);
    }

    private Expr resolve(Scope scope, Expr expression, int depth, Set<String> seen) {
        if (expression == null || depth >= MAX_DEPTH) {
            return null;
        }
        if (expression instanceof Expr.Member member) {
            return member.optional() ? null : resolveMember(scope, member, depth, seen);
        }
        if (expression instanceof Expr.Call call) {
            return call.optional() ? null : resolveCall(scope, call, depth, seen);
        }
        if (expression instanceof Expr.Ident id) {
            return resolveIdentifier(scope, id, depth, seen);
        }
        return null;
    }

    private Expr chain(Scope scope, Expr value, int depth, Set<String> seen) {
        final Expr chained = resolve(scope, value, depth + 1, seen);
        return chained != null ? chained : value;
    }

    // ---------------------------------------------------------------------
    // members

    private Expr resolveMember(Scope scope, Expr.Member member, int depth, Set<String> seen) {
        final String property = memberPropertyName(member);
        final Expr object = resolve(scope, member.object(), depth + 1, seen);
        if (object != null) {
            final Expr value = property != null ? memberValue(object, property) : null;
            if (value != null) {
                return chain(scope, value, depth, seen);
            }
        }

        if (property != null) {
            final Expr fromFactory = factoryReturnForProperty(property);
            if (fromFactory != null) {
                return chain(scope, fromFactory, depth, seen);
            }
        }

        final Expr reference = resolver.resolveReference(member);
        return reference != null ? chain(scope, reference, depth, seen) : null;
    }

    private static String memberPropertyName(Expr.Member member) {
        final String name = member.propertyName();
        if (name != null) {
            return name;
        }
        if (member.property() instanceof Expr.Str s) {
            return s.value();
        }
        if (member.property() instanceof Expr.Num n) {
            return n.text();
        }
        return null;
    }

    private static Expr memberValue(Expr object, String property) {
        if (object instanceof Expr.ObjectLit literal) {
            return LocalBindingScanner.lastPropertyValue(literal, property);
        }
        if (!(object instanceof Expr.ArrayLit array)) {
            return null;
        }
        final int index = SymbolReferenceResolver.parseIndex(property);
        if (index < 0 || index >= array.elements().size()) {
            return null;
        }
        final Expr element = array.elements().get(index);
        return element instanceof Expr.Hole || element instanceof Expr.Spread ? null : element;
    }

    /** {@code keys.todoListQueryKey} hints at a factory named {@code createTodoListQueryKey} or {@code todoListQueryKey}. */
    private Expr factoryReturnForProperty(String property) {
        if (!property.endsWith(QUERY_KEY_SUFFIX) || QUERY_KEY_PROPERTY.matcher(property).matches()) {
            return null;
        }
        final String base = property.substring(0, property.length() - QUERY_KEY_SUFFIX.length());
        if (base.isEmpty()) {
            return null;
        }
        final String capitalized = Character.toUpperCase(base.charAt(0)) + base.substring(1);
        for (String candidate : List.of("create" + capitalized + QUERY_KEY_SUFFIX, base + QUERY_KEY_SUFFIX)) {
            final Expr returned = resolver.resolveCallResult(new Expr.Ident(candidate));
            if (returned != null) {
                return returned;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // calls

    private Expr resolveCall(Scope scope, Expr.Call call, int depth, Set<String> seen) {
        final Expr firstArg = QueryKeyNormalizer.firstArgument(call);
        if (isOptionsIdentity(call.callee()) && firstArg != null) {
            return chain(scope, firstArg, depth, seen);
        }

        if (call.callee() instanceof Expr.FunctionExpr inline) {
            final Expr inlined = inline(inline, call);
            if (inlined != null) {
                return chain(scope, inlined, depth, seen);
            }
        }

        boolean inlineReference = true;
        if (call.callee() instanceof Expr.Ident callee) {
            final boolean factoryName = isLikelyKeyFactoryName(callee.name());
            final Binding binding = scope.lookup(callee.name());
            if (!factoryName && binding != null) {
                final Expr.FunctionExpr local = localFunction(binding);
                final Expr inlined = local != null ? inline(local, call) : null;
                if (inlined != null) {
                    return chain(scope, inlined, depth, seen);
                }
            }
            inlineReference = !factoryName && (binding == null || binding.kind() != Binding.Kind.MODULE);
        }

        if (inlineReference && resolver.resolveReference(call.callee()) instanceof Expr.FunctionExpr referenced) {
            final Expr inlined = inline(referenced, call);
            if (inlined != null) {
                return chain(scope, inlined, depth, seen);
            }
        }

        final Expr returned = resolver.resolveCallResult(call.callee());
        return returned != null ? chain(scope, returned, depth, seen) : null;
    }

    private static Expr.FunctionExpr localFunction(Binding binding) {
        if (binding.kind() == Binding.Kind.FUNCTION) {
            return binding.function();
        }
        if (binding.kind() != Binding.Kind.PARAM && binding.init() instanceof Expr.FunctionExpr fn) {
            return fn;
        }
        return null;
    }

    /** Returned expression of {@code function} with identifier parameters replaced by the call's arguments. */
    private static Expr inline(Expr.FunctionExpr function, Expr.Call call) {
        Expr inlined = FunctionReturns.extract(function);
        if (inlined == null) {
            return null;
        }
        for (int i = 0; i < function.params().size() && i < call.arguments().size(); i++) {
            final Expr arg = call.arguments().get(i);
            if (function.params().get(i) instanceof ai.querygraph.ast.Pattern.Binding param
                    && !(arg instanceof Expr.Spread)) {
                inlined = Substitution.replaceIdentifier(inlined, param.name(), arg);
            }
        }
        return inlined;
    }

    /** {@code queryOptions(x)}, {@code infiniteQueryOptions(x)} and {@code Object.freeze(x)} return x. */
    private static boolean isOptionsIdentity(Expr callee) {
        if (callee instanceof Expr.Ident id) {
            return id.name().equals("queryOptions") || id.name().equals("infiniteQueryOptions");
        }
        return callee instanceof Expr.Member member
                && member.object() instanceof Expr.Ident object
                && object.name().equals("Object")
                && "freeze".equals(member.propertyName());
    }

    static boolean isLikelyKeyFactoryName(String name) {
        if (name == null) {
            return false;
        }
        final String lower = name.toLowerCase(Locale.ROOT);
        return lower.contains("querykey") || lower.contains("rqkey");
    }

    // ---------------------------------------------------------------------
    // identifiers

    private Expr resolveIdentifier(Scope scope, Expr.Ident id, int depth, Set<String> seen) {
        if (!seen.add("id:" + id.name())) {
            return null;
        }
        final Binding binding = scope.lookup(id.name());
        if (binding == null) {
            return null;
        }

        if (binding.kind() == Binding.Kind.PARAM) {
            final String factory = returnTypeFactoryName(binding.type());
            final Expr hinted = factory != null ? resolver.resolveCallResult(new Expr.Ident(factory)) : null;
            return hinted != null ? chain(scope, hinted, depth, seen) : null;
        }
        if (binding.kind() == Binding.Kind.MODULE || !binding.constant()) {
            return null;
        }
        if (binding.kind() == Binding.Kind.FUNCTION) {
            final Expr returned = binding.function() != null ? FunctionReturns.extract(binding.function()) : null;
            return returned != null ? chain(scope, returned, depth, seen) : null;
        }
        return binding.init() != null ? chain(scope, binding.init(), depth, seen) : null;
    }

    /** {@code f} in a parameter typed {@code ReturnType<typeof f>}. */
    static String returnTypeFactoryName(TypeNode type) {
        if (!(type instanceof TypeNode.Ref ref) || ref.name().size() != 1 || !"ReturnType".equals(ref.name().get(0))
                || ref.typeArguments().isEmpty()) {
            return null;
        }
        if (ref.typeArguments().get(0) instanceof TypeNode.Query query && !query.name().isEmpty()) {
            return query.name().get(query.name().size() - 1);
        }
        return null;
    }
}
