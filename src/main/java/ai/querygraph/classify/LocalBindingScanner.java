package ai.querygraph.classify;

import java.util.Locale;
import java.util.Objects;

import ai.querygraph.ast.AstVisitor;
import ai.querygraph.ast.AstWalker;
import ai.querygraph.ast.Expr;
import ai.querygraph.ast.Pattern;
import ai.querygraph.ast.SourceFile;
import ai.querygraph.ast.Stmt;
import ai.querygraph.ast.TypeNode;
import ai.querygraph.key.HookKeyInference;
import ai.querygraph.key.QueryKeyNormalizer;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.model.Resolution;
import ai.querygraph.resolve.QueryKeyResolver;

/**
 * Finds local names that hold a query client or a hook result.
 * <p>
 * A client variable is recognized from its declared type, from {@code useQueryClient()},
 * from {@code new QueryClient()}, and from values read out of a React context or a custom
 * hook's returned object. Hook results are remembered so that {@code refetch} calls can be
 * attributed to the key of the hook they came from.
 */
final class LocalBindingScanner implements AstVisitor {

    private static final int MAX_CERTAINTY_DEPTH = 8;
    private static final java.util.regex.Pattern HOOK_LIKE_NAME = java.util.regex.Pattern.compile("^use[A-Z0-9_].*");

    private final ParseContext context;
    private final ClientCertainty certainty;
    private final QueryKeyResolver resolver;
    private final HookKeyInference hookKeys;

    LocalBindingScanner(ParseContext context, QueryKeyResolver resolver, HookKeyInference hookKeys) {
        this.context = Objects.requireNonNull(context, "context");
        this.certainty = new ClientCertainty(context);
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.hookKeys = Objects.requireNonNull(hookKeys, "hookKeys");
    }

    void scan(SourceFile file) {
        AstWalker.walk(file, this);
    }

    @Override
    public void enterFunction(Expr.FunctionExpr function) {
        for (Pattern param : function.params()) {
            trackTypedParam(param);
        }
    }

    @Override
    public void visitDeclarator(Stmt.Declarator declarator, String kind) {
        final Pattern id = declarator.id();
        if (id instanceof Pattern.Binding binding) {
            trackTyped(binding.name(), binding.type());
        }

        final Expr init = declarator.init();
        if (init instanceof Expr.New construction && id instanceof Pattern.Binding binding) {
            final Resolution ctor = certainty.constructorCall(construction.callee());
            if (ctor != null) {
                ParseContext.setCertainty(context.queryClientVars, binding.name(), ctor);
            }
        }
        if (!(init instanceof Expr.Call call) || call.optional()) {
            return;
        }

        final Resolution useClient = certainty.useQueryClientCall(call.callee());
        if (useClient != null && id instanceof Pattern.Binding binding) {
            ParseContext.setCertainty(context.queryClientVars, binding.name(), useClient);
        }
        if (id instanceof Pattern.ObjectPattern pattern) {
            trackDestructuredClient(pattern, call);
        }

        if (certainty.hookCall(call.callee()) == null) {
            return;
        }
        final NormalizedKey hookKey = hookKeys.inferHookKey(call.arguments());
        if (id instanceof Pattern.ObjectPattern pattern) {
            for (Pattern.PatternProperty property : pattern.properties()) {
                if ("refetch".equals(property.key())
                        && property.value() instanceof Pattern.Binding local) {
                    context.refetchFunctions.put(local.name(), hookKey);
                }
            }
        }
        if (id instanceof Pattern.Binding binding) {
            context.refetchObjects.put(binding.name(), hookKey);
        }
    }

    // ---------------------------------------------------------------------
    // declared types

    private void trackTyped(String name, TypeNode type) {
        final Resolution typed = certainty.typeAnnotation(type);
        if (typed != null) {
            ParseContext.setCertainty(context.queryClientVars, name, typed);
        }
    }

    private void trackTypedParam(Pattern param) {
        if (param instanceof Pattern.Binding binding) {
            trackTyped(binding.name(), binding.type());
        } else if (param instanceof Pattern.Defaulted defaulted) {
            if (defaulted.target() instanceof Pattern.Binding binding) {
                trackTyped(binding.name(), binding.type());
            } else if (defaulted.target() instanceof Pattern.ObjectPattern pattern) {
                trackTypedObjectPattern(pattern);
            }
        } else if (param instanceof Pattern.Rest rest
                && rest.argument() instanceof Pattern.Binding binding) {
            trackTyped(binding.name(), binding.type() != null ? binding.type() : rest.type());
        } else if (param instanceof Pattern.ObjectPattern pattern) {
            trackTypedObjectPattern(pattern);
        }
    }

    /** {@code ({ client }: { client: QueryClient })}. */
    private void trackTypedObjectPattern(Pattern.ObjectPattern pattern) {
        if (!(pattern.type() instanceof TypeNode.Literal literal)) {
            return;
        }
        for (TypeNode.Member member : literal.members()) {
            if (member.type() == null) {
                continue;
            }
            final Resolution typed = certainty.typeAnnotation(member.type());
            final String local = typed != null ? localNameForKey(pattern, member.name()) : null;
            if (local != null) {
                ParseContext.setCertainty(context.queryClientVars, local, typed);
            }
        }
    }

    private static String localNameForKey(Pattern.ObjectPattern pattern, String key) {
        for (Pattern.PatternProperty property : pattern.properties()) {
            if (property.rest() || property.key() == null || !property.key().equals(key)) {
                continue;
            }
            return localName(property);
        }
        return null;
    }

    private static String localName(Pattern.PatternProperty property) {
        if (property.value() instanceof Pattern.Binding binding) {
            return binding.name();
        }
        if (property.value() instanceof Pattern.Defaulted defaulted
                && defaulted.target() instanceof Pattern.Binding binding) {
            return binding.name();
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // destructuring from custom hooks and contexts

    /** {@code const { queryClient } = useAppContext()}. */
    private void trackDestructuredClient(Pattern.ObjectPattern pattern, Expr.Call init) {
        final Expr callResult = resolver.resolveCallResult(init.callee());

        for (Pattern.PatternProperty property : pattern.properties()) {
            if (property.rest()) {
                continue;
            }
            final String key = property.key();
            final String local = localName(property);
            if (local == null) {
                continue;
            }

            Resolution found = null;
            if (key != null && callResult instanceof Expr.ObjectLit object) {
                final Expr value = lastPropertyValue(object, key);
                if (value != null) {
                    found = fromExpression(value, 0);
                }
            }
            final boolean clientLike = looksLikeClientName(key) || looksLikeClientName(local);
            if (found == null && clientLike && callResult != null) {
                found = fromExpression(callResult, 0);
            }
            if (found == null && clientLike && isHookLike(init.callee())) {
                found = Resolution.DYNAMIC;
            }
            if (found != null) {
                ParseContext.setCertainty(context.queryClientVars, local, found);
            }
        }
    }

    private Resolution fromExpression(Expr expression, int depth) {
        if (expression == null || depth >= MAX_CERTAINTY_DEPTH) {
            return null;
        }
        if (expression instanceof Expr.Call call) {
            return fromCall(call, depth);
        }
        if (expression instanceof Expr.New construction) {
            return certainty.constructorCall(construction.callee());
        }
        if (expression instanceof Expr.Ident || expression instanceof Expr.Member) {
            final Resolution tracked = certainty.clientObject(expression);
            if (tracked != null) {
                return tracked;
            }
            final Expr resolved = resolver.resolveReference(expression);
            return resolved != null ? fromExpression(resolved, depth + 1) : null;
        }
        if (expression instanceof Expr.Conditional conditional) {
            final Resolution consequent = fromExpression(conditional.consequent(), depth + 1);
            return consequent != null ? consequent : fromExpression(conditional.alternate(), depth + 1);
        }
        if (expression instanceof Expr.Logical logical) {
            final Resolution left = fromExpression(logical.left(), depth + 1);
            return left != null ? left : fromExpression(logical.right(), depth + 1);
        }
        return null;
    }

    private Resolution fromCall(Expr.Call call, int depth) {
        final String name = QueryKeyNormalizer.calleeName(call.callee());
        if ("createContext".equals(name)) {
            final Resolution fromContext = fromCreateContext(call, depth);
            if (fromContext != null) {
                return fromContext;
            }
        }
        if ("useContext".equals(name)) {
            final Expr contextArg = QueryKeyNormalizer.firstArgument(call);
            if (contextArg != null) {
                final Expr resolved = resolver.resolveReference(contextArg);
                final Resolution fromContext = fromExpression(resolved != null ? resolved : contextArg, depth + 1);
                if (fromContext != null) {
                    return fromContext;
                }
            }
        }

        final Resolution hook = certainty.useQueryClientCall(call.callee());
        if (hook != null) {
            return hook;
        }
        final Expr returned = resolver.resolveCallResult(call.callee());
        return returned != null ? fromExpression(returned, depth + 1) : null;
    }

    /** {@code createContext<{ queryClient: QueryClient }>(...)} or a default value holding the client. */
    private Resolution fromCreateContext(Expr.Call call, int depth) {
        final TypeNode typeArgument = call.typeArguments().isEmpty() ? null : call.typeArguments().get(0);
        if (typeArgument instanceof TypeNode.Literal literal) {
            for (TypeNode.Member member : literal.members()) {
                if (member.type() == null || !looksLikeClientName(member.name())) {
                    continue;
                }
                if (typeLooksLikeClient(member.type(), 0)) {
                    return Resolution.STATIC;
                }
                final Resolution typed = certainty.typeAnnotation(member.type());
                if (typed != null) {
                    return typed;
                }
            }
        }
        if (typeLooksLikeClient(typeArgument, 0)) {
            return Resolution.STATIC;
        }

        if (!(QueryKeyNormalizer.firstArgument(call) instanceof Expr.ObjectLit initial)) {
            return null;
        }
        final Expr client = lastPropertyValue(initial, "queryClient");
        return client != null ? fromExpression(client, depth + 1) : null;
    }

    private static boolean typeLooksLikeClient(TypeNode type, int depth) {
        if (type == null || depth >= MAX_CERTAINTY_DEPTH) {
            return false;
        }
        if (type instanceof TypeNode.Ref ref) {
            return looksLikeClientName(ref.simpleName());
        }
        if (type instanceof TypeNode.Union union) {
            return union.types().stream().anyMatch(t -> typeLooksLikeClient(t, depth + 1));
        }
        if (type instanceof TypeNode.Intersection intersection) {
            return intersection.types().stream().anyMatch(t -> typeLooksLikeClient(t, depth + 1));
        }
        return false;
    }

    private static boolean looksLikeClientName(String name) {
        return name != null && name.toLowerCase(Locale.ROOT).equals("queryclient");
    }

    private static boolean isHookLike(Expr callee) {
        final String name = QueryKeyNormalizer.calleeName(callee);
        return name != null && HOOK_LIKE_NAME.matcher(name).matches();
    }

    /** Value of the last property named {@code name}, looking into literal spreads. */
    static Expr lastPropertyValue(Expr.ObjectLit object, String name) {
        for (int i = object.properties().size() - 1; i >= 0; i--) {
            final Expr.Prop prop = object.properties().get(i);
            if (prop instanceof Expr.Property property) {
                if (name.equals(property.staticKey())) {
                    return property.value();
                }
            } else if (prop instanceof Expr.SpreadProp spread && spread.argument() instanceof Expr.ObjectLit nested) {
                final Expr found = lastPropertyValue(nested, name);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }
}
