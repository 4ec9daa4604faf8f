package ai.querygraph.classify;

import java.util.List;
import java.util.Objects;

import ai.querygraph.ast.Expr;
import ai.querygraph.ast.TypeNode;
import ai.querygraph.model.Resolution;

/**
 * Decides whether a callee, constructor, type or object refers to the query library,
 * and with which certainty. Every method returns null for "not recognized".
 */
final class ClientCertainty {

    private static final int MAX_TYPE_DEPTH = 8;

    /**
     * A recognized hook call.
     *
     * @param operation name as written at the call site
     * @param hook      library hook it stands for
     */
    record HookCall(String operation, String hook, Resolution resolution) {
    }

    private final ParseContext context;

    ClientCertainty(ParseContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    HookCall hookCall(Expr callee) {
        if (callee instanceof Expr.Ident id) {
            final Resolution certainty = context.queryHooks.get(id.name());
            if (certainty == null) {
                return null;
            }
            return new HookCall(id.name(), context.queryHookKinds.getOrDefault(id.name(), id.name()), certainty);
        }
        if (!(callee instanceof Expr.Member member) || !(member.object() instanceof Expr.Ident namespace)) {
            return null;
        }
        final String property = member.propertyName();
        if (property == null || !QueryApi.QUERY_HOOKS.contains(property)) {
            return null;
        }
        final Resolution certainty = context.queryNamespaces.get(namespace.name());
        return certainty != null ? new HookCall(property, property, certainty) : null;
    }

    /** {@code useQueryClient()} or {@code ns.useQueryClient()}. */
    Resolution useQueryClientCall(Expr callee) {
        return namespacedOrLocal(callee, "useQueryClient", context.useQueryClientNames.get(localName(callee)));
    }

    /** {@code new QueryClient()} or {@code new ns.QueryClient()}. */
    Resolution constructorCall(Expr callee) {
        return namespacedOrLocal(callee, "QueryClient", context.queryClientCtorNames.get(localName(callee)));
    }

    private Resolution namespacedOrLocal(Expr callee, String exportedName, Resolution local) {
        if (callee instanceof Expr.Ident) {
            return local;
        }
        if (callee instanceof Expr.Member member && member.object() instanceof Expr.Ident namespace
                && exportedName.equals(member.propertyName())) {
            return context.queryNamespaces.get(namespace.name());
        }
        return null;
    }

    private static String localName(Expr callee) {
        return callee instanceof Expr.Ident id ? id.name() : "";
    }

    /** Certainty that a declared type names the client: {@code QueryClient}, {@code ns.QueryClient}, unions. */
    Resolution typeAnnotation(TypeNode type) {
        return typeAnnotation(type, 0);
    }

    private Resolution typeAnnotation(TypeNode type, int depth) {
        if (type == null || depth > MAX_TYPE_DEPTH) {
            return null;
        }
        if (type instanceof TypeNode.Ref ref) {
            if (ref.name().size() == 1) {
                return context.queryClientTypeNames.get(ref.name().get(0));
            }
            if (ref.name().size() == 2 && "QueryClient".equals(ref.name().get(1))) {
                return context.queryNamespaces.get(ref.name().get(0));
            }
            return null;
        }
        final List<TypeNode> members;
        if (type instanceof TypeNode.Union union) {
            members = union.types();
        } else if (type instanceof TypeNode.Intersection intersection) {
            members = intersection.types();
        } else {
            return null;
        }
        for (TypeNode member : members) {
            final Resolution certainty = typeAnnotation(member, depth + 1);
            if (certainty != null) {
                return certainty;
            }
        }
        return null;
    }

    /** Certainty that {@code x} or {@code a.x} is a tracked client variable. */
    Resolution clientObject(Expr node) {
        final String leaf = leafName(node);
        return leaf != null ? context.queryClientVars.get(leaf) : null;
    }

    static String leafName(Expr node) {
        if (node instanceof Expr.Ident id) {
            return id.name();
        }
        if (node instanceof Expr.Member member) {
            return member.propertyName();
        }
        return null;
    }
}
