package ai.querygraph.ast;

import java.util.IdentityHashMap;
import java.util.Map;

/** Lexical scopes of one file, looked up by call or JSX node. */
public final class FileScopes {

    private final Scope root;
    private final Map<Expr, Scope> scopeByNode;
    private final Map<Expr.FunctionExpr, Expr.Call> callbackCalls;

    FileScopes(Scope root, IdentityHashMap<Expr, Scope> scopeByNode,
               IdentityHashMap<Expr.FunctionExpr, Expr.Call> callbackCalls) {
        this.root = root;
        this.scopeByNode = scopeByNode;
        this.callbackCalls = callbackCalls;
    }

    public Scope root() {
        return root;
    }

    /** Scope enclosing a call, {@code new} or JSX node; the module scope for anything else. */
    public Scope scopeOf(Expr node) {
        final Scope scope = scopeByNode.get(node);
        return scope != null ? scope : root;
    }

    /** The call that receives {@code function} as one of its arguments, or null. */
    public Expr.Call callbackCall(Expr.FunctionExpr function) {
        return callbackCalls.get(function);
    }
}
