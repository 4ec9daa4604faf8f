package ai.querygraph.resolve;

import ai.querygraph.ast.Expr;

/**
 * Static value lookup used while normalizing keys. Both methods return null when the
 * value cannot be determined; they never throw for unresolvable code.
 */
public interface QueryKeyResolver {

    /** The expression an identifier or member chain refers to. */
    Expr resolveReference(Expr expression);

    /** The expression a call to {@code callee} returns. */
    Expr resolveCallResult(Expr callee);
}
