package ai.querygraph.symbols;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import ai.querygraph.ast.Expr;
import ai.querygraph.ast.Pattern;
import ai.querygraph.ast.Stmt;

/**
 * Finds the expression a function returns without running it.
 */
public final class FunctionReturns {

    private FunctionReturns() {
    }

    /**
     * Concise arrow bodies return their expression. Block bodies return the first reachable
     * {@code return} argument; a returned identifier is chased through the body's own declarations.
     */
    public static Expr extract(Expr.FunctionExpr function) {
        if (function.expressionBody() != null) {
            return function.expressionBody();
        }
        if (function.body() == null) {
            return null;
        }
        final List<Stmt> statements = function.body().body();
        final Expr returned = firstReturn(statements);
        if (!(returned instanceof Expr.Ident id)) {
            return returned;
        }
        final Expr chased = returnedIdentifier(id.name(), statements, new HashSet<>());
        return chased != null ? chased : returned;
    }

    private static Expr firstReturn(List<Stmt> statements) {
        for (Stmt statement : statements) {
            final Expr found = firstReturn(statement);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static Expr firstReturn(Stmt statement) {
        if (statement instanceof Stmt.Return ret) {
            return ret.argument();
        }
        if (statement instanceof Stmt.Block block) {
            return firstReturn(block.body());
        }
        if (statement instanceof Stmt.If ifStmt) {
            final Expr fromConsequent = firstReturn(ifStmt.consequent());
            if (fromConsequent != null) {
                return fromConsequent;
            }
            return ifStmt.alternate() != null ? firstReturn(ifStmt.alternate()) : null;
        }
        if (statement instanceof Stmt.Labeled labeled) {
            return firstReturn(labeled.body());
        }
        if (statement instanceof Stmt.For loop) {
            return firstReturn(loop.body());
        }
        if (statement instanceof Stmt.ForEach loop) {
            return firstReturn(loop.body());
        }
        if (statement instanceof Stmt.While loop) {
            return firstReturn(loop.body());
        }
        if (statement instanceof Stmt.Switch sw) {
            for (Stmt.SwitchCase switchCase : sw.cases()) {
                final Expr fromCase = firstReturn(switchCase.body());
                if (fromCase != null) {
                    return fromCase;
                }
            }
            return null;
        }
        if (statement instanceof Stmt.Try tryStmt) {
            final Expr fromTry = firstReturn(tryStmt.block().body());
            if (fromTry != null) {
                return fromTry;
            }
            if (tryStmt.handler() != null) {
                final Expr fromCatch = firstReturn(tryStmt.handler().body());
                if (fromCatch != null) {
                    return fromCatch;
                }
            }
            return tryStmt.finalizer() != null ? firstReturn(tryStmt.finalizer().body()) : null;
        }
        return null;
    }

    // last declaration of the name wins; identifier aliases are followed
    private static Expr returnedIdentifier(String name, List<Stmt> statements, Set<String> seen) {
        if (!seen.add(name)) {
            return null;
        }
        for (int i = statements.size() - 1; i >= 0; i--) {
            if (!(statements.get(i) instanceof Stmt.VarDecl decl)) {
                continue;
            }
            final List<Stmt.Declarator> declarators = decl.declarations();
            for (int j = declarators.size() - 1; j >= 0; j--) {
                final Stmt.Declarator declarator = declarators.get(j);
                if (!(declarator.id() instanceof Pattern.Binding b) || !b.name().equals(name)) {
                    continue;
                }
                final Expr init = declarator.init();
                if (init == null) {
                    return null;
                }
                if (init instanceof Expr.Ident alias && !alias.name().equals(name)) {
                    final Expr chased = returnedIdentifier(alias.name(), statements, seen);
                    return chased != null ? chased : init;
                }
                return init;
            }
        }
        return null;
    }
}
