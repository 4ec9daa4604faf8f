package ai.querygraph.ast;

import java.util.List;

/** Callbacks for {@link AstWalker}. Every method is optional. */
public interface AstVisitor {

    default void visitStatement(Stmt statement) {
    }

    /** Called before the children of the expression are walked. */
    default void visitExpression(Expr expression) {
    }

    default void visitDeclarator(Stmt.Declarator declarator, String kind) {
    }

    default void enterFunction(Expr.FunctionExpr function) {
    }

    default void enterBlock(List<Stmt> statements) {
    }

    default void enterCatch(Pattern param, List<Stmt> statements) {
    }

    default void enterLoop(Stmt loop) {
    }

    /** Closes the scope opened by the last enter call. */
    default void exitScope() {
    }
}
