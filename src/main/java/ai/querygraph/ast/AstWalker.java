package ai.querygraph.ast;

import java.util.List;
import java.util.Objects;

/**
 * Pre-order, source-order traversal over statements, expressions and patterns.
 * Function bodies share the scope opened for the function itself.
 */
public final class AstWalker {

    private final AstVisitor visitor;

    public AstWalker(AstVisitor visitor) {
        this.visitor = Objects.requireNonNull(visitor, "visitor");
    }

    public static void walk(SourceFile file, AstVisitor visitor) {
        new AstWalker(visitor).statements(file.body());
    }

    public void statements(List<Stmt> statements) {
        for (Stmt statement : statements) {
            statement(statement);
        }
    }

    public void statement(Stmt statement) {
        if (statement == null) {
            return;
        }
        visitor.visitStatement(statement);

        if (statement instanceof Stmt.VarDecl decl) {
            for (Stmt.Declarator declarator : decl.declarations()) {
                visitor.visitDeclarator(declarator, decl.kind());
                pattern(declarator.id());
                expression(declarator.init());
            }
        } else if (statement instanceof Stmt.FunctionDecl fn) {
            expression(fn.function());
        } else if (statement instanceof Stmt.ClassDecl cls) {
            expression(cls.classExpr());
        } else if (statement instanceof Stmt.Return ret) {
            expression(ret.argument());
        } else if (statement instanceof Stmt.If ifStmt) {
            expression(ifStmt.test());
            statement(ifStmt.consequent());
            statement(ifStmt.alternate());
        } else if (statement instanceof Stmt.Block block) {
            visitor.enterBlock(block.body());
            statements(block.body());
            visitor.exitScope();
        } else if (statement instanceof Stmt.For loop) {
            visitor.enterLoop(loop);
            statement(loop.init());
            expression(loop.test());
            expression(loop.update());
            statement(loop.body());
            visitor.exitScope();
        } else if (statement instanceof Stmt.ForEach loop) {
            visitor.enterLoop(loop);
            statement(loop.left());
            expression(loop.right());
            statement(loop.body());
            visitor.exitScope();
        } else if (statement instanceof Stmt.While loop) {
            expression(loop.test());
            statement(loop.body());
        } else if (statement instanceof Stmt.Switch sw) {
            expression(sw.discriminant());
            final List<Stmt> all = sw.cases().stream().flatMap(c -> c.body().stream()).toList();
            visitor.enterBlock(all);
            for (Stmt.SwitchCase switchCase : sw.cases()) {
                expression(switchCase.test());
                statements(switchCase.body());
            }
            visitor.exitScope();
        } else if (statement instanceof Stmt.Try tryStmt) {
            statement(tryStmt.block());
            if (tryStmt.handler() != null) {
                visitor.enterCatch(tryStmt.param(), tryStmt.handler().body());
                if (tryStmt.param() != null) {
                    pattern(tryStmt.param());
                }
                statements(tryStmt.handler().body());
                visitor.exitScope();
            }
            statement(tryStmt.finalizer());
        } else if (statement instanceof Stmt.Labeled labeled) {
            statement(labeled.body());
        } else if (statement instanceof Stmt.Throw thr) {
            expression(thr.argument());
        } else if (statement instanceof Stmt.ExprStmt es) {
            expression(es.expression());
        } else if (statement instanceof Stmt.ExportNamed export) {
            statement(export.declaration());
        } else if (statement instanceof Stmt.ExportDefault export) {
            statement(export.declaration());
            expression(export.expression());
        }
    }

    public void expression(Expr expression) {
        if (expression == null) {
            return;
        }
        visitor.visitExpression(expression);

        switch (expression.kind()) {
            case STRING, NUMBER, BOOLEAN, NULL, BIGINT, IDENTIFIER, PRIVATE_NAME, HOLE -> {
            }
            case MEMBER -> {
                final Expr.Member member = (Expr.Member) expression;
                expression(member.object());
                if (member.computed()) {
                    expression(member.property());
                }
            }
            case CALL -> {
                final Expr.Call call = (Expr.Call) expression;
                expression(call.callee());
                call.arguments().forEach(this::expression);
            }
            case NEW -> {
                final Expr.New nw = (Expr.New) expression;
                expression(nw.callee());
                nw.arguments().forEach(this::expression);
            }
            case ARRAY -> ((Expr.ArrayLit) expression).elements().forEach(this::expression);
            case SPREAD -> expression(((Expr.Spread) expression).argument());
            case OBJECT -> {
                for (Expr.Prop prop : ((Expr.ObjectLit) expression).properties()) {
                    if (prop instanceof Expr.Property p) {
                        if (p.computed()) {
                            expression(p.key());
                        }
                        expression(p.value());
                    } else if (prop instanceof Expr.SpreadProp s) {
                        expression(s.argument());
                    } else if (prop instanceof Expr.Method m) {
                        if (m.computed()) {
                            expression(m.key());
                        }
                        expression(m.function());
                    }
                }
            }
            case TEMPLATE -> ((Expr.Template) expression).expressions().forEach(this::expression);
            case CONDITIONAL -> {
                final Expr.Conditional c = (Expr.Conditional) expression;
                expression(c.test());
                expression(c.consequent());
                expression(c.alternate());
            }
            case LOGICAL -> {
                final Expr.Logical l = (Expr.Logical) expression;
                expression(l.left());
                expression(l.right());
            }
            case BINARY -> {
                final Expr.Binary b = (Expr.Binary) expression;
                expression(b.left());
                expression(b.right());
            }
            case UNARY -> expression(((Expr.Unary) expression).argument());
            case UPDATE -> expression(((Expr.Update) expression).argument());
            case ASSIGNMENT -> {
                final Expr.Assignment a = (Expr.Assignment) expression;
                pattern(a.target());
                expression(a.value());
            }
            case SEQUENCE -> ((Expr.Sequence) expression).expressions().forEach(this::expression);
            case AWAIT -> expression(((Expr.Await) expression).argument());
            case FUNCTION -> function((Expr.FunctionExpr) expression);
            case CLASS -> {
                final Expr.ClassExpr cls = (Expr.ClassExpr) expression;
                expression(cls.superClass());
                for (Expr.ClassMember member : cls.members()) {
                    if (member.computed()) {
                        expression(member.key());
                    }
                    expression(member.function());
                    expression(member.value());
                }
            }
            case JSX -> {
                final Expr.Jsx jsx = (Expr.Jsx) expression;
                for (Expr.JsxAttribute attribute : jsx.attributes()) {
                    expression(attribute.value());
                }
                jsx.children().forEach(this::expression);
            }
            case OPAQUE -> ((Expr.Opaque) expression).children().forEach(this::expression);
        }
    }

    private void function(Expr.FunctionExpr function) {
        visitor.enterFunction(function);
        for (Pattern param : function.params()) {
            pattern(param);
        }
        if (function.body() != null) {
            statements(function.body().body());
        } else {
            expression(function.expressionBody());
        }
        visitor.exitScope();
    }

    private void pattern(Pattern pattern) {
        if (pattern instanceof Pattern.ObjectPattern op) {
            for (Pattern.PatternProperty property : op.properties()) {
                expression(property.computedKey());
                pattern(property.value());
            }
        } else if (pattern instanceof Pattern.ArrayPattern ap) {
            ap.elements().forEach(this::pattern);
        } else if (pattern instanceof Pattern.Defaulted d) {
            pattern(d.target());
            expression(d.defaultValue());
        } else if (pattern instanceof Pattern.Rest r) {
            pattern(r.argument());
        } else if (pattern instanceof Pattern.Target t) {
            expression(t.expression());
        }
    }
}
