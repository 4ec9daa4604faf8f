package ai.querygraph.ast;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;

/**
 * Builds lexical scopes for a file. Declarations are registered when their scope opens
 * (var and function hoisting included), so a binding's constant flag reflects every
 * assignment in the file once analysis completes.
 */
public final class ScopeAnalyzer implements AstVisitor {

    private final IdentityHashMap<Expr, Scope> scopeByNode = new IdentityHashMap<>();
    private final IdentityHashMap<Expr.FunctionExpr, Expr.Call> callbackCalls = new IdentityHashMap<>();
    private final Scope root;
    private Scope current;

    private ScopeAnalyzer(List<Stmt> program) {
        this.root = new Scope(null, true);
        this.current = root;
        declareLexical(root, program);
        hoistVars(root, program);
    }

    public static FileScopes analyze(SourceFile file) {
        final ScopeAnalyzer analyzer = new ScopeAnalyzer(file.body());
        AstWalker.walk(file, analyzer);
        return new FileScopes(analyzer.root, analyzer.scopeByNode, analyzer.callbackCalls);
    }

    @Override
    public void visitExpression(Expr expression) {
        switch (expression.kind()) {
            case CALL -> {
                scopeByNode.put(expression, current);
                final Expr.Call call = (Expr.Call) expression;
                for (Expr arg : call.arguments()) {
                    if (arg instanceof Expr.FunctionExpr fn) {
                        callbackCalls.put(fn, call);
                    }
                }
            }
            case NEW, JSX -> scopeByNode.put(expression, current);
            case ASSIGNMENT -> {
                final List<String> names = new ArrayList<>();
                collectNames(((Expr.Assignment) expression).target(), names);
                names.forEach(this::markReassigned);
            }
            case UPDATE -> {
                if (((Expr.Update) expression).argument() instanceof Expr.Ident id) {
                    markReassigned(id.name());
                }
            }
            default -> {
            }
        }
    }

    @Override
    public void enterFunction(Expr.FunctionExpr function) {
        final Scope scope = new Scope(current, true);
        for (Pattern param : function.params()) {
            declareParam(scope, param, function, null);
        }
        if (function.body() != null) {
            declareLexical(scope, function.body().body());
            hoistVars(scope, function.body().body());
        }
        current = scope;
    }

    @Override
    public void enterBlock(List<Stmt> statements) {
        final Scope scope = new Scope(current, false);
        declareLexical(scope, statements);
        current = scope;
    }

    @Override
    public void enterCatch(Pattern param, List<Stmt> statements) {
        final Scope scope = new Scope(current, false);
        if (param != null) {
            final List<String> names = new ArrayList<>();
            collectNames(param, names);
            for (String name : names) {
                scope.declare(new Binding(name, Binding.Kind.CATCH, null, null, null));
            }
        }
        declareLexical(scope, statements);
        current = scope;
    }

    @Override
    public void enterLoop(Stmt loop) {
        final Scope scope = new Scope(current, false);
        if (loop instanceof Stmt.For f && f.init() != null) {
            declareLexical(scope, List.of(f.init()));
        } else if (loop instanceof Stmt.ForEach fe && fe.left() != null) {
            declareLexical(scope, List.of(fe.left()));
        }
        current = scope;
    }

    @Override
    public void exitScope() {
        if (current.parent() != null) {
            current = current.parent();
        }
    }

    private void markReassigned(String name) {
        final Binding binding = current.lookup(name);
        if (binding != null) {
            binding.markReassigned();
        }
    }

    private static void declareLexical(Scope scope, List<Stmt> statements) {
        for (Stmt statement : statements) {
            Stmt s = statement;
            if (s instanceof Stmt.ExportNamed en && en.declaration() != null) {
                s = en.declaration();
            } else if (s instanceof Stmt.ExportDefault ed && ed.declaration() != null) {
                s = ed.declaration();
            }

            if (s instanceof Stmt.VarDecl decl && !"var".equals(decl.kind())) {
                final Binding.Kind kind = "let".equals(decl.kind()) ? Binding.Kind.LET : Binding.Kind.CONST;
                declareDeclarators(scope, decl, kind);
            } else if (s instanceof Stmt.FunctionDecl fn && fn.name() != null) {
                scope.declare(new Binding(fn.name(), Binding.Kind.FUNCTION, null, fn.function(), null));
            } else if (s instanceof Stmt.ClassDecl cls && cls.name() != null) {
                scope.declare(new Binding(cls.name(), Binding.Kind.CLASS, null, null, null));
            } else if (s instanceof Stmt.Import imp) {
                for (Stmt.ImportSpecifier spec : imp.specifiers()) {
                    scope.declare(new Binding(spec.local(), Binding.Kind.MODULE, null, null, null));
                }
            }
        }
    }

    private static void hoistVars(Scope scope, List<Stmt> statements) {
        for (Stmt statement : statements) {
            hoistVars(scope, statement);
        }
    }

    private static void hoistVars(Scope scope, Stmt statement) {
        if (statement instanceof Stmt.VarDecl decl) {
            if ("var".equals(decl.kind())) {
                declareDeclarators(scope, decl, Binding.Kind.VAR);
            }
        } else if (statement instanceof Stmt.ExportNamed en) {
            if (en.declaration() != null) {
                hoistVars(scope, en.declaration());
            }
        } else if (statement instanceof Stmt.Block block) {
            hoistVars(scope, block.body());
        } else if (statement instanceof Stmt.If ifStmt) {
            hoistVars(scope, ifStmt.consequent());
            if (ifStmt.alternate() != null) {
                hoistVars(scope, ifStmt.alternate());
            }
        } else if (statement instanceof Stmt.For loop) {
            if (loop.init() != null) {
                hoistVars(scope, loop.init());
            }
            hoistVars(scope, loop.body());
        } else if (statement instanceof Stmt.ForEach loop) {
            if (loop.left() != null) {
                hoistVars(scope, loop.left());
            }
            hoistVars(scope, loop.body());
        } else if (statement instanceof Stmt.While loop) {
            hoistVars(scope, loop.body());
        } else if (statement instanceof Stmt.Switch sw) {
            for (Stmt.SwitchCase c : sw.cases()) {
                hoistVars(scope, c.body());
            }
        } else if (statement instanceof Stmt.Try tryStmt) {
            hoistVars(scope, tryStmt.block());
            if (tryStmt.handler() != null) {
                hoistVars(scope, tryStmt.handler());
            }
            if (tryStmt.finalizer() != null) {
                hoistVars(scope, tryStmt.finalizer());
            }
        } else if (statement instanceof Stmt.Labeled labeled) {
            hoistVars(scope, labeled.body());
        }
    }

    private static void declareDeclarators(Scope scope, Stmt.VarDecl decl, Binding.Kind kind) {
        for (Stmt.Declarator declarator : decl.declarations()) {
            if (declarator.id() instanceof Pattern.Binding b) {
                scope.declare(new Binding(b.name(), kind, declarator.init(), null, null));
                continue;
            }
            final List<String> names = new ArrayList<>();
            collectNames(declarator.id(), names);
            for (String name : names) {
                scope.declare(new Binding(name, kind, null, null, null));
            }
        }
    }

    private static void declareParam(Scope scope, Pattern param, Expr.FunctionExpr owner, TypeNode inherited) {
        if (param instanceof Pattern.Binding b) {
            final TypeNode type = b.type() != null ? b.type() : inherited;
            scope.declare(new Binding(b.name(), Binding.Kind.PARAM, null, owner, type));
        } else if (param instanceof Pattern.Defaulted d) {
            declareParam(scope, d.target(), owner, inherited);
        } else if (param instanceof Pattern.Rest r) {
            declareParam(scope, r.argument(), owner, r.type() != null ? r.type() : inherited);
        } else if (param instanceof Pattern.ObjectPattern op) {
            for (Pattern.PatternProperty property : op.properties()) {
                final TypeNode memberType = property.key() != null
                        ? literalMemberType(op.type(), property.key())
                        : null;
                declareParam(scope, property.value(), owner, memberType);
            }
        } else if (param instanceof Pattern.ArrayPattern ap) {
            for (Pattern element : ap.elements()) {
                declareParam(scope, element, owner, null);
            }
        }
    }

    /** Type of {@code name} in an inline object type such as {@code { client: QueryClient }}. */
    public static TypeNode literalMemberType(TypeNode type, String name) {
        if (type instanceof TypeNode.Literal literal) {
            for (TypeNode.Member member : literal.members()) {
                if (name.equals(member.name())) {
                    return member.type();
                }
            }
        }
        return null;
    }

    /** Names bound by a pattern, in source order. */
    public static void collectNames(Pattern pattern, List<String> out) {
        if (pattern instanceof Pattern.Binding b) {
            out.add(b.name());
        } else if (pattern instanceof Pattern.ObjectPattern op) {
            for (Pattern.PatternProperty property : op.properties()) {
                collectNames(property.value(), out);
            }
        } else if (pattern instanceof Pattern.ArrayPattern ap) {
            for (Pattern element : ap.elements()) {
                collectNames(element, out);
            }
        } else if (pattern instanceof Pattern.Defaulted d) {
            collectNames(d.target(), out);
        } else if (pattern instanceof Pattern.Rest r) {
            collectNames(r.argument(), out);
        } else if (pattern instanceof Pattern.Target t && t.expression() instanceof Expr.Ident id) {
            out.add(id.name());
        }
    }
}
