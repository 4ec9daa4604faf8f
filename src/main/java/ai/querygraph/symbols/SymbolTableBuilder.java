package ai.querygraph.symbols;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Set;

import ai.querygraph.ast.AstVisitor;
import ai.querygraph.ast.AstWalker;
import ai.querygraph.ast.Expr;
import ai.querygraph.ast.Pattern;
import ai.querygraph.ast.SourceFile;
import ai.querygraph.ast.Stmt;

/**
 * Builds the {@link FileSymbolTable} of one file from its syntax alone. Top-level declarations are
 * always recorded; nested ones only when their name looks like a key or key factory.
 */
public final class SymbolTableBuilder implements AstVisitor {

    private final FileSymbolTable table;
    private final Set<Stmt> topLevel = Collections.newSetFromMap(new IdentityHashMap<>());

    private SymbolTableBuilder(SourceFile file) {
        this.table = new FileSymbolTable(file.path());
        for (Stmt statement : file.body()) {
            topLevel.add(statement);
            if (statement instanceof Stmt.ExportNamed en && en.declaration() != null) {
                topLevel.add(en.declaration());
            } else if (statement instanceof Stmt.ExportDefault ed && ed.declaration() != null) {
                topLevel.add(ed.declaration());
            }
        }
    }

    public static FileSymbolTable build(SourceFile file) {
        final SymbolTableBuilder builder = new SymbolTableBuilder(file);
        AstWalker.walk(file, builder);
        return builder.table;
    }

    /** Case-insensitive "querykey" or "rqkey" containment, excluding the bare name {@code queryKey}. */
    public static boolean isKeySymbolName(String name) {
        final String normalized = name.toLowerCase(Locale.ROOT);
        if ("querykey".equals(normalized)) {
            return false;
        }
        return normalized.contains("rqkey") || normalized.contains("querykey");
    }

    @Override
    public void visitStatement(Stmt statement) {
        if (statement instanceof Stmt.Import imp) {
            collectImport(imp);
        } else if (statement instanceof Stmt.VarDecl decl) {
            final boolean isTopLevel = topLevel.contains(decl);
            for (Stmt.Declarator declarator : decl.declarations()) {
                if (declarator.id() instanceof Pattern.Binding b
                        && (isTopLevel || isKeySymbolName(b.name()))) {
                    collectVariable(b.name(), declarator.init());
                }
            }
        } else if (statement instanceof Stmt.FunctionDecl fn) {
            if (fn.name() != null && (topLevel.contains(fn) || isKeySymbolName(fn.name()))) {
                final Expr returned = FunctionReturns.extract(fn.function());
                if (returned != null) {
                    table.putFunction(fn.name(), returned);
                }
            }
        } else if (statement instanceof Stmt.ExportNamed export) {
            collectNamedExport(export);
        } else if (statement instanceof Stmt.ExportDefault export) {
            collectDefaultExport(export);
        } else if (statement instanceof Stmt.ExportAll export) {
            if (export.exported() == null) {
                table.addReExport(ReExport.all(export.source()));
            }
        }
    }

    private void collectImport(Stmt.Import imp) {
        for (Stmt.ImportSpecifier spec : imp.specifiers()) {
            table.putImport(spec.local(), new ImportBinding(spec.kind(), imp.source(), spec.imported()));
        }
    }

    private void collectVariable(String name, Expr init) {
        if (init == null) {
            return;
        }
        table.putValue(name, init);
        if (init instanceof Expr.FunctionExpr fn) {
            final Expr returned = FunctionReturns.extract(fn);
            if (returned != null) {
                table.putFunction(name, returned);
            }
        }
    }

    private void collectNamedExport(Stmt.ExportNamed export) {
        final Stmt declaration = export.declaration();
        if (declaration instanceof Stmt.VarDecl decl) {
            for (Stmt.Declarator declarator : decl.declarations()) {
                if (declarator.id() instanceof Pattern.Binding b) {
                    table.putExport(b.name(), b.name());
                }
            }
        } else if (declaration instanceof Stmt.FunctionDecl fn && fn.name() != null) {
            table.putExport(fn.name(), fn.name());
        }

        for (Stmt.ExportSpecifier spec : export.specifiers()) {
            if (export.source() == null) {
                table.putExport(spec.exported(), spec.local());
            } else {
                table.addReExport(new ReExport(export.source(), spec.local(), spec.exported(), false));
            }
        }
    }

    private void collectDefaultExport(Stmt.ExportDefault export) {
        if (export.declaration() instanceof Stmt.FunctionDecl fn) {
            if (fn.name() != null) {
                final Expr returned = FunctionReturns.extract(fn.function());
                if (returned != null) {
                    table.putFunction(fn.name(), returned);
                }
                table.putExport("default", fn.name());
                return;
            }
            collectDefaultExpression(fn.function());
            return;
        }
        final Expr expression = export.expression();
        if (expression instanceof Expr.Ident id) {
            table.putExport("default", id.name());
        } else if (expression != null) {
            collectDefaultExpression(expression);
        }
    }

    private void collectDefaultExpression(Expr expression) {
        table.putValue(FileSymbolTable.DEFAULT_EXPORT_NAME, expression);
        if (expression instanceof Expr.FunctionExpr fn) {
            final Expr returned = FunctionReturns.extract(fn);
            if (returned != null) {
                table.putFunction(FileSymbolTable.DEFAULT_EXPORT_NAME, returned);
            }
        }
        table.putExport("default", FileSymbolTable.DEFAULT_EXPORT_NAME);
    }
}
