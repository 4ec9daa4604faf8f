package ai.querygraph.ast;

import java.util.List;
import java.util.Objects;

public sealed interface Stmt {

    /** {@code kind} is one of const, let, var (using declarations map to const). */
    record VarDecl(String kind, List<Declarator> declarations) implements Stmt {
        public VarDecl {
            Objects.requireNonNull(kind, "kind");
            declarations = List.copyOf(declarations);
        }
    }

    record Declarator(Pattern id, Expr init) {
        public Declarator {
            Objects.requireNonNull(id, "id");
        }
    }

    record FunctionDecl(String name, Expr.FunctionExpr function) implements Stmt {
        public FunctionDecl {
            Objects.requireNonNull(function, "function");
        }
    }

    record ClassDecl(String name, Expr.ClassExpr classExpr) implements Stmt {
    }

    record Return(Expr argument) implements Stmt {
    }

    record If(Expr test, Stmt consequent, Stmt alternate) implements Stmt {
    }

    record Block(List<Stmt> body) implements Stmt {
        public Block {
            body = List.copyOf(body);
        }
    }

    record For(Stmt init, Expr test, Expr update, Stmt body) implements Stmt {
    }

    /** for-in and for-of; {@code left} is a {@link VarDecl} without initializer or an {@link ExprStmt} target. */
    record ForEach(Stmt left, Expr right, Stmt body, boolean of) implements Stmt {
    }

    record While(Expr test, Stmt body, boolean doWhile) implements Stmt {
    }

    record Switch(Expr discriminant, List<SwitchCase> cases) implements Stmt {
        public Switch {
            cases = List.copyOf(cases);
        }
    }

    /** {@code test} is null for the default case. */
    record SwitchCase(Expr test, List<Stmt> body) {
        public SwitchCase {
            body = List.copyOf(body);
        }
    }

    record Try(Block block, Pattern param, Block handler, Block finalizer) implements Stmt {
    }

    record Labeled(String label, Stmt body) implements Stmt {
    }

    record Throw(Expr argument) implements Stmt {
    }

    record ExprStmt(Expr expression) implements Stmt {
    }

    record Import(String source, List<ImportSpecifier> specifiers) implements Stmt {
        public Import {
            Objects.requireNonNull(source, "source");
            specifiers = List.copyOf(specifiers);
        }
    }

    enum ImportKind {
        NAMED,
        DEFAULT,
        NAMESPACE
    }

    /** {@code imported} is "default" for default imports and null for namespace imports. */
    record ImportSpecifier(ImportKind kind, String imported, String local) {
    }

    /** {@code export const x = ...}, {@code export { a as b }} and {@code export { a } from "m"}. */
    record ExportNamed(Stmt declaration, List<ExportSpecifier> specifiers, String source) implements Stmt {
        public ExportNamed {
            specifiers = List.copyOf(specifiers);
        }
    }

    record ExportSpecifier(String local, String exported) {
    }

    /** Exactly one of {@code declaration} (function or class) and {@code expression} is set. */
    record ExportDefault(Stmt declaration, Expr expression) implements Stmt {
    }

    /** {@code export * from "m"} or {@code export * as ns from "m"}. */
    record ExportAll(String source, String exported) implements Stmt {
    }

    /** Statements without analysis relevance: type declarations, break, continue, debugger, empty. */
    record Other() implements Stmt {
    }
}
