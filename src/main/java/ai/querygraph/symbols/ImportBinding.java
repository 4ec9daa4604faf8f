package ai.querygraph.symbols;

import ai.querygraph.ast.Stmt;

/** {@code imported} is "default" for default imports and null for namespace imports. */
public record ImportBinding(Stmt.ImportKind kind, String source, String imported) {
}
