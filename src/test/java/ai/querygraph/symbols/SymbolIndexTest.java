package ai.querygraph.symbols;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ai.querygraph.ast.Expr;
import ai.querygraph.ast.Stmt;
import ai.querygraph.parse.TsSourceParser;

class SymbolIndexTest {

    private static final String SOURCE = """
            import { base } from './base';
            import * as ns from './ns';
            export const todoKeys = { all: ['todos'] };
            const local = 1;
            export { local as renamed };
            export * from './more';
            export { other as alias } from './other';
            export default () => ['default-key'];
            function helper() {
              const inner = 2;
              function nestedQueryKey() { return ['nested']; }
              return inner;
            }
            """;

    private FileSymbolTable table() throws Exception {
        final SymbolIndex index = SymbolIndex.build(List.of(new TsSourceParser().parse("/w/src/keys.ts", SOURCE)));
        assertEquals(Set.of("/w/src/keys.ts"), index.fileSet());
        return index.file("/w/src/keys.ts");
    }

    @Test
    void recordsTopLevelValuesAndExports() throws Exception {
        final FileSymbolTable table = table();

        assertInstanceOf(Expr.ObjectLit.class, table.value("todoKeys"));
        assertEquals("todoKeys", table.exportedLocal("todoKeys"));
        assertEquals("local", table.exportedLocal("renamed"));
        assertEquals(new Expr.Num(1), table.value("local"));
    }

    @Test
    void recordsImports() throws Exception {
        final FileSymbolTable table = table();

        assertEquals(new ImportBinding(Stmt.ImportKind.NAMED, "./base", "base"), table.importBinding("base"));
        assertEquals(new ImportBinding(Stmt.ImportKind.NAMESPACE, "./ns", null), table.importBinding("ns"));
    }

    @Test
    void recordsReExportsInOrder() throws Exception {
        assertEquals(List.of(
                ReExport.all("./more"),
                new ReExport("./other", "other", "alias", false)), table().reExports());
    }

    @Test
    void anonymousDefaultExportGetsSyntheticName() throws Exception {
        final FileSymbolTable table = table();

        assertEquals(FileSymbolTable.DEFAULT_EXPORT_NAME, table.exportedLocal("default"));
        assertEquals(new Expr.ArrayLit(List.of(new Expr.Str("default-key"))),
                table.functionReturn(FileSymbolTable.DEFAULT_EXPORT_NAME));
    }

    @Test
    void nestedDeclarationsOnlyWhenNamedLikeKeys() throws Exception {
        final FileSymbolTable table = table();

        assertEquals(new Expr.Num(2), table.functionReturn("helper"));
        assertNull(table.value("inner"));
        assertEquals(new Expr.ArrayLit(List.of(new Expr.Str("nested"))), table.functionReturn("nestedQueryKey"));
    }

    @Test
    void keySymbolNames() {
        assertTrue(SymbolTableBuilder.isKeySymbolName("todoQueryKeys"));
        assertTrue(SymbolTableBuilder.isKeySymbolName("RQKEY_USERS"));
        assertFalse(SymbolTableBuilder.isKeySymbolName("queryKey"));
        assertFalse(SymbolTableBuilder.isKeySymbolName("keys"));
    }
}
