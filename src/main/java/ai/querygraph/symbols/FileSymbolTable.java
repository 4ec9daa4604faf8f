package ai.querygraph.symbols;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.querygraph.ast.Expr;

/**
 * Bindings of one file:
 * - values: local name -> initializer
 * - functions: local name -> returned expression
 * - imports: local name -> import binding
 * - exports: exported name -> local name
 * - reExports: in declaration order
 * <p>
 * Filled by {@link SymbolTableBuilder}, read-only afterwards.
 */
public final class FileSymbolTable {

    public static final String DEFAULT_EXPORT_NAME = "__default_export__";

    private final String file;
    private final Map<String, Expr> values = new LinkedHashMap<>();
    private final Map<String, Expr> functions = new LinkedHashMap<>();
    private final Map<String, ImportBinding> imports = new LinkedHashMap<>();
    private final Map<String, String> exports = new LinkedHashMap<>();
    private final List<ReExport> reExports = new ArrayList<>();

    FileSymbolTable(String file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public String file() {
        return file;
    }

    public Expr value(String name) {
        return values.get(name);
    }

    public Expr functionReturn(String name) {
        return functions.get(name);
    }

    public ImportBinding importBinding(String name) {
        return imports.get(name);
    }

    public String exportedLocal(String exportedName) {
        return exports.get(exportedName);
    }

    public List<ReExport> reExports() {
        return Collections.unmodifiableList(reExports);
    }

    public Map<String, Expr> values() {
        return Collections.unmodifiableMap(values);
    }

    public Map<String, Expr> functions() {
        return Collections.unmodifiableMap(functions);
    }

    public Map<String, ImportBinding> imports() {
        return Collections.unmodifiableMap(imports);
    }

    public Map<String, String> exports() {
        return Collections.unmodifiableMap(exports);
    }

    void putValue(String name, Expr value) {
        values.put(name, value);
    }

    void putFunction(String name, Expr returned) {
        functions.put(name, returned);
    }

    void putImport(String local, ImportBinding binding) {
        imports.put(local, binding);
    }

    void putExport(String exported, String local) {
        exports.put(exported, local);
    }

    void addReExport(ReExport reExport) {
        reExports.add(reExport);
    }
}
