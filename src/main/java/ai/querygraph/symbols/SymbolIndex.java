package ai.querygraph.symbols;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import ai.querygraph.ast.SourceFile;

/**
 * Symbol tables of every successfully parsed file of one run. Read-only once built.
 */
public final class SymbolIndex {

    private final Map<String, FileSymbolTable> files;

    private SymbolIndex(Map<String, FileSymbolTable> files) {
        this.files = Collections.unmodifiableMap(files);
    }

    public static SymbolIndex build(Collection<SourceFile> parsedFiles) {
        final Map<String, FileSymbolTable> files = new LinkedHashMap<>();
        for (SourceFile file : parsedFiles) {
            files.put(file.path(), SymbolTableBuilder.build(file));
        }
        return new SymbolIndex(files);
    }

    public FileSymbolTable file(String path) {
        return files.get(path);
    }

    public boolean contains(String path) {
        return files.containsKey(path);
    }

    public Set<String> fileSet() {
        return files.keySet();
    }

    public Collection<FileSymbolTable> tables() {
        return files.values();
    }
}
