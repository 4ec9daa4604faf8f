package ai.querygraph.symbols;

/**
 * {@code export { imported as exported } from source}, or {@code export * from source} when {@code all}.
 */
public record ReExport(String source, String imported, String exported, boolean all) {

    public static ReExport all(String source) {
        return new ReExport(source, null, null, true);
    }
}
