package ai.querygraph.parse;

/** A file whose text is not valid TypeScript/JavaScript for the grammar it was parsed with. */
public final class SourceParseException extends Exception {

    private final int line;
    private final int column;

    public SourceParseException(int line, int column) {
        super("Syntax error at " + line + ":" + column);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
