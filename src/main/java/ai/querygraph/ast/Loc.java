package ai.querygraph.ast;

/** 1-based line and column. */
public record Loc(int line, int column) {

    public static final Loc START = new Loc(1, 1);
}
