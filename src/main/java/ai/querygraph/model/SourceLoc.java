package ai.querygraph.model;

public record SourceLoc(int line, int column) {
}
