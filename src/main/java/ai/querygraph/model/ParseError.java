package ai.querygraph.model;

public record ParseError(String file, String message) {
}
