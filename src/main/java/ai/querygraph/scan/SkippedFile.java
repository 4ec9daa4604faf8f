package ai.querygraph.scan;

/** A matching file left out of the analysis because it exceeds the size limit. */
public record SkippedFile(String file, long sizeBytes) {
}
