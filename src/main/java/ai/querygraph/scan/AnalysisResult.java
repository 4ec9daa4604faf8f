package ai.querygraph.scan;

import java.util.List;

import ai.querygraph.model.CallSiteRecord;
import ai.querygraph.model.ParseError;

/**
 * Output of one pipeline run.
 *
 * @param records      call-site records in file order
 * @param scannedFiles every file handed to the parser, in scan order
 */
public record AnalysisResult(
        List<CallSiteRecord> records,
        List<ParseError> parseErrors,
        List<String> scannedFiles,
        List<SkippedFile> skippedFiles
) {
    public AnalysisResult {
        records = List.copyOf(records);
        parseErrors = List.copyOf(parseErrors);
        scannedFiles = List.copyOf(scannedFiles);
        skippedFiles = List.copyOf(skippedFiles);
    }
}
