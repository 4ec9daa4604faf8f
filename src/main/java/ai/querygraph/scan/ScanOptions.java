package ai.querygraph.scan;

import java.util.List;
import java.util.Objects;

/**
 * What to scan below each workspace root.
 *
 * @param folders       folders relative to the root (or absolute); "." scans the whole root
 * @param include       comma-separated globs, braces allowed
 * @param exclude       comma-separated globs, braces allowed
 * @param maxFileSizeKB larger files are skipped and reported
 * @param threads       worker count for parsing and classification
 */
public record ScanOptions(
        List<String> folders,
        String include,
        String exclude,
        boolean useGitIgnore,
        int maxFileSizeKB,
        int threads
) {
    public static final String DEFAULT_INCLUDE = "**/*.{ts,tsx,js,jsx,mts,cts,mjs,cjs}";
    public static final String DEFAULT_EXCLUDE =
            "**/{node_modules,dist,build,.next,coverage,.expo,.expo-shared,.turbo,.yarn,android,ios,Pods}/**";
    public static final int DEFAULT_MAX_FILE_SIZE_KB = 512;

    public ScanOptions {
        Objects.requireNonNull(folders, "folders");
        folders = folders.isEmpty() ? List.of(".") : List.copyOf(folders);
        include = include == null || include.isBlank() ? DEFAULT_INCLUDE : include;
        exclude = exclude == null ? DEFAULT_EXCLUDE : exclude;
        if (maxFileSizeKB <= 0) {
            throw new IllegalArgumentException("maxFileSizeKB must be positive: " + maxFileSizeKB);
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
    }

    public static ScanOptions defaults() {
        return new ScanOptions(List.of("."), DEFAULT_INCLUDE, DEFAULT_EXCLUDE, true, DEFAULT_MAX_FILE_SIZE_KB,
                Runtime.getRuntime().availableProcessors());
    }

    public ScanOptions withFolders(List<String> value) {
        return new ScanOptions(value, include, exclude, useGitIgnore, maxFileSizeKB, threads);
    }

    public ScanOptions withInclude(String value) {
        return new ScanOptions(folders, value, exclude, useGitIgnore, maxFileSizeKB, threads);
    }

    public ScanOptions withExclude(String value) {
        return new ScanOptions(folders, include, value, useGitIgnore, maxFileSizeKB, threads);
    }

    public ScanOptions withUseGitIgnore(boolean value) {
        return new ScanOptions(folders, include, exclude, value, maxFileSizeKB, threads);
    }

    public ScanOptions withMaxFileSizeKB(int value) {
        return new ScanOptions(folders, include, exclude, useGitIgnore, value, threads);
    }

    public ScanOptions withThreads(int value) {
        return new ScanOptions(folders, include, exclude, useGitIgnore, maxFileSizeKB, value);
    }
}
