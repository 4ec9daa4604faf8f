package ai.querygraph.model;

import java.io.File;
import java.nio.file.Path;
import java.util.Objects;

public final class Ids {

    private Ids() {
    }

    public static String fileNodeId(String file) {
        Objects.requireNonNull(file, "file");
        return "file:" + file;
    }

    public static String actionNodeId(CallSiteRecord record, int index) {
        Objects.requireNonNull(record, "record");
        return "action:" + record.file()
                + ":" + record.loc().line()
                + ":" + record.loc().column()
                + ":" + record.operation()
                + ":" + index;
    }

    public static String keyNodeId(String keyId) {
        Objects.requireNonNull(keyId, "keyId");
        return "qk:" + keyId;
    }

    /** Absolute, normalized, '/'-separated file identity used across the analysis. */
    public static String normalizePath(Path path) {
        Objects.requireNonNull(path, "path");
        return toPosix(path.toAbsolutePath().normalize().toString());
    }

    public static String toPosix(String path) {
        if (path == null) {
            return "";
        }
        return File.separatorChar == '/' ? path : path.replace(File.separatorChar, '/');
    }
}
