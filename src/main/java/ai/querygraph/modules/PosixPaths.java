package ai.querygraph.modules;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import ai.querygraph.model.Ids;

/**
 * Helpers over the '/'-separated absolute path strings used as file identities.
 */
public final class PosixPaths {

    private PosixPaths() {
    }

    public static String dirname(String file) {
        final int slash = file.lastIndexOf('/');
        if (slash < 0) {
            return ".";
        }
        return slash == 0 ? "/" : file.substring(0, slash);
    }

    public static String basename(String file) {
        final int slash = file.lastIndexOf('/');
        return slash < 0 ? file : file.substring(slash + 1);
    }

    /** Resolves {@code other} against {@code base} and normalizes the result. */
    public static String resolve(String base, String other) {
        return Ids.normalizePath(Path.of(base).resolve(other));
    }

    public static boolean isAbsolute(String path) {
        return path.startsWith("/") || Path.of(path).isAbsolute();
    }

    public static List<String> segments(String path) {
        final List<String> out = new ArrayList<>();
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return out;
    }

    public static int commonPrefixLength(String left, String right) {
        final List<String> a = segments(left);
        final List<String> b = segments(right);
        final int limit = Math.min(a.size(), b.size());
        int count = 0;
        while (count < limit && a.get(count).equals(b.get(count))) {
            count++;
        }
        return count;
    }

    /** Relative path from {@code from} to {@code to}; empty when both are the same directory. */
    public static String relative(String from, String to) {
        if (from.equals(to)) {
            return "";
        }
        return Ids.toPosix(Path.of(from).relativize(Path.of(to)).toString());
    }

    /** True when {@code file} equals {@code dir} or lies below it. */
    public static boolean isWithin(String dir, String file) {
        if (file.equals(dir)) {
            return true;
        }
        final String prefix = dir.endsWith("/") ? dir : dir + "/";
        return file.startsWith(prefix);
    }
}
