package ai.querygraph.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiled glob list. Supports {@code **}, {@code *}, {@code ?}, {@code [...]} and {@code {a,b}};
 * a leading {@code **}{@code /} also matches no directory, a trailing {@code /**} also matches the directory itself.
 */
public final class GlobPatterns {

    private final List<String> globs;
    private final List<Pattern> patterns;

    private GlobPatterns(List<String> globs) {
        this.globs = List.copyOf(globs);
        this.patterns = globs.stream().map(GlobPatterns::toRegex).toList();
    }

    public static GlobPatterns parse(String input) {
        return new GlobPatterns(split(input));
    }

    public static GlobPatterns of(List<String> globs) {
        return new GlobPatterns(globs);
    }

    /** Splits on commas outside braces; blank entries are dropped. */
    public static List<String> split(String input) {
        final List<String> out = new ArrayList<>();
        if (input == null) {
            return out;
        }
        final StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                addTrimmed(out, current);
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        addTrimmed(out, current);
        return out;
    }

    private static void addTrimmed(List<String> out, StringBuilder current) {
        final String trimmed = current.toString().trim();
        if (!trimmed.isEmpty()) {
            out.add(trimmed);
        }
    }

    public List<String> globs() {
        return globs;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /** @param relativePath '/'-separated path without leading slash */
    public boolean matches(String relativePath) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(relativePath).matches()) {
                return true;
            }
        }
        return false;
    }

    static Pattern toRegex(String glob) {
        String g = glob.replace('\\', '/');
        if (g.startsWith("./")) {
            g = g.substring(2);
        }
        final StringBuilder regex = new StringBuilder();
        int braceDepth = 0;
        int i = 0;
        while (i < g.length()) {
            final char c = g.charAt(i);
            if (c == '*' && i + 1 < g.length() && g.charAt(i + 1) == '*') {
                if (i + 2 < g.length() && g.charAt(i + 2) == '/') {
                    regex.append("(?:.*/)?");
                    i += 3;
                } else {
                    regex.append(".*");
                    i += 2;
                }
                continue;
            }
            if (c == '/' && g.startsWith("/**", i) && i + 3 == g.length()) {
                regex.append("(?:/.*)?");
                break;
            }
            switch (c) {
                case '*' -> regex.append("[^/]*");
                case '?' -> regex.append("[^/]");
                case '{' -> {
                    braceDepth++;
                    regex.append("(?:");
                }
                case '}' -> {
                    if (braceDepth > 0) {
                        braceDepth--;
                        regex.append(')');
                    } else {
                        regex.append("\\}");
                    }
                }
                case ',' -> regex.append(braceDepth > 0 ? "|" : ",");
                case '[' -> {
                    final int close = g.indexOf(']', i + 1);
                    if (close < 0) {
                        regex.append("\\[");
                    } else {
                        String body = g.substring(i + 1, close);
                        if (body.startsWith("!")) {
                            body = "^" + body.substring(1);
                        }
                        regex.append('[').append(body.replace("\\", "\\\\")).append(']');
                        i = close;
                    }
                }
                default -> {
                    if (".()+^$|\\".indexOf(c) >= 0) {
                        regex.append('\\');
                    }
                    regex.append(c);
                }
            }
            i++;
        }
        return Pattern.compile(regex.toString());
    }
}
