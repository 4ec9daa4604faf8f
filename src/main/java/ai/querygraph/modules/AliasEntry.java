package ai.querygraph.modules;

import java.util.List;
import java.util.Objects;

/**
 * One {@code compilerOptions.paths} entry with targets already made absolute.
 */
public record AliasEntry(String pattern, List<String> targets) {

    public AliasEntry {
        Objects.requireNonNull(pattern, "pattern");
        targets = List.copyOf(targets);
    }

    public boolean wildcard() {
        return pattern.indexOf('*') >= 0;
    }

    /**
     * Text matched by the pattern's '*', "" for an exact match, or null when the specifier does not match.
     */
    public String capture(String specifier) {
        final int star = pattern.indexOf('*');
        if (star < 0) {
            return pattern.equals(specifier) ? "" : null;
        }
        final String prefix = pattern.substring(0, star);
        final String suffix = pattern.substring(star + 1);
        if (!specifier.startsWith(prefix) || !specifier.endsWith(suffix)
                || specifier.length() < prefix.length() + suffix.length()) {
            return null;
        }
        return specifier.substring(prefix.length(), specifier.length() - suffix.length());
    }
}
