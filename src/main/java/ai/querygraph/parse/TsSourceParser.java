package ai.querygraph.parse;

import java.util.Objects;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

import ai.querygraph.ast.Loc;
import ai.querygraph.ast.SourceFile;

/**
 * Parses TypeScript and JavaScript source text into a {@link SourceFile}.
 * <p>
 * Every extension goes through the one TypeScript grammar, which also accepts JSX, so
 * {@code .ts} and {@code .tsx} sources share a parser. Parsers are kept per thread; the
 * instance itself can be shared by pipeline workers.
 */
public final class TsSourceParser {

    private final ThreadLocal<TSParser> parsers = ThreadLocal.withInitial(() -> newParser(new TreeSitterTypescript()));

    /**
     * @param path absolute '/'-separated file identity
     * @throws SourceParseException at the first syntax error
     */
    public SourceFile parse(String path, String text) throws SourceParseException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(text, "text");

        final TSParser parser = parsers.get();
        final TSTree tree = parser.parseString(null, text);
        final TSNode root = tree.getRootNode();

        final TreeSitterAstBuilder builder = new TreeSitterAstBuilder(text);
        final TSNode error = TreeSitterAstBuilder.firstErrorNode(root);
        if (error != null) {
            final Loc loc = builder.locationOf(error);
            throw new SourceParseException(loc.line(), loc.column());
        }
        return new SourceFile(path, builder.program(root), builder.locations());
    }

    private static TSParser newParser(TSLanguage language) {
        final TSParser parser = new TSParser();
        if (!parser.setLanguage(language)) {
            throw new IllegalStateException("tree-sitter language rejected: " + language.getClass().getSimpleName());
        }
        return parser;
    }
}
