package ai.querygraph.classify;

import ai.querygraph.ast.SourceFile;
import ai.querygraph.ast.Stmt;
import ai.querygraph.model.Resolution;

/**
 * Registers hook, client and namespace names imported from the query library.
 * Names from {@code @tanstack/react-query} itself are static; names from look-alike modules are dynamic.
 */
final class ImportScanner {

    private ImportScanner() {
    }

    static void scan(SourceFile file, ParseContext context) {
        for (Stmt statement : file.body()) {
            if (statement instanceof Stmt.Import imp) {
                register(imp, context);
            }
        }
    }

    private static void register(Stmt.Import imp, ParseContext context) {
        final boolean tanstack = QueryApi.TANSTACK_MODULE.equals(imp.source());
        final Resolution certainty = tanstack ? Resolution.STATIC : Resolution.DYNAMIC;

        for (Stmt.ImportSpecifier specifier : imp.specifiers()) {
            switch (specifier.kind()) {
                case NAMED -> {
                    final String imported = specifier.imported();
                    final String local = specifier.local();
                    if (QueryApi.QUERY_HOOKS.contains(imported)) {
                        ParseContext.setCertainty(context.queryHooks, local, certainty);
                        context.queryHookKinds.put(local, imported);
                    }
                    if ("useQueryClient".equals(imported)) {
                        ParseContext.setCertainty(context.useQueryClientNames, local, certainty);
                    }
                    if ("QueryClient".equals(imported)) {
                        ParseContext.setCertainty(context.queryClientCtorNames, local, certainty);
                        ParseContext.setCertainty(context.queryClientTypeNames, local, certainty);
                    }
                }
                case NAMESPACE -> {
                    if (QueryApi.isQueryLikeModule(imp.source())) {
                        ParseContext.setCertainty(context.queryNamespaces, specifier.local(), certainty);
                    }
                }
                case DEFAULT -> {
                    if (tanstack) {
                        ParseContext.setCertainty(context.queryNamespaces, specifier.local(), certainty);
                    }
                }
            }
        }
    }
}
