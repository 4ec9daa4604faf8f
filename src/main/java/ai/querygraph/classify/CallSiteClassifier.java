package ai.querygraph.classify;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ai.querygraph.ast.AstVisitor;
import ai.querygraph.ast.AstWalker;
import ai.querygraph.ast.Binding;
import ai.querygraph.ast.Expr;
import ai.querygraph.ast.FileScopes;
import ai.querygraph.ast.Loc;
import ai.querygraph.ast.Scope;
import ai.querygraph.ast.ScopeAnalyzer;
import ai.querygraph.ast.SourceFile;
import ai.querygraph.key.ActionKeyInference;
import ai.querygraph.key.HookKeyInference;
import ai.querygraph.key.QueryKeyNormalizer;
import ai.querygraph.key.QueryKeys;
import ai.querygraph.model.CallSiteRecord;
import ai.querygraph.model.MatchMode;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.model.Relation;
import ai.querygraph.model.Resolution;
import ai.querygraph.model.SourceLoc;
import ai.querygraph.resolve.QueryKeyResolver;

/**
 * Turns the calls of one file into {@link CallSiteRecord}s.
 * <p>
 * Three passes over the file: imports register the library names in scope, local bindings
 * register client variables and hook results, and finally every call and JSX element is
 * classified as a declaration, a cache mutation, or nothing.
 * <p>
 * One instance per file; the resolver it is given is expected to be bound to that file.
 */
public final class CallSiteClassifier {

    private final QueryKeyResolver resolver;
    private final QueryKeyNormalizer normalizer;
    private final HookKeyInference hookKeys;
    private final ActionKeyInference actionKeys;
    private final LocalArgResolver locals;

    public CallSiteClassifier(QueryKeyResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.normalizer = new QueryKeyNormalizer(resolver);
        this.hookKeys = new HookKeyInference(normalizer);
        this.actionKeys = new ActionKeyInference(normalizer);
        this.locals = new LocalArgResolver(resolver);
    }

    public List<CallSiteRecord> classify(SourceFile file) {
        Objects.requireNonNull(file, "file");
        final ParseContext context = new ParseContext();
        ImportScanner.scan(file, context);
        new LocalBindingScanner(context, resolver, hookKeys).scan(file);

        final FileScopes scopes = ScopeAnalyzer.analyze(file);
        final FileScan scan = new FileScan(file, scopes, context);
        AstWalker.walk(file, scan);
        return scan.records;
    }

    /** State of one classification pass. */
    private final class FileScan implements AstVisitor {

        private final SourceFile file;
        private final FileScopes scopes;
        private final ParseContext context;
        private final ClientCertainty certainty;
        private final IteratorExpansion expansion;
        private final InvalidationPropScanner propScanner;
        private final List<CallSiteRecord> records = new ArrayList<>();

        FileScan(SourceFile file, FileScopes scopes, ParseContext context) {
            this.file = file;
            this.scopes = scopes;
            this.context = context;
            this.certainty = new ClientCertainty(context);
            this.expansion = new IteratorExpansion(scopes, locals, normalizer);
            this.propScanner = new InvalidationPropScanner(resolver, normalizer);
        }

        @Override
        public void visitExpression(Expr expression) {
            if (expression instanceof Expr.Call call) {
                visitCall(call);
            } else if (expression instanceof Expr.Jsx jsx) {
                visitJsx(jsx);
            }
        }

        private void visitCall(Expr.Call call) {
            final SourceLoc loc = locationOf(call);
            if (call.optional()) {
                memberClientCall(call, loc);
                return;
            }

            final ClientCertainty.HookCall hook = certainty.hookCall(call.callee());
            if (hook != null) {
                hookCall(call, hook, loc);
                return;
            }

            if (call.callee() instanceof Expr.Ident id && context.refetchFunctions.containsKey(id.name())) {
                add(Relation.REFETCHES, "refetch", loc, refetchKey(context.refetchFunctions.get(id.name())),
                        Resolution.DYNAMIC, false);
                return;
            }

            memberClientCall(call, loc);
        }

        private void hookCall(Expr.Call call, ClientCertainty.HookCall hook, SourceLoc loc) {
            final Scope scope = scopes.scopeOf(call);
            final List<Expr> hookArgs = locals.resolveArguments(scope, call.arguments());

            List<NormalizedKey> keys = expansion.hookIteratorKeys(scope, hook.hook(), hookArgs);
            if (keys.isEmpty()) {
                keys = expansion.hookStaticCollectionKeys(scope, hook.hook(), hookArgs);
            }
            if (keys.isEmpty()) {
                keys = hookKeys.inferHookKeys(hook.hook(), hookArgs);
            }

            final boolean direct = HookKeyInference.declaresKeyDirectly(call.arguments(), hook.hook());
            for (NormalizedKey key : keys) {
                add(Relation.DECLARES, hook.operation(), loc, key, Resolution.merge(key.resolution(), hook.resolution()), direct);
            }
        }

        private void memberClientCall(Expr.Call call, SourceLoc loc) {
            if (!(call.callee() instanceof Expr.Member member) || member.propertyName() == null) {
                return;
            }
            final String method = member.propertyName();
            final Expr object = member.object();

            if ("refetch".equals(method)) {
                final String objectName = ClientCertainty.leafName(object);
                if (objectName != null && context.refetchObjects.containsKey(objectName)) {
                    add(Relation.REFETCHES, "refetch", loc, refetchKey(context.refetchObjects.get(objectName)),
                            Resolution.DYNAMIC, false);
                    return;
                }
            }

            final Scope scope = scopes.scopeOf(call);
            if (QueryApi.CLIENT_DECLARE_METHODS.contains(method)) {
                final Resolution client = certainty.clientObject(object);
                if (client == null) {
                    return;
                }
                final List<Expr> args = locals.resolveArguments(scope, call.arguments());
                final NormalizedKey key = actionKeys.inferActionKey(method, args);
                add(Relation.DECLARES, method, loc, key, Resolution.merge(client, key.resolution()),
                        HookKeyInference.declaresKeyDirectly(call.arguments(), method));
                return;
            }

            final Relation relation = QueryApi.ACTION_RELATIONS.get(method);
            final Resolution client = relation != null ? certainty.clientObject(object) : null;
            if (client == null) {
                return;
            }

            final List<Expr> args = locals.resolveArguments(scope, call.arguments());
            List<NormalizedKey> keys = expansion.actionKeys(scope, method, args);
            if (keys.isEmpty()) {
                keys = List.of(actionKeys.inferActionKey(method, args));
            }
            for (NormalizedKey key : keys) {
                if (!isSkippedPassThrough(call, scope, key)) {
                    add(relation, method, loc, key, Resolution.merge(client, key.resolution()), false);
                }
            }
        }

        /**
         * An unresolved {@code { queryKey: x }} where x is a local value or a member of one says
         * nothing useful; a parameter passed through is kept as its own node.
         */
        private boolean isSkippedPassThrough(Expr.Call call, Scope scope, NormalizedKey key) {
            if (!QueryKeys.isUnresolved(key) && !QueryKeys.isWildcard(key)) {
                return false;
            }
            if (!(call.firstArgument() instanceof Expr.ObjectLit options)) {
                return false;
            }
            final Expr value = QueryKeyNormalizer.findProperty(options, "queryKey");
            if (value instanceof Expr.Ident id) {
                return !isParam(scope, id.name());
            }
            if (value instanceof Expr.Member member && member.propertyName() != null) {
                return !(member.object() instanceof Expr.Ident object && isParam(scope, object.name()));
            }
            return false;
        }

        private boolean isParam(Scope scope, String name) {
            final Binding binding = scope.lookup(name);
            return binding != null && binding.kind() == Binding.Kind.PARAM;
        }

        private NormalizedKey refetchKey(NormalizedKey tracked) {
            return tracked != null ? tracked : normalizer.normalize(null, MatchMode.ALL, true);
        }

        private void visitJsx(Expr.Jsx jsx) {
            Expr value = null;
            for (Expr.JsxAttribute attribute : jsx.attributes()) {
                if (QueryApi.INVALIDATION_PROP.equals(attribute.name())) {
                    value = attribute.value();
                    break;
                }
            }
            if (value == null) {
                return;
            }

            final Set<String> emitted = new HashSet<>();
            for (InvalidationPropScanner.KeyExpression candidate : propScanner.keyExpressions(value)) {
                final NormalizedKey key = normalizer.normalize(candidate.expression(), MatchMode.PREFIX, false);
                if (QueryKeys.isWildcard(key) || QueryKeys.isUnresolved(key) || InvalidationPropScanner.isIgnorable(key)) {
                    continue;
                }
                final SourceLoc loc = locationOf(candidate.locationNode());
                if (emitted.add(key.id() + ":" + key.display() + ":" + loc.line() + ":" + loc.column())) {
                    add(Relation.INVALIDATES, "invalidateQueries", loc, key, Resolution.DYNAMIC, false);
                }
            }
        }

        private SourceLoc locationOf(Expr node) {
            final Loc loc = file.locationOf(node);
            return new SourceLoc(loc.line(), loc.column());
        }

        private void add(Relation relation, String operation, SourceLoc loc, NormalizedKey key,
                         Resolution resolution, boolean declaresDirectly) {
            records.add(new CallSiteRecord(relation, operation, file.path(), loc, key, resolution, declaresDirectly));
        }
    }
}
