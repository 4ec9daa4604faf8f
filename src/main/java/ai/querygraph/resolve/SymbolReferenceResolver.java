package ai.querygraph.resolve;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.querygraph.ast.AstVisitor;
import ai.querygraph.ast.AstWalker;
import ai.querygraph.ast.Expr;
import ai.querygraph.ast.Stmt;
import ai.querygraph.modules.ModuleResolver;
import ai.querygraph.modules.PosixPaths;
import ai.querygraph.symbols.FileSymbolTable;
import ai.querygraph.symbols.FunctionReturns;
import ai.querygraph.symbols.ImportBinding;
import ai.querygraph.symbols.ReExport;
import ai.querygraph.symbols.SymbolIndex;
import ai.querygraph.symbols.SymbolTableBuilder;

/**
 * Resolves references for one entry file against the symbol index of the run.
 * <p>
 * Every lookup carries a depth counter (capped at {@link #MAX_DEPTH}) and a seen-set keyed by
 * lookup kind, file and name, so cyclic re-exports and alias chains terminate. Expressions taken
 * from another file are tagged with that file; later lookups on them start from their origin.
 * <p>
 * Not thread-safe: classification creates one instance per file.
 */
public final class SymbolReferenceResolver implements QueryKeyResolver {

    public static final int MAX_DEPTH = 24;

    private final String entryFile;
    private final SymbolIndex index;
    private final ModuleResolver modules;
    private final Map<Object, String> origins = new IdentityHashMap<>();

    public SymbolReferenceResolver(String entryFile, SymbolIndex index, ModuleResolver modules) {
        this.entryFile = Objects.requireNonNull(entryFile, "entryFile");
        this.index = Objects.requireNonNull(index, "index");
        this.modules = Objects.requireNonNull(modules, "modules");
    }

    @Override
    public Expr resolveReference(Expr expression) {
        if (expression == null) {
            return null;
        }
        final String fromFile = originOf(expression);
        return mark(resolveReference(fromFile, expression, 0, new HashSet<>()), fromFile);
    }

    @Override
    public Expr resolveCallResult(Expr callee) {
        if (callee == null) {
            return null;
        }
        final String fromFile = originOf(callee);
        return mark(resolveCallResult(fromFile, callee, 0, new HashSet<>()), fromFile);
    }

    /** File an expression was taken from; the entry file for anything not produced by this resolver. */
    public String originOf(Expr expression) {
        final String origin = origins.get(expression);
        return origin != null ? origin : entryFile;
    }

    // ---------------------------------------------------------------------
    // origin tagging

    private Expr mark(Expr expression, String file) {
        if (expression == null || origins.containsKey(expression)) {
            return expression;
        }
        new AstWalker(new AstVisitor() {
            @Override
            public void visitExpression(Expr e) {
                origins.putIfAbsent(e, file);
            }
        }).expression(expression);
        return expression;
    }

    // ---------------------------------------------------------------------
    // exports and imports

    private Expr resolveExportValue(String targetFile, String exportName, int depth, Set<String> seen) {
        return resolveExport(targetFile, exportName, depth, seen, false);
    }

    private Expr resolveExportFunctionReturn(String targetFile, String exportName, int depth, Set<String> seen) {
        return resolveExport(targetFile, exportName, depth, seen, true);
    }

    private Expr resolveExport(String targetFile, String exportName, int depth, Set<String> seen, boolean function) {
        if (depth > MAX_DEPTH) {
            return null;
        }
        if (!seen.add((function ? "exp-fn:" : "exp-value:") + targetFile + ":" + exportName)) {
            return null;
        }
        final FileSymbolTable symbols = index.file(targetFile);
        if (symbols == null) {
            return null;
        }

        final String localName = symbols.exportedLocal(exportName);
        if (localName != null) {
            return function
                    ? resolveLocalFunctionReturn(targetFile, localName, depth + 1, seen)
                    : resolveLocalValue(targetFile, localName, depth + 1, seen);
        }

        for (ReExport reExport : symbols.reExports()) {
            if (!reExport.all() && !exportName.equals(reExport.exported())) {
                continue;
            }
            final String nestedFile = modules.resolve(targetFile, reExport.source());
            if (nestedFile == null) {
                continue;
            }
            final String nestedName = reExport.all() || reExport.imported() == null ? exportName : reExport.imported();
            final Expr value = resolveExport(nestedFile, nestedName, depth + 1, seen, function);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private Expr resolveImported(String fromFile, ImportBinding binding, int depth, Set<String> seen, boolean function) {
        if (binding.kind() == Stmt.ImportKind.NAMESPACE) {
            return null;
        }
        final String targetFile = modules.resolve(fromFile, binding.source());
        if (targetFile == null) {
            return null;
        }
        final String exportName = binding.kind() == Stmt.ImportKind.DEFAULT || binding.imported() == null
                ? "default"
                : binding.imported();
        return function
                ? resolveExportFunctionReturn(targetFile, exportName, depth + 1, seen)
                : resolveExportValue(targetFile, exportName, depth + 1, seen);
    }

    private Expr resolveNamespaceMember(String fromFile, String namespace, String member, int depth, Set<String> seen) {
        final FileSymbolTable symbols = index.file(fromFile);
        final ImportBinding binding = symbols != null ? symbols.importBinding(namespace) : null;
        if (binding == null || binding.kind() != Stmt.ImportKind.NAMESPACE) {
            return null;
        }
        final String targetFile = modules.resolve(fromFile, binding.source());
        if (targetFile == null) {
            return null;
        }
        return resolveExportValue(targetFile, member, depth + 1, seen);
    }

    // ---------------------------------------------------------------------
    // locals

    private Expr resolveLocalValue(String fromFile, String localName, int depth, Set<String> seen) {
        if (depth > MAX_DEPTH || !seen.add("local-value:" + fromFile + ":" + localName)) {
            return null;
        }
        final FileSymbolTable symbols = index.file(fromFile);
        if (symbols == null) {
            return null;
        }

        final Expr localValue = symbols.value(localName);
        if (localValue != null) {
            if (localValue instanceof Expr.Ident alias && !alias.name().equals(localName)) {
                final Expr chased = resolveLocalValue(fromFile, alias.name(), depth + 1, seen);
                return mark(chased != null ? chased : localValue, fromFile);
            }
            return mark(localValue, fromFile);
        }

        final Expr localFunctionReturn = symbols.functionReturn(localName);
        if (localFunctionReturn != null) {
            return mark(localFunctionReturn, fromFile);
        }

        final ImportBinding binding = symbols.importBinding(localName);
        return binding != null ? resolveImported(fromFile, binding, depth + 1, seen, false) : null;
    }

    private Expr resolveLocalFunctionReturn(String fromFile, String localName, int depth, Set<String> seen) {
        if (depth > MAX_DEPTH || !seen.add("local-fn:" + fromFile + ":" + localName)) {
            return null;
        }
        final FileSymbolTable symbols = index.file(fromFile);
        if (symbols == null) {
            return null;
        }

        final Expr localFunctionReturn = symbols.functionReturn(localName);
        if (localFunctionReturn != null) {
            return mark(localFunctionReturn, fromFile);
        }

        final Expr localValue = symbols.value(localName);
        if (localValue != null) {
            if (localValue instanceof Expr.Ident alias && !alias.name().equals(localName)) {
                return resolveLocalFunctionReturn(fromFile, alias.name(), depth + 1, seen);
            }
            if (localValue instanceof Expr.FunctionExpr fn) {
                return mark(FunctionReturns.extract(fn), fromFile);
            }
            return null;
        }

        final ImportBinding binding = symbols.importBinding(localName);
        return binding != null ? resolveImported(fromFile, binding, depth + 1, seen, true) : null;
    }

    private record FactoryCandidate(String file, Expr returned, int score) {
    }

    /**
     * Last resort for key factories: the uniquely closest file in the workspace that defines a function
     * with this name. Equally close candidates in different files make the lookup ambiguous.
     */
    private Expr resolveWorkspaceFunctionReturnByName(String fromFile, String functionName) {
        if (!looksLikeKeyFactory(functionName)) {
            return null;
        }

        final List<FactoryCandidate> candidates = new ArrayList<>();
        for (FileSymbolTable symbols : index.tables()) {
            final int score = PosixPaths.commonPrefixLength(fromFile, symbols.file());
            final Expr fromFunctions = symbols.functionReturn(functionName);
            if (fromFunctions != null) {
                candidates.add(new FactoryCandidate(symbols.file(), fromFunctions, score));
                continue;
            }
            if (symbols.value(functionName) instanceof Expr.FunctionExpr fn) {
                final Expr returned = FunctionReturns.extract(fn);
                if (returned != null) {
                    candidates.add(new FactoryCandidate(symbols.file(), returned, score));
                }
            }
        }
        if (candidates.isEmpty()) {
            return null;
        }

        candidates.sort(Comparator.comparingInt((FactoryCandidate c) -> -c.score())
                .thenComparing(FactoryCandidate::file));
        final FactoryCandidate best = candidates.get(0);
        if (candidates.size() > 1) {
            final FactoryCandidate second = candidates.get(1);
            if (second.score() == best.score() && !second.file().equals(best.file())) {
                return null;
            }
        }
        return mark(best.returned(), best.file());
    }

    // "queryKey" itself is a factory name here, unlike in the symbol index
    static boolean looksLikeKeyFactory(String name) {
        return "queryKey".equalsIgnoreCase(name) || SymbolTableBuilder.isKeySymbolName(name);
    }

    // ---------------------------------------------------------------------
    // expressions

    private Expr resolveObjectPropertyValue(String fromFile, Expr.ObjectLit object, String propertyName,
                                           int depth, Set<String> seen) {
        if (depth > MAX_DEPTH) {
            return null;
        }
        final List<Expr.Prop> properties = object.properties();
        for (int i = properties.size() - 1; i >= 0; i--) {
            final Expr.Prop prop = properties.get(i);
            if (prop instanceof Expr.Property p) {
                if (propertyName.equals(p.staticKey())) {
                    return mark(p.value(), fromFile);
                }
                continue;
            }
            if (!(prop instanceof Expr.SpreadProp spread)) {
                continue;
            }
            final Expr resolved = resolveReference(fromFile, spread.argument(), depth + 1, seen);
            final Expr spreadValue = resolved != null ? resolved : spread.argument();
            if (spreadValue instanceof Expr.ObjectLit nestedObject) {
                final Expr nested = resolveObjectPropertyValue(fromFile, nestedObject, propertyName, depth + 1, seen);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    private Expr resolveReference(String fromFile, Expr node, int depth, Set<String> seen) {
        if (depth > MAX_DEPTH) {
            return null;
        }
        if (node instanceof Expr.Ident id) {
            return resolveLocalValue(fromFile, id.name(), depth + 1, seen);
        }
        if (!(node instanceof Expr.Member member) || member.optional()) {
            return null;
        }

        final String propertyName = propertyName(fromFile, member, depth, seen);
        if (member.object() instanceof Expr.Ident namespace && propertyName != null) {
            final Expr namespaceValue = resolveNamespaceMember(fromFile, namespace.name(), propertyName, depth + 1, seen);
            if (namespaceValue != null) {
                return namespaceValue;
            }
        }

        final Expr resolvedObjectOrNull = resolveReference(fromFile, member.object(), depth + 1, seen);
        final Expr resolvedObject = resolvedObjectOrNull != null ? resolvedObjectOrNull : member.object();
        if (propertyName == null) {
            return null;
        }

        if (resolvedObject instanceof Expr.ObjectLit object) {
            return resolveObjectPropertyValue(fromFile, object, propertyName, depth + 1, seen);
        }

        if (resolvedObject instanceof Expr.Call call && !call.optional()) {
            final Expr fromCall = memberOfCall(fromFile, call, propertyName, depth, seen);
            if (fromCall != null) {
                return fromCall;
            }
            final Expr nestedResult = resolveCallResult(fromFile, call.callee(), depth + 1, seen);
            if (nestedResult instanceof Expr.ObjectLit object) {
                return resolveObjectPropertyValue(fromFile, object, propertyName, depth + 1, seen);
            }
            if (nestedResult instanceof Expr.Call nestedCall && !nestedCall.optional()) {
                final Expr fromNestedCall = memberOfCall(fromFile, nestedCall, propertyName, depth, seen);
                if (fromNestedCall != null) {
                    return fromNestedCall;
                }
            }
        }

        if (resolvedObject instanceof Expr.ArrayLit array) {
            return arrayElement(fromFile, array, propertyName);
        }
        return null;
    }

    /** {@code call(...).prop} where the call's first argument carries the value. */
    private Expr memberOfCall(String fromFile, Expr.Call call, String propertyName, int depth, Set<String> seen) {
        if ("queryKey".equals(propertyName)) {
            final Expr fromOptions = queryKeyPropertyFromCall(call);
            if (fromOptions != null) {
                return fromOptions;
            }
        }

        final Expr wrapped = call.firstArgument();
        if (wrapped == null || wrapped instanceof Expr.Spread) {
            return null;
        }
        final boolean singleLiteral = call.arguments().size() == 1
                && (wrapped instanceof Expr.ObjectLit || wrapped instanceof Expr.ArrayLit);
        if (!isIdentityWrapperCall(call.callee()) && !singleLiteral) {
            return null;
        }

        final Expr resolved = resolveReference(fromFile, wrapped, depth + 1, seen);
        final Expr value = resolved != null ? resolved : wrapped;
        if (value instanceof Expr.ObjectLit object) {
            return resolveObjectPropertyValue(fromFile, object, propertyName, depth + 1, seen);
        }
        if (value instanceof Expr.ArrayLit array) {
            return arrayElement(fromFile, array, propertyName);
        }
        return null;
    }

    private Expr arrayElement(String fromFile, Expr.ArrayLit array, String propertyName) {
        final int position = parseIndex(propertyName);
        if (position < 0 || position >= array.elements().size()) {
            return null;
        }
        final Expr element = array.elements().get(position);
        if (element instanceof Expr.Hole || element instanceof Expr.Spread) {
            return null;
        }
        return mark(element, fromFile);
    }

    private Expr resolveCallResult(String fromFile, Expr callee, int depth, Set<String> seen) {
        if (depth > MAX_DEPTH) {
            return null;
        }

        if (callee instanceof Expr.Ident id) {
            final Expr localFunctionReturn = resolveLocalFunctionReturn(fromFile, id.name(), depth + 1, seen);
            if (localFunctionReturn != null) {
                return localFunctionReturn;
            }
            final Expr localValue = resolveLocalValue(fromFile, id.name(), depth + 1, seen);
            if (localValue == null) {
                return resolveWorkspaceFunctionReturnByName(fromFile, id.name());
            }
            if (localValue instanceof Expr.FunctionExpr fn) {
                return FunctionReturns.extract(fn);
            }
            return localValue;
        }

        if (!(callee instanceof Expr.Member member) || member.optional()) {
            return null;
        }

        if (member.object() instanceof Expr.Ident namespace && member.propertyName() != null) {
            final Expr namespaceFunction =
                    resolveNamespaceMember(fromFile, namespace.name(), member.propertyName(), depth + 1, seen);
            if (namespaceFunction != null) {
                return functionResult(fromFile, namespaceFunction, depth, seen);
            }
        }

        final Expr resolvedReference = resolveReference(fromFile, member, depth + 1, seen);
        return resolvedReference != null ? functionResult(fromFile, resolvedReference, depth, seen) : null;
    }

    private Expr functionResult(String fromFile, Expr function, int depth, Set<String> seen) {
        if (function instanceof Expr.FunctionExpr fn) {
            return FunctionReturns.extract(fn);
        }
        if (function instanceof Expr.Ident id) {
            return resolveLocalFunctionReturn(fromFile, id.name(), depth + 1, seen);
        }
        return function;
    }

    // ---------------------------------------------------------------------
    // helpers

    private String propertyName(String fromFile, Expr.Member member, int depth, Set<String> seen) {
        final String staticName = member.propertyName();
        if (staticName != null) {
            return staticName;
        }
        final Expr property = member.property();
        if (property instanceof Expr.Str s) {
            return s.value();
        }
        if (property instanceof Expr.Num n) {
            return n.text();
        }
        final Expr resolvedOrNull = resolveReference(fromFile, property, depth + 1, seen);
        final Expr resolved = resolvedOrNull != null ? resolvedOrNull : property;
        if (resolved instanceof Expr.Str s) {
            return s.value();
        }
        if (resolved instanceof Expr.Num n) {
            return n.text();
        }
        if (resolved instanceof Expr.Bool b) {
            return String.valueOf(b.value());
        }
        return null;
    }

    static Expr queryKeyPropertyFromCall(Expr.Call call) {
        if (!(call.firstArgument() instanceof Expr.ObjectLit options)) {
            return null;
        }
        for (Expr.Prop prop : options.properties()) {
            if (prop instanceof Expr.Property p && !p.computed()
                    && (p.key() instanceof Expr.Ident || p.key() instanceof Expr.Str)
                    && "queryKey".equals(p.staticKey())) {
                return p.value();
            }
        }
        return null;
    }

    /** {@code queryOptions(x)}, {@code infiniteQueryOptions(x)} and {@code Object.freeze(x)} return x. */
    public static boolean isIdentityWrapperCall(Expr callee) {
        if (callee instanceof Expr.Ident id) {
            return "queryOptions".equals(id.name()) || "infiniteQueryOptions".equals(id.name());
        }
        if (callee instanceof Expr.Member member) {
            final String property = member.propertyName();
            if ("queryOptions".equals(property) || "infiniteQueryOptions".equals(property)) {
                return true;
            }
            return "freeze".equals(property) && member.object() instanceof Expr.Ident obj && "Object".equals(obj.name());
        }
        return false;
    }

    /** Leading integer of the text, like JavaScript's parseInt; -1 when there is none. */
    public static int parseIndex(String text) {
        final String trimmed = text.trim();
        int end = 0;
        while (end < trimmed.length() && trimmed.charAt(end) >= '0' && trimmed.charAt(end) <= '9') {
            end++;
        }
        if (end == 0 || end > 9) {
            return -1;
        }
        return Integer.parseInt(trimmed.substring(0, end));
    }
}
