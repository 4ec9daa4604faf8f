package ai.querygraph.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.querygraph.key.QueryKeys;
import ai.querygraph.model.CallSiteRecord;
import ai.querygraph.model.Ids;
import ai.querygraph.model.NormalizedKey;
import ai.querygraph.model.ParseError;
import ai.querygraph.model.Relation;
import ai.querygraph.model.Resolution;
import ai.querygraph.model.SourceLoc;
import ai.querygraph.modules.ProjectScopeResolver;
import ai.querygraph.modules.WorkspaceLayout;

/**
 * Builds the file -> action -> queryKey graph from call-site records.
 * <p>
 * Pass 1 creates file and action nodes and collects declared keys per project scope.
 * Pass 2 links every mutation to the declared keys it reaches within its own scope, or to its
 * own key node when it reaches none. Key nodes that nothing declares and no concrete
 * {@code setQueryData} writes are pruned at the end, and the per-node counts are recomputed
 * from what survives.
 */
public final class GraphBuilder {

    private final WorkspaceLayout layout;
    private final ProjectScopeResolver scopes;

    public GraphBuilder(WorkspaceLayout layout) {
        Objects.requireNonNull(layout, "layout");
        this.layout = layout.roots().isEmpty() ? WorkspaceLayout.currentDirectory() : layout;
        this.scopes = new ProjectScopeResolver(this.layout);
    }

    public Graph build(List<CallSiteRecord> records, List<ParseError> parseErrors) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(parseErrors, "parseErrors");

        final Map<String, MutableNode> nodes = new LinkedHashMap<>();
        final Map<String, Graph.Edge> edges = new LinkedHashMap<>();

        final Map<String, String> scopeByFile = new HashMap<>();
        final Map<String, Map<String, Integer>> recordsPerScopeByKey = new HashMap<>();
        final Map<String, NormalizedKey> declaredKeyByNode = new LinkedHashMap<>();
        final Map<String, Set<String>> declaredScopesByNode = new HashMap<>();
        final List<PendingLink> pending = new ArrayList<>(records.size());

        // Step 1: file/action/key nodes, declared keys per scope
        for (int index = 0; index < records.size(); index++) {
            final CallSiteRecord record = records.get(index);
            final String file = record.file();
            final String displayFile = layout.displayPath(file);
            final String scope = scopes.scopeOf(file);
            scopeByFile.put(file, scope);

            final String fileNodeId = Ids.fileNodeId(file);
            final String actionNodeId = Ids.actionNodeId(record, index);
            final NormalizedKey key = record.queryKey();
            final boolean wildcard = QueryKeys.isWildcard(key);
            final String keyNodeId = wildcard ? null : Ids.keyNodeId(key.id());

            nodes.computeIfAbsent(fileNodeId,
                    id -> new MutableNode(id, Graph.NodeKind.FILE, displayFile, file, null, Resolution.STATIC));

            nodes.computeIfAbsent(actionNodeId, id -> {
                final MutableNode action = new MutableNode(id, Graph.NodeKind.ACTION, record.operation(), file,
                        record.loc(), record.resolution());
                action.metrics.put("relation", record.relation());
                action.metrics.put("displayFile", displayFile);
                action.metrics.put("projectScope", scope);
                action.metrics.put("declaresDirectly", record.declaresDirectly() ? 1 : 0);
                return action;
            });

            if (keyNodeId != null) {
                nodes.computeIfAbsent(keyNodeId, id -> {
                    final MutableNode keyNode = new MutableNode(id, Graph.NodeKind.QUERY_KEY, key.display(), null,
                            null, key.resolution());
                    keyNode.metrics.put("matchMode", key.matchMode());
                    keyNode.metrics.put("rootSegment", key.segments().isEmpty() ? "unknown" : key.segments().get(0));
                    return keyNode;
                });
                recordsPerScopeByKey.computeIfAbsent(keyNodeId, k -> new HashMap<>()).merge(scope, 1, Integer::sum);

                if (record.relation() == Relation.DECLARES) {
                    declaredKeyByNode.putIfAbsent(keyNodeId, key);
                    declaredScopesByNode.computeIfAbsent(keyNodeId, k -> new HashSet<>()).add(scope);
                }
            }

            putEdge(edges, fileNodeId, actionNodeId, record.relation(), record.resolution());
            pending.add(new PendingLink(actionNodeId, record, scope, keyNodeId));
        }

        // Step 2: action -> key links
        final Map<String, Set<String>> keysByFile = new HashMap<>();
        final Map<String, Set<String>> filesByKey = new HashMap<>();
        final Map<String, Set<String>> declareFilesByKey = new HashMap<>();
        final Map<String, Integer> declareCallsitesByKey = new HashMap<>();
        final Set<String> setAnchoredKeys = new HashSet<>();

        for (PendingLink link : pending) {
            final CallSiteRecord record = link.record();
            for (String target : targets(link, declaredKeyByNode, declaredScopesByNode)) {
                if (record.relation() == Relation.SETS && KeyMatcher.isConcreteSetAnchor(record.queryKey())) {
                    setAnchoredKeys.add(target);
                }
                putEdge(edges, link.actionNodeId(), target, record.relation(), record.resolution());

                keysByFile.computeIfAbsent(record.file(), k -> new HashSet<>()).add(target);
                filesByKey.computeIfAbsent(target, k -> new HashSet<>()).add(record.file());
                if (record.relation() == Relation.DECLARES) {
                    declareFilesByKey.computeIfAbsent(target, k -> new HashSet<>()).add(record.file());
                    declareCallsitesByKey.merge(target, 1, Integer::sum);
                }
            }
        }

        for (MutableNode node : nodes.values()) {
            if (node.kind == Graph.NodeKind.FILE) {
                node.metrics.put("affectedKeys", keysByFile.getOrDefault(node.file, Set.of()).size());
                node.metrics.put("projectScope", scopeByFile.getOrDefault(node.file, ProjectScopeResolver.DEFAULT_SCOPE));
            } else if (node.kind == Graph.NodeKind.QUERY_KEY) {
                node.metrics.put("affectedFiles", filesByKey.getOrDefault(node.id, Set.of()).size());
                node.metrics.put("declaredFiles", declareFilesByKey.getOrDefault(node.id, Set.of()).size());
                node.metrics.put("declaredCallsites", declareCallsitesByKey.getOrDefault(node.id, 0));
                node.metrics.put("projectScope", primaryScope(recordsPerScopeByKey.get(node.id)));
            }
        }

        // Step 3: prune keys nothing declares or concretely sets
        final Map<String, MutableNode> kept = new LinkedHashMap<>();
        for (MutableNode node : nodes.values()) {
            if (node.kind != Graph.NodeKind.QUERY_KEY
                    || declareCallsitesByKey.getOrDefault(node.id, 0) > 0
                    || setAnchoredKeys.contains(node.id)) {
                kept.put(node.id, node);
            }
        }
        final List<Graph.Edge> keptEdges = new ArrayList<>();
        for (Graph.Edge edge : edges.values()) {
            if (kept.containsKey(edge.source()) && kept.containsKey(edge.target())) {
                keptEdges.add(edge);
            }
        }
        recountReach(kept, keptEdges);

        final List<ParseError> mappedErrors = new ArrayList<>(parseErrors.size());
        for (ParseError error : parseErrors) {
            mappedErrors.add(new ParseError(layout.displayPath(error.file()), error.message()));
        }

        final List<Graph.Node> out = new ArrayList<>(kept.size());
        int files = 0;
        int actions = 0;
        int keys = 0;
        for (MutableNode node : kept.values()) {
            out.add(node.freeze());
            switch (node.kind) {
                case FILE -> files++;
                case ACTION -> actions++;
                case QUERY_KEY -> keys++;
            }
        }
        return new Graph(out, keptEdges, new Graph.Summary(files, actions, keys, mappedErrors.size()), mappedErrors);
    }

    private static List<String> targets(PendingLink link,
                                        Map<String, NormalizedKey> declaredKeyByNode,
                                        Map<String, Set<String>> declaredScopesByNode) {
        final CallSiteRecord record = link.record();
        if (record.relation() == Relation.DECLARES) {
            return link.keyNodeId() != null ? List.of(link.keyNodeId()) : List.of();
        }

        final List<String> matched = new ArrayList<>();
        for (Map.Entry<String, NormalizedKey> declared : declaredKeyByNode.entrySet()) {
            if (!declaredScopesByNode.getOrDefault(declared.getKey(), Set.of()).contains(link.scope())) {
                continue;
            }
            if (link.keyNodeId() == null || KeyMatcher.affects(record.queryKey(), declared.getValue())) {
                matched.add(declared.getKey());
            }
        }
        if (link.keyNodeId() == null) {
            return matched;
        }
        return matched.isEmpty() ? List.of(link.keyNodeId()) : matched;
    }

    /** Scope with the most records; ties go to the lexically first scope. */
    private static String primaryScope(Map<String, Integer> recordsPerScope) {
        if (recordsPerScope == null || recordsPerScope.isEmpty()) {
            return ProjectScopeResolver.DEFAULT_SCOPE;
        }
        return recordsPerScope.entrySet().stream()
                .min(Comparator.<Map.Entry<String, Integer>>comparingInt(e -> -e.getValue())
                        .thenComparing(Map.Entry::getKey))
                .map(Map.Entry::getKey)
                .orElse(ProjectScopeResolver.DEFAULT_SCOPE);
    }

    /** affectedKeys/affectedFiles over surviving file -> action -> key paths. */
    private static void recountReach(Map<String, MutableNode> nodes, List<Graph.Edge> edges) {
        final Map<String, Set<String>> filesByAction = new HashMap<>();
        final Map<String, Set<String>> keysByAction = new LinkedHashMap<>();
        for (Graph.Edge edge : edges) {
            final MutableNode source = nodes.get(edge.source());
            final MutableNode target = nodes.get(edge.target());
            if (source.kind == Graph.NodeKind.FILE && target.kind == Graph.NodeKind.ACTION) {
                filesByAction.computeIfAbsent(target.id, k -> new LinkedHashSet<>()).add(source.id);
            } else if (source.kind == Graph.NodeKind.ACTION && target.kind == Graph.NodeKind.QUERY_KEY) {
                keysByAction.computeIfAbsent(source.id, k -> new LinkedHashSet<>()).add(target.id);
            }
        }

        final Map<String, Set<String>> keysByFile = new HashMap<>();
        final Map<String, Set<String>> filesByKey = new HashMap<>();
        for (Map.Entry<String, Set<String>> entry : keysByAction.entrySet()) {
            for (String fileId : filesByAction.getOrDefault(entry.getKey(), Set.of())) {
                for (String keyId : entry.getValue()) {
                    keysByFile.computeIfAbsent(fileId, k -> new HashSet<>()).add(keyId);
                    filesByKey.computeIfAbsent(keyId, k -> new HashSet<>()).add(fileId);
                }
            }
        }

        for (MutableNode node : nodes.values()) {
            if (node.kind == Graph.NodeKind.FILE) {
                node.metrics.put("affectedKeys", keysByFile.getOrDefault(node.id, Set.of()).size());
            } else if (node.kind == Graph.NodeKind.QUERY_KEY) {
                node.metrics.put("affectedFiles", filesByKey.getOrDefault(node.id, Set.of()).size());
            }
        }
    }

    private static void putEdge(Map<String, Graph.Edge> edges, String source, String target,
                                Relation relation, Resolution resolution) {
        final String id = source + "->" + target + ":" + relation.label();
        edges.putIfAbsent(id, new Graph.Edge(id, source, target, relation, resolution));
    }

    private record PendingLink(String actionNodeId, CallSiteRecord record, String scope, String keyNodeId) {
    }

    private static final class MutableNode {
        final String id;
        final Graph.NodeKind kind;
        final String label;
        final String file;
        final SourceLoc loc;
        final Resolution resolution;
        final Map<String, Object> metrics = new LinkedHashMap<>();

        private MutableNode(String id, Graph.NodeKind kind, String label, String file,
                            SourceLoc loc, Resolution resolution) {
            this.id = id;
            this.kind = kind;
            this.label = label;
            this.file = file;
            this.loc = loc;
            this.resolution = resolution;
        }

        Graph.Node freeze() {
            return new Graph.Node(id, kind, label, file, loc, resolution, metrics);
        }
    }
}
