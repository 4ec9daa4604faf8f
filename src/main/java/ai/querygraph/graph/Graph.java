package ai.querygraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import ai.querygraph.model.ParseError;
import ai.querygraph.model.Relation;
import ai.querygraph.model.Resolution;
import ai.querygraph.model.SourceLoc;

/**
 * Fully built graph, ready for writing.
 * - file -> action -> queryKey nodes
 * - parse errors with display paths
 */
public record Graph(
        List<Node> nodes,
        List<Edge> edges,
        Summary summary,
        List<ParseError> parseErrors
) {
    public Graph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        Objects.requireNonNull(summary, "summary");
        parseErrors = List.copyOf(parseErrors);
    }

    public enum NodeKind {
        FILE("file"),
        ACTION("action"),
        QUERY_KEY("queryKey");

        private final String label;

        NodeKind(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Node(
            String id,
            NodeKind kind,
            String label,
            String file,        // null for key nodes
            SourceLoc loc,      // actions only
            Resolution resolution,
            Map<String, Object> metrics
    ) {
        public Node {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(resolution, "resolution");
            metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        }

        public Object metric(String name) {
            return metrics.get(name);
        }
    }

    public record Edge(
            String id,
            String source,
            String target,
            Relation relation,
            Resolution resolution
    ) {
    }

    public record Summary(
            int files,
            int actions,
            int queryKeys,
            int parseErrors
    ) {
    }

    public List<Node> nodesOfKind(NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).toList();
    }

    public Node node(String id) {
        for (Node node : nodes) {
            if (node.id().equals(id)) {
                return node;
            }
        }
        return null;
    }
}
