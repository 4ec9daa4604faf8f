package ai.querygraph.ast;

import java.util.List;

/** The slice of TypeScript type syntax the client detection looks at. */
public sealed interface TypeNode {

    /** {@code QueryClient}, {@code RQ.QueryClient}, {@code ReturnType<typeof f>}. */
    record Ref(List<String> name, List<TypeNode> typeArguments) implements TypeNode {
        public Ref {
            name = List.copyOf(name);
            typeArguments = List.copyOf(typeArguments);
        }

        public String simpleName() {
            return name.get(name.size() - 1);
        }
    }

    /** {@code typeof x.y}. */
    record Query(List<String> name) implements TypeNode {
        public Query {
            name = List.copyOf(name);
        }
    }

    record Literal(List<Member> members) implements TypeNode {
        public Literal {
            members = List.copyOf(members);
        }
    }

    record Member(String name, TypeNode type) {
    }

    record Union(List<TypeNode> types) implements TypeNode {
        public Union {
            types = List.copyOf(types);
        }
    }

    record Intersection(List<TypeNode> types) implements TypeNode {
        public Intersection {
            types = List.copyOf(types);
        }
    }

    record Other() implements TypeNode {
    }
}
