package ai.querygraph.ast;

import java.util.List;
import java.util.Objects;

/** Binding and assignment targets. Type annotations are kept where a declaration carries one. */
public sealed interface Pattern {

    record Binding(String name, TypeNode type) implements Pattern {
        public Binding {
            Objects.requireNonNull(name, "name");
        }
    }

    record ObjectPattern(List<PatternProperty> properties, TypeNode type) implements Pattern {
        public ObjectPattern {
            properties = List.copyOf(properties);
        }
    }

    /**
     * {@code key: value} inside an object pattern. {@code key} is null for computed keys and rest elements.
     */
    record PatternProperty(String key, Expr computedKey, Pattern value, boolean rest) {
        public PatternProperty {
            Objects.requireNonNull(value, "value");
        }
    }

    record ArrayPattern(List<Pattern> elements, TypeNode type) implements Pattern {
        public ArrayPattern {
            elements = List.copyOf(elements);
        }
    }

    record Defaulted(Pattern target, Expr defaultValue) implements Pattern {
        public Defaulted {
            Objects.requireNonNull(target, "target");
        }
    }

    record Rest(Pattern argument, TypeNode type) implements Pattern {
        public Rest {
            Objects.requireNonNull(argument, "argument");
        }
    }

    /** Non-binding assignment target such as {@code obj.prop = value}. */
    record Target(Expr expression) implements Pattern {
    }

    static TypeNode typeOf(Pattern pattern) {
        if (pattern instanceof Binding b) {
            return b.type();
        }
        if (pattern instanceof ObjectPattern op) {
            return op.type();
        }
        if (pattern instanceof ArrayPattern ap) {
            return ap.type();
        }
        if (pattern instanceof Rest r) {
            return r.type();
        }
        return null;
    }
}
