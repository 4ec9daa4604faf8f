package ai.querygraph.ast;

import java.util.HashMap;
import java.util.Map;

public final class Scope {

    private final Scope parent;
    private final boolean functionScope;
    private final Map<String, Binding> bindings = new HashMap<>();

    Scope(Scope parent, boolean functionScope) {
        this.parent = parent;
        this.functionScope = functionScope;
    }

    public Binding lookup(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            final Binding b = s.bindings.get(name);
            if (b != null) {
                return b;
            }
        }
        return null;
    }

    Scope parent() {
        return parent;
    }

    Scope nearestFunctionScope() {
        Scope s = this;
        while (!s.functionScope && s.parent != null) {
            s = s.parent;
        }
        return s;
    }

    void declare(Binding binding) {
        // first declaration wins for var re-declarations
        bindings.putIfAbsent(binding.name(), binding);
    }
}
