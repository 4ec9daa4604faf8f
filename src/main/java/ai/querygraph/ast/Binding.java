package ai.querygraph.ast;

import java.util.Objects;

/**
 * A declared name within a {@link Scope}. Depending on {@link Kind} one of the optional fields
 * describes where the value comes from.
 */
public final class Binding {

    public enum Kind {
        MODULE,
        CONST,
        LET,
        VAR,
        FUNCTION,
        CLASS,
        PARAM,
        CATCH
    }

    private final String name;
    private final Kind kind;
    private final Expr init;
    private final Expr.FunctionExpr function;
    private final TypeNode type;
    private boolean constant = true;

    Binding(String name, Kind kind, Expr init, Expr.FunctionExpr function, TypeNode type) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.init = init;
        this.function = function;
        this.type = type;
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    /** Initializer of a plain {@code const x = init} style declarator; null for destructuring. */
    public Expr init() {
        return init;
    }

    /** Declared function for {@link Kind#FUNCTION}; owning function for {@link Kind#PARAM}. */
    public Expr.FunctionExpr function() {
        return function;
    }

    /** Declared type of a parameter, looked through object-pattern type literals. */
    public TypeNode type() {
        return type;
    }

    public boolean constant() {
        return constant;
    }

    void markReassigned() {
        constant = false;
    }
}
