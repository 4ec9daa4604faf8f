package ai.querygraph.ast;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Structural rewrites and queries over expressions. Trees are immutable, so rewrites copy the changed spine. */
public final class Substitution {

    private Substitution() {
    }

    /**
     * Replaces every reference to {@code name} with {@code replacement}. Non-computed member properties
     * and object keys are not references; function bodies are left alone.
     */
    public static Expr replaceIdentifier(Expr expression, String name, Expr replacement) {
        if (expression == null) {
            return null;
        }
        return switch (expression.kind()) {
            case IDENTIFIER -> ((Expr.Ident) expression).name().equals(name) ? replacement : expression;
            case ARRAY -> new Expr.ArrayLit(replaceAll(((Expr.ArrayLit) expression).elements(), name, replacement));
            case SPREAD -> new Expr.Spread(replaceIdentifier(((Expr.Spread) expression).argument(), name, replacement));
            case OBJECT -> replaceInObject((Expr.ObjectLit) expression, name, replacement);
            case MEMBER -> {
                final Expr.Member m = (Expr.Member) expression;
                yield new Expr.Member(
                        replaceIdentifier(m.object(), name, replacement),
                        m.computed() ? replaceIdentifier(m.property(), name, replacement) : m.property(),
                        m.computed(),
                        m.optional());
            }
            case CALL -> {
                final Expr.Call c = (Expr.Call) expression;
                yield new Expr.Call(
                        replaceIdentifier(c.callee(), name, replacement),
                        replaceAll(c.arguments(), name, replacement),
                        c.typeArguments(),
                        c.optional());
            }
            case TEMPLATE -> {
                final Expr.Template t = (Expr.Template) expression;
                yield new Expr.Template(t.quasis(), replaceAll(t.expressions(), name, replacement));
            }
            case UNARY -> {
                final Expr.Unary u = (Expr.Unary) expression;
                yield new Expr.Unary(u.operator(), replaceIdentifier(u.argument(), name, replacement));
            }
            case UPDATE -> {
                final Expr.Update u = (Expr.Update) expression;
                yield new Expr.Update(u.operator(), u.prefix(), replaceIdentifier(u.argument(), name, replacement));
            }
            case BINARY -> {
                final Expr.Binary b = (Expr.Binary) expression;
                yield new Expr.Binary(b.operator(),
                        replaceIdentifier(b.left(), name, replacement),
                        replaceIdentifier(b.right(), name, replacement));
            }
            case LOGICAL -> {
                final Expr.Logical l = (Expr.Logical) expression;
                yield new Expr.Logical(l.operator(),
                        replaceIdentifier(l.left(), name, replacement),
                        replaceIdentifier(l.right(), name, replacement));
            }
            case ASSIGNMENT -> {
                final Expr.Assignment a = (Expr.Assignment) expression;
                final Pattern target = a.target() instanceof Pattern.Target t
                        ? new Pattern.Target(replaceIdentifier(t.expression(), name, replacement))
                        : a.target();
                yield new Expr.Assignment(a.operator(), target, replaceIdentifier(a.value(), name, replacement));
            }
            case CONDITIONAL -> {
                final Expr.Conditional c = (Expr.Conditional) expression;
                yield new Expr.Conditional(
                        replaceIdentifier(c.test(), name, replacement),
                        replaceIdentifier(c.consequent(), name, replacement),
                        replaceIdentifier(c.alternate(), name, replacement));
            }
            case SEQUENCE -> new Expr.Sequence(
                    replaceAll(((Expr.Sequence) expression).expressions(), name, replacement));
            case STRING, NUMBER, BOOLEAN, NULL, BIGINT, PRIVATE_NAME, HOLE, NEW, AWAIT, FUNCTION, CLASS, JSX, OPAQUE ->
                    expression;
        };
    }

    private static List<Expr> replaceAll(List<Expr> expressions, String name, Expr replacement) {
        final List<Expr> out = new ArrayList<>(expressions.size());
        for (Expr e : expressions) {
            out.add(replaceIdentifier(e, name, replacement));
        }
        return out;
    }

    private static Expr replaceInObject(Expr.ObjectLit object, String name, Expr replacement) {
        final List<Expr.Prop> props = new ArrayList<>(object.properties().size());
        for (Expr.Prop prop : object.properties()) {
            if (prop instanceof Expr.SpreadProp s) {
                props.add(new Expr.SpreadProp(replaceIdentifier(s.argument(), name, replacement)));
            } else if (prop instanceof Expr.Property p) {
                final Expr key = p.computed() ? replaceIdentifier(p.key(), name, replacement) : p.key();
                final Expr value = replaceIdentifier(p.value(), name, replacement);
                final boolean shorthand = p.shorthand()
                        && key instanceof Expr.Ident k
                        && value instanceof Expr.Ident v
                        && k.name().equals(v.name());
                props.add(new Expr.Property(key, value, p.computed(), shorthand));
            } else {
                props.add(prop);
            }
        }
        return new Expr.ObjectLit(props);
    }

    /** Names of identifiers in reference position, in first-seen order. Parameter lists are skipped. */
    public static Set<String> referencedNames(Expr expression) {
        final Set<String> names = new LinkedHashSet<>();
        if (expression == null) {
            return names;
        }
        new AstWalker(new AstVisitor() {
            @Override
            public void visitExpression(Expr e) {
                if (e instanceof Expr.Ident id) {
                    names.add(id.name());
                }
            }
        }).expression(expression);
        return names;
    }

    public static boolean containsIdentifier(Expr expression, String name) {
        return referencedNames(expression).contains(name);
    }
}
