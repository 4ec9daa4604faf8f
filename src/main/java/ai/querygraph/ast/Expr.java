package ai.querygraph.ast;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Closed expression model shared by the symbol index, the resolver and the key normalizer.
 * TypeScript-only wrappers (as, satisfies, non-null, casts) and parentheses never appear here:
 * the parser drops them when the tree is built.
 */
public sealed interface Expr {

    Kind kind();

    enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        BIGINT,
        IDENTIFIER,
        PRIVATE_NAME,
        MEMBER,
        CALL,
        NEW,
        ARRAY,
        HOLE,
        SPREAD,
        OBJECT,
        TEMPLATE,
        CONDITIONAL,
        LOGICAL,
        BINARY,
        UNARY,
        UPDATE,
        ASSIGNMENT,
        SEQUENCE,
        AWAIT,
        FUNCTION,
        CLASS,
        JSX,
        OPAQUE
    }

    record Str(String value) implements Expr {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    record Num(double value) implements Expr {
        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        /** Renders the number the way JavaScript's String(n) does. */
        public String text() {
            return jsNumberText(value);
        }
    }

    record Bool(boolean value) implements Expr {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }
    }

    record Null() implements Expr {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }

    record BigInt(String digits) implements Expr {
        @Override
        public Kind kind() {
            return Kind.BIGINT;
        }
    }

    record Ident(String name) implements Expr {
        public Ident {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public Kind kind() {
            return Kind.IDENTIFIER;
        }
    }

    record PrivateName(String name) implements Expr {
        @Override
        public Kind kind() {
            return Kind.PRIVATE_NAME;
        }
    }

    /**
     * Member access. {@code optional} is set for every link of an optional chain,
     * not only the one written with {@code ?.}.
     */
    record Member(Expr object, Expr property, boolean computed, boolean optional) implements Expr {
        public Member {
            Objects.requireNonNull(object, "object");
            Objects.requireNonNull(property, "property");
        }

        @Override
        public Kind kind() {
            return Kind.MEMBER;
        }

        /** Static property name for {@code a.b}, or null for computed access. */
        public String propertyName() {
            if (!computed && property instanceof Ident id) {
                return id.name();
            }
            return null;
        }
    }

    record Call(Expr callee, List<Expr> arguments, List<TypeNode> typeArguments, boolean optional) implements Expr {
        public Call {
            Objects.requireNonNull(callee, "callee");
            arguments = List.copyOf(arguments);
            typeArguments = List.copyOf(typeArguments);
        }

        @Override
        public Kind kind() {
            return Kind.CALL;
        }

        public Expr firstArgument() {
            return arguments.isEmpty() ? null : arguments.get(0);
        }
    }

    record New(Expr callee, List<Expr> arguments) implements Expr {
        public New {
            Objects.requireNonNull(callee, "callee");
            arguments = List.copyOf(arguments);
        }

        @Override
        public Kind kind() {
            return Kind.NEW;
        }
    }

    record ArrayLit(List<Expr> elements) implements Expr {
        public ArrayLit {
            elements = List.copyOf(elements);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }

    /** Elided array element, as in {@code [a, , b]}. */
    record Hole() implements Expr {
        @Override
        public Kind kind() {
            return Kind.HOLE;
        }
    }

    record Spread(Expr argument) implements Expr {
        public Spread {
            Objects.requireNonNull(argument, "argument");
        }

        @Override
        public Kind kind() {
            return Kind.SPREAD;
        }
    }

    record ObjectLit(List<Prop> properties) implements Expr {
        public ObjectLit {
            properties = List.copyOf(properties);
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }
    }

    sealed interface Prop {
    }

    /** {@code key: value}; {@code key} is an identifier, string or number unless computed. */
    record Property(Expr key, Expr value, boolean computed, boolean shorthand) implements Prop {
        public Property {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        /** Static key text for identifier, string and number keys. */
        public String staticKey() {
            if (computed) {
                return null;
            }
            return switch (key.kind()) {
                case IDENTIFIER -> ((Ident) key).name();
                case STRING -> ((Str) key).value();
                case NUMBER -> ((Num) key).text();
                default -> null;
            };
        }
    }

    record SpreadProp(Expr argument) implements Prop {
        public SpreadProp {
            Objects.requireNonNull(argument, "argument");
        }
    }

    record Method(Expr key, boolean computed, FunctionExpr function) implements Prop {
        public Method {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(function, "function");
        }
    }

    /** Template literal; {@code quasis} holds the cooked text runs, one more than {@code expressions}. */
    record Template(List<String> quasis, List<Expr> expressions) implements Expr {
        public Template {
            quasis = List.copyOf(quasis);
            expressions = List.copyOf(expressions);
        }

        @Override
        public Kind kind() {
            return Kind.TEMPLATE;
        }
    }

    record Conditional(Expr test, Expr consequent, Expr alternate) implements Expr {
        @Override
        public Kind kind() {
            return Kind.CONDITIONAL;
        }
    }

    /** {@code &&}, {@code ||} and {@code ??}. */
    record Logical(String operator, Expr left, Expr right) implements Expr {
        @Override
        public Kind kind() {
            return Kind.LOGICAL;
        }
    }

    record Binary(String operator, Expr left, Expr right) implements Expr {
        @Override
        public Kind kind() {
            return Kind.BINARY;
        }
    }

    record Unary(String operator, Expr argument) implements Expr {
        @Override
        public Kind kind() {
            return Kind.UNARY;
        }
    }

    record Update(String operator, boolean prefix, Expr argument) implements Expr {
        @Override
        public Kind kind() {
            return Kind.UPDATE;
        }
    }

    record Assignment(String operator, Pattern target, Expr value) implements Expr {
        @Override
        public Kind kind() {
            return Kind.ASSIGNMENT;
        }
    }

    record Sequence(List<Expr> expressions) implements Expr {
        public Sequence {
            expressions = List.copyOf(expressions);
        }

        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }
    }

    /** {@code await x} and {@code yield x}. */
    record Await(Expr argument) implements Expr {
        @Override
        public Kind kind() {
            return Kind.AWAIT;
        }
    }

    /**
     * Function expression, arrow function or the function part of a declaration or method.
     * Exactly one of {@code body} and {@code expressionBody} is set.
     */
    record FunctionExpr(String name, List<Pattern> params, Stmt.Block body, Expr expressionBody, boolean arrow)
            implements Expr {
        public FunctionExpr {
            params = List.copyOf(params);
        }

        @Override
        public Kind kind() {
            return Kind.FUNCTION;
        }
    }

    record ClassExpr(String name, Expr superClass, List<ClassMember> members) implements Expr {
        public ClassExpr {
            members = List.copyOf(members);
        }

        @Override
        public Kind kind() {
            return Kind.CLASS;
        }
    }

    /** Method ({@code function} set) or field ({@code value} possibly set). */
    record ClassMember(Expr key, boolean computed, boolean isStatic, FunctionExpr function, Expr value) {
    }

    record Jsx(String name, List<JsxAttribute> attributes, List<Expr> children) implements Expr {
        public Jsx {
            attributes = List.copyOf(attributes);
            children = List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.JSX;
        }
    }

    /** {@code name={value}}; a spread attribute has a null name. */
    record JsxAttribute(String name, Expr value) {
    }

    /** Anything the analysis does not model ({@code this}, regex, tagged templates...). Children are kept for traversal. */
    record Opaque(String text, List<Expr> children) implements Expr {
        public Opaque {
            children = List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.OPAQUE;
        }
    }

    static String jsNumberText(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == 0) {
            return "0";
        }
        final double abs = Math.abs(value);
        if (value == Math.rint(value) && abs < 1e21) {
            return new BigDecimal(value).toPlainString();
        }
        if (abs >= 1e-6 && abs < 1e21) {
            return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
        }
        // 1.5E-7 -> 1.5e-7, 1.0E22 -> 1e+22
        final String javaText = Double.toString(value);
        final int e = javaText.indexOf('E');
        String mantissa = javaText.substring(0, e);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        final String exponent = javaText.substring(e + 1);
        return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
    }
}
