package ai.querygraph.ast;

import java.util.List;

/** Builders for expression trees in engine tests. */
public final class Ast {

    private Ast() {
    }

    public static Expr.Str str(String value) {
        return new Expr.Str(value);
    }

    public static Expr.Num num(double value) {
        return new Expr.Num(value);
    }

    public static Expr.Ident id(String name) {
        return new Expr.Ident(name);
    }

    public static Expr.Ident undefined() {
        return new Expr.Ident("undefined");
    }

    public static Expr.Member member(Expr object, String property) {
        return new Expr.Member(object, new Expr.Ident(property), false, false);
    }

    public static Expr.Member index(Expr object, Expr property) {
        return new Expr.Member(object, property, true, false);
    }

    public static Expr.Call call(Expr callee, Expr... arguments) {
        return new Expr.Call(callee, List.of(arguments), List.of(), false);
    }

    public static Expr.ArrayLit array(Expr... elements) {
        return new Expr.ArrayLit(List.of(elements));
    }

    public static Expr.Spread spread(Expr argument) {
        return new Expr.Spread(argument);
    }

    public static Expr.ObjectLit object(Expr.Prop... properties) {
        return new Expr.ObjectLit(List.of(properties));
    }

    public static Expr.Property prop(String key, Expr value) {
        return new Expr.Property(new Expr.Ident(key), value, false, false);
    }

    public static Expr.Property computed(Expr key, Expr value) {
        return new Expr.Property(key, value, true, false);
    }

    public static Expr.SpreadProp spreadProp(Expr argument) {
        return new Expr.SpreadProp(argument);
    }

    public static Expr.Template template(List<String> quasis, Expr... expressions) {
        return new Expr.Template(quasis, List.of(expressions));
    }

    public static Expr.Conditional cond(Expr test, Expr consequent, Expr alternate) {
        return new Expr.Conditional(test, consequent, alternate);
    }

    public static Expr.Logical or(Expr left, Expr right) {
        return new Expr.Logical("||", left, right);
    }

    public static Expr.Binary eq(Expr left, Expr right) {
        return new Expr.Binary("===", left, right);
    }

    public static Expr.Logical and(Expr left, Expr right) {
        return new Expr.Logical("&&", left, right);
    }

    public static Expr.FunctionExpr arrow(List<String> params, Expr body) {
        return new Expr.FunctionExpr(null, params.stream().<Pattern>map(p -> new Pattern.Binding(p, null)).toList(),
                null, body, true);
    }
}
