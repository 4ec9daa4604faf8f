package ai.querygraph.parse;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.treesitter.TSNode;
import org.treesitter.TSPoint;

import ai.querygraph.ast.Expr;
import ai.querygraph.ast.Loc;
import ai.querygraph.ast.Pattern;
import ai.querygraph.ast.Stmt;
import ai.querygraph.ast.TypeNode;

/**
 * Converts a tree-sitter TypeScript/TSX syntax tree into the {@link Expr}/{@link Stmt} model.
 * <p>
 * Parentheses and the TypeScript-only wrappers ({@code as}, {@code satisfies}, {@code !},
 * {@code <T>x}) are dropped here. Every created node gets a 1-based line/column entry in
 * {@link #locations()}; columns count characters, not bytes.
 * <p>
 * Not thread-safe; one instance per file.
 */
final class TreeSitterAstBuilder {

    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "??");

    private final byte[] source;
    private final IdentityHashMap<Object, Loc> locations = new IdentityHashMap<>();

    TreeSitterAstBuilder(String text) {
        this.source = text.getBytes(StandardCharsets.UTF_8);
    }

    IdentityHashMap<Object, Loc> locations() {
        return locations;
    }

    List<Stmt> program(TSNode root) {
        return statements(namedChildren(root));
    }

    /** First ERROR or MISSING node in document order, or null. */
    static TSNode firstErrorNode(TSNode node) {
        if ("ERROR".equals(node.getType()) || node.isMissing()) {
            return node;
        }
        if (!node.hasError()) {
            return null;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            final TSNode found = firstErrorNode(node.getChild(i));
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    Loc locationOf(TSNode node) {
        final TSPoint point = node.getStartPoint();
        final int byteColumn = point.getColumn();
        final int lineStart = Math.max(0, node.getStartByte() - byteColumn);
        final int charColumn = new String(source, lineStart, Math.min(byteColumn, source.length - lineStart),
                StandardCharsets.UTF_8).length();
        return new Loc(point.getRow() + 1, charColumn + 1);
    }

    // ---------------------------------------------------------------------
    // statements

    private List<Stmt> statements(List<TSNode> nodes) {
        final List<Stmt> out = new ArrayList<>(nodes.size());
        for (TSNode node : nodes) {
            out.add(statement(node));
        }
        return out;
    }

    private Stmt statement(TSNode n) {
        if (n == null) {
            return new Stmt.Other();
        }
        final Stmt built = switch (n.getType()) {
            case "import_statement" -> importStatement(n);
            case "export_statement" -> exportStatement(n);
            case "lexical_declaration", "variable_declaration" -> variableDeclaration(n);
            case "function_declaration", "generator_function_declaration" -> {
                final String name = textOf(field(n, "name"));
                yield new Stmt.FunctionDecl(name, function(n, name));
            }
            case "class_declaration", "abstract_class_declaration" -> {
                final String name = textOf(field(n, "name"));
                yield new Stmt.ClassDecl(name, classExpr(n, name));
            }
            case "expression_statement" -> new Stmt.ExprStmt(expression(firstNamed(n)));
            case "return_statement" -> {
                final TSNode argument = firstNamed(n);
                yield new Stmt.Return(argument != null ? expression(argument) : null);
            }
            case "if_statement" -> {
                final TSNode alternative = field(n, "alternative");
                final TSNode alternateBody = alternative != null ? firstNamed(alternative) : null;
                yield new Stmt.If(expression(field(n, "condition")), statement(field(n, "consequence")),
                        alternateBody != null ? statement(alternateBody) : null);
            }
            case "statement_block" -> block(n);
            case "for_statement" -> forStatement(n);
            case "for_in_statement" -> forInStatement(n);
            case "while_statement" -> new Stmt.While(expression(field(n, "condition")), statement(field(n, "body")), false);
            case "do_statement" -> new Stmt.While(expression(field(n, "condition")), statement(field(n, "body")), true);
            case "switch_statement" -> switchStatement(n);
            case "try_statement" -> tryStatement(n);
            case "labeled_statement" -> new Stmt.Labeled(textOf(field(n, "label")), statement(field(n, "body")));
            case "throw_statement" -> new Stmt.Throw(expression(firstNamed(n)));
            default -> new Stmt.Other();
        };
        return at(built, n);
    }

    private Stmt.Block block(TSNode n) {
        if (n == null) {
            return new Stmt.Block(List.of());
        }
        return at(new Stmt.Block(statements(namedChildren(n))), n);
    }

    private Stmt importStatement(TSNode n) {
        final String source = stringValue(field(n, "source"));
        final List<Stmt.ImportSpecifier> specifiers = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            if (!"import_clause".equals(child.getType())) {
                continue;
            }
            for (TSNode part : namedChildren(child)) {
                switch (part.getType()) {
                    case "identifier" -> specifiers.add(
                            new Stmt.ImportSpecifier(Stmt.ImportKind.DEFAULT, "default", text(part)));
                    case "namespace_import" -> {
                        final TSNode local = firstNamed(part);
                        if (local != null) {
                            specifiers.add(new Stmt.ImportSpecifier(Stmt.ImportKind.NAMESPACE, null, text(local)));
                        }
                    }
                    case "named_imports" -> {
                        for (TSNode spec : namedChildren(part)) {
                            if (!"import_specifier".equals(spec.getType())) {
                                continue;
                            }
                            final String imported = moduleExportName(field(spec, "name"));
                            final TSNode alias = field(spec, "alias");
                            final String local = alias != null ? moduleExportName(alias) : imported;
                            final Stmt.ImportKind kind = "default".equals(imported)
                                    ? Stmt.ImportKind.DEFAULT : Stmt.ImportKind.NAMED;
                            specifiers.add(new Stmt.ImportSpecifier(kind, imported, local));
                        }
                    }
                    default -> {
                    }
                }
            }
        }
        if (source == null) {
            return new Stmt.Other();
        }
        return new Stmt.Import(source, specifiers);
    }

    private Stmt exportStatement(TSNode n) {
        final boolean isDefault = hasToken(n, "default");
        final TSNode declaration = field(n, "declaration");
        final TSNode value = field(n, "value");
        final TSNode sourceNode = field(n, "source");
        final String source = sourceNode != null ? stringValue(sourceNode) : null;

        if (isDefault) {
            if (declaration != null) {
                return new Stmt.ExportDefault(statement(declaration), null);
            }
            if (value != null) {
                return new Stmt.ExportDefault(null, expression(value));
            }
            return new Stmt.Other();
        }
        if (declaration != null) {
            return new Stmt.ExportNamed(statement(declaration), List.of(), null);
        }

        for (TSNode child : namedChildren(n)) {
            if ("export_clause".equals(child.getType())) {
                final List<Stmt.ExportSpecifier> specifiers = new ArrayList<>();
                for (TSNode spec : namedChildren(child)) {
                    if (!"export_specifier".equals(spec.getType())) {
                        continue;
                    }
                    final String local = moduleExportName(field(spec, "name"));
                    final TSNode alias = field(spec, "alias");
                    specifiers.add(new Stmt.ExportSpecifier(local, alias != null ? moduleExportName(alias) : local));
                }
                return new Stmt.ExportNamed(null, specifiers, source);
            }
            if ("namespace_export".equals(child.getType()) && source != null) {
                final TSNode name = firstNamed(child);
                return new Stmt.ExportAll(source, name != null ? moduleExportName(name) : null);
            }
        }
        if (source != null && hasToken(n, "*")) {
            return new Stmt.ExportAll(source, null);
        }
        return new Stmt.Other();
    }

    private Stmt.VarDecl variableDeclaration(TSNode n) {
        String kind = "var";
        if ("lexical_declaration".equals(n.getType())) {
            final TSNode kindNode = field(n, "kind");
            kind = kindNode != null ? text(kindNode) : "const";
        }
        if (!kind.equals("let") && !kind.equals("var")) {
            kind = "const";
        }
        final List<Stmt.Declarator> declarators = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            if (!"variable_declarator".equals(child.getType())) {
                continue;
            }
            final Pattern id = pattern(field(child, "name"), typeAnnotation(field(child, "type")));
            final TSNode init = field(child, "value");
            declarators.add(new Stmt.Declarator(id, init != null ? expression(init) : null));
        }
        return new Stmt.VarDecl(kind, declarators);
    }

    private Stmt forStatement(TSNode n) {
        final TSNode initializer = field(n, "initializer");
        Stmt init = null;
        if (initializer != null && !"empty_statement".equals(initializer.getType())) {
            init = isStatementNode(initializer) ? statement(initializer)
                    : at(new Stmt.ExprStmt(expression(initializer)), initializer);
        }
        final TSNode condition = field(n, "condition");
        Expr test = null;
        if (condition != null && !"empty_statement".equals(condition.getType())) {
            final TSNode testNode = "expression_statement".equals(condition.getType()) ? firstNamed(condition) : condition;
            test = testNode != null ? expression(testNode) : null;
        }
        final TSNode increment = field(n, "increment");
        return new Stmt.For(init, test, increment != null ? expression(increment) : null, statement(field(n, "body")));
    }

    private Stmt forInStatement(TSNode n) {
        final TSNode left = field(n, "left");
        final TSNode kindNode = field(n, "kind");
        final Stmt leftStmt;
        if (kindNode != null) {
            final String kind = text(kindNode).equals("var") || text(kindNode).equals("let") ? text(kindNode) : "const";
            leftStmt = at(new Stmt.VarDecl(kind, List.of(new Stmt.Declarator(pattern(left, null), null))), left);
        } else {
            leftStmt = at(new Stmt.ExprStmt(expression(left)), left);
        }
        final TSNode operator = field(n, "operator");
        final boolean of = operator != null ? text(operator).equals("of") : hasToken(n, "of");
        return new Stmt.ForEach(leftStmt, expression(field(n, "right")), statement(field(n, "body")), of);
    }

    private Stmt switchStatement(TSNode n) {
        final List<Stmt.SwitchCase> cases = new ArrayList<>();
        final TSNode body = field(n, "body");
        if (body != null) {
            for (TSNode clause : namedChildren(body)) {
                final TSNode value = field(clause, "value");
                final List<Stmt> statements = new ArrayList<>();
                for (TSNode child : namedChildren(clause)) {
                    if (value == null || !same(child, value)) {
                        statements.add(statement(child));
                    }
                }
                if ("switch_case".equals(clause.getType())) {
                    cases.add(new Stmt.SwitchCase(value != null ? expression(value) : null, statements));
                } else if ("switch_default".equals(clause.getType())) {
                    cases.add(new Stmt.SwitchCase(null, statements));
                }
            }
        }
        return new Stmt.Switch(expression(field(n, "value")), cases);
    }

    private Stmt tryStatement(TSNode n) {
        final Stmt.Block block = block(field(n, "body"));
        Pattern param = null;
        Stmt.Block handlerBody = null;
        final TSNode handler = field(n, "handler");
        if (handler != null) {
            final TSNode parameter = field(handler, "parameter");
            param = parameter != null ? pattern(parameter, null) : null;
            handlerBody = block(field(handler, "body"));
        }
        final TSNode finalizer = field(n, "finalizer");
        final Stmt.Block finalBody = finalizer != null ? block(field(finalizer, "body")) : null;
        return new Stmt.Try(block, param, handlerBody, finalBody);
    }

    private static boolean isStatementNode(TSNode n) {
        return switch (n.getType()) {
            case "lexical_declaration", "variable_declaration", "expression_statement" -> true;
            default -> false;
        };
    }

    // ---------------------------------------------------------------------
    // functions and classes

    private Expr.FunctionExpr function(TSNode n, String name) {
        final List<Pattern> params = new ArrayList<>();
        final TSNode single = field(n, "parameter");
        if (single != null) {
            params.add(pattern(single, null));
        }
        final TSNode parameters = field(n, "parameters");
        if (parameters != null) {
            for (TSNode param : namedChildren(parameters)) {
                final Pattern built = parameter(param);
                if (built != null) {
                    params.add(built);
                }
            }
        }

        final TSNode body = field(n, "body");
        final boolean arrow = "arrow_function".equals(n.getType());
        final Expr.FunctionExpr function;
        if (body == null) {
            function = new Expr.FunctionExpr(name, params, new Stmt.Block(List.of()), null, arrow);
        } else if ("statement_block".equals(body.getType())) {
            function = new Expr.FunctionExpr(name, params, block(body), null, arrow);
        } else {
            function = new Expr.FunctionExpr(name, params, null, expression(body), arrow);
        }
        return at(function, n);
    }

    private Pattern parameter(TSNode n) {
        switch (n.getType()) {
            case "required_parameter", "optional_parameter" -> {
                final TSNode target = field(n, "pattern");
                if (target == null || "this".equals(target.getType())) {
                    return null;
                }
                final Pattern bound = pattern(target, typeAnnotation(field(n, "type")));
                final TSNode value = field(n, "value");
                return value != null ? new Pattern.Defaulted(bound, expression(value)) : bound;
            }
            case "decorator", "accessibility_modifier", "override_modifier" -> {
                return null;
            }
            default -> {
                return pattern(n, null);
            }
        }
    }

    private Expr.ClassExpr classExpr(TSNode n, String name) {
        Expr superClass = null;
        final List<Expr.ClassMember> members = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            if ("class_heritage".equals(child.getType())) {
                for (TSNode clause : namedChildren(child)) {
                    if ("extends_clause".equals(clause.getType())) {
                        final TSNode value = field(clause, "value");
                        superClass = value != null ? expression(value) : null;
                    }
                }
            }
        }
        final TSNode body = field(n, "body");
        if (body != null) {
            for (TSNode member : namedChildren(body)) {
                final Expr.ClassMember built = classMember(member);
                if (built != null) {
                    members.add(built);
                }
            }
        }
        return at(new Expr.ClassExpr(name, superClass, members), n);
    }

    private Expr.ClassMember classMember(TSNode n) {
        final boolean isStatic = hasToken(n, "static");
        switch (n.getType()) {
            case "method_definition" -> {
                final TSNode nameNode = field(n, "name");
                final boolean computed = nameNode != null && "computed_property_name".equals(nameNode.getType());
                return new Expr.ClassMember(propertyKey(nameNode), computed, isStatic,
                        function(n, nameNode != null ? text(nameNode) : null), null);
            }
            case "public_field_definition", "field_definition" -> {
                TSNode nameNode = field(n, "name");
                if (nameNode == null) {
                    nameNode = field(n, "property");
                }
                final boolean computed = nameNode != null && "computed_property_name".equals(nameNode.getType());
                final TSNode value = field(n, "value");
                return new Expr.ClassMember(propertyKey(nameNode), computed, isStatic, null,
                        value != null ? expression(value) : null);
            }
            default -> {
                return null;
            }
        }
    }

    // ---------------------------------------------------------------------
    // patterns

    private Pattern pattern(TSNode n, TypeNode type) {
        if (n == null) {
            return new Pattern.Target(expression(null));
        }
        return switch (n.getType()) {
            case "identifier", "shorthand_property_identifier_pattern", "undefined" -> new Pattern.Binding(text(n), type);
            case "object_pattern" -> objectPattern(n, type);
            case "array_pattern" -> {
                final List<Pattern> elements = new ArrayList<>();
                for (TSNode element : namedChildren(n)) {
                    elements.add(pattern(element, null));
                }
                yield new Pattern.ArrayPattern(elements, type);
            }
            case "assignment_pattern" -> new Pattern.Defaulted(pattern(field(n, "left"), type),
                    expression(field(n, "right")));
            case "rest_pattern" -> new Pattern.Rest(pattern(firstNamed(n), null), type);
            case "parenthesized_expression" -> pattern(firstNamed(n), type);
            default -> new Pattern.Target(expression(n));
        };
    }

    private Pattern.ObjectPattern objectPattern(TSNode n, TypeNode type) {
        final List<Pattern.PatternProperty> properties = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            switch (child.getType()) {
                case "shorthand_property_identifier_pattern" -> properties.add(
                        new Pattern.PatternProperty(text(child), null, new Pattern.Binding(text(child), null), false));
                case "object_assignment_pattern" -> {
                    final TSNode left = field(child, "left");
                    final Pattern target = pattern(left, null);
                    final String key = target instanceof Pattern.Binding b ? b.name() : null;
                    properties.add(new Pattern.PatternProperty(key, null,
                            new Pattern.Defaulted(target, expression(field(child, "right"))), false));
                }
                case "pair_pattern" -> {
                    final TSNode keyNode = field(child, "key");
                    final Pattern value = pattern(field(child, "value"), null);
                    if (keyNode != null && "computed_property_name".equals(keyNode.getType())) {
                        properties.add(new Pattern.PatternProperty(null, expression(firstNamed(keyNode)), value, false));
                    } else {
                        properties.add(new Pattern.PatternProperty(staticKeyText(keyNode), null, value, false));
                    }
                }
                case "rest_pattern" -> properties.add(
                        new Pattern.PatternProperty(null, null, pattern(firstNamed(child), null), true));
                default -> {
                }
            }
        }
        return new Pattern.ObjectPattern(properties, type);
    }

    // ---------------------------------------------------------------------
    // types

    private TypeNode typeAnnotation(TSNode n) {
        if (n == null) {
            return null;
        }
        final TSNode inner = "type_annotation".equals(n.getType()) ? firstNamed(n) : n;
        return inner != null ? type(inner) : null;
    }

    private TypeNode type(TSNode n) {
        return switch (n.getType()) {
            case "type_identifier", "nested_type_identifier", "identifier" ->
                    new TypeNode.Ref(qualifiedName(text(n)), List.of());
            case "generic_type" -> {
                final TSNode name = field(n, "name");
                final TSNode arguments = field(n, "type_arguments");
                yield new TypeNode.Ref(qualifiedName(name != null ? text(name) : text(n)), typeArguments(arguments));
            }
            case "type_query" -> {
                final TSNode target = firstNamed(n);
                String name = target != null ? text(target) : "";
                final int generic = name.indexOf('<');
                if (generic >= 0) {
                    name = name.substring(0, generic);
                }
                yield new TypeNode.Query(qualifiedName(name));
            }
            case "object_type" -> {
                final List<TypeNode.Member> members = new ArrayList<>();
                for (TSNode member : namedChildren(n)) {
                    if ("property_signature".equals(member.getType())) {
                        members.add(new TypeNode.Member(staticKeyText(field(member, "name")),
                                typeAnnotation(field(member, "type"))));
                    }
                }
                yield new TypeNode.Literal(members);
            }
            case "union_type" -> new TypeNode.Union(flattenTypes(n, "union_type", new ArrayList<>()));
            case "intersection_type" -> new TypeNode.Intersection(flattenTypes(n, "intersection_type", new ArrayList<>()));
            case "parenthesized_type" -> {
                final TSNode inner = firstNamed(n);
                yield inner != null ? type(inner) : new TypeNode.Other();
            }
            default -> new TypeNode.Other();
        };
    }

    private List<TypeNode> flattenTypes(TSNode n, String nodeType, List<TypeNode> out) {
        for (TSNode child : namedChildren(n)) {
            if (nodeType.equals(child.getType())) {
                flattenTypes(child, nodeType, out);
            } else {
                out.add(type(child));
            }
        }
        return out;
    }

    private List<TypeNode> typeArguments(TSNode n) {
        if (n == null) {
            return List.of();
        }
        final List<TypeNode> out = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            out.add(type(child));
        }
        return out;
    }

    private static List<String> qualifiedName(String text) {
        final List<String> out = new ArrayList<>();
        for (String part : text.split("\\.")) {
            final String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out.isEmpty() ? List.of(text) : out;
    }

    // ---------------------------------------------------------------------
    // expressions

    private Expr expression(TSNode n) {
        if (n == null) {
            return at(new Expr.Opaque("missing", List.of()), null);
        }
        switch (n.getType()) {
            case "parenthesized_expression", "as_expression", "satisfies_expression", "non_null_expression",
                 "instantiation_expression" -> {
                final TSNode inner = firstNamed(n);
                return inner != null ? expression(inner) : opaque(n);
            }
            case "type_assertion" -> {
                final List<TSNode> children = namedChildren(n);
                return children.isEmpty() ? opaque(n) : expression(children.get(children.size() - 1));
            }
            default -> {
                return at(build(n), n);
            }
        }
    }

    private Expr build(TSNode n) {
        return switch (n.getType()) {
            case "identifier", "shorthand_property_identifier", "property_identifier" -> new Expr.Ident(text(n));
            case "undefined" -> new Expr.Ident("undefined");
            case "private_property_identifier" -> new Expr.PrivateName(text(n).substring(1));
            case "number" -> number(text(n));
            case "string" -> new Expr.Str(stringValue(n));
            case "true" -> new Expr.Bool(true);
            case "false" -> new Expr.Bool(false);
            case "null" -> new Expr.Null();
            case "template_string" -> template(n);
            case "member_expression" -> {
                final TSNode object = field(n, "object");
                final TSNode property = field(n, "property");
                final Expr propertyExpr = "private_property_identifier".equals(property.getType())
                        ? at(new Expr.PrivateName(text(property).substring(1)), property)
                        : at(new Expr.Ident(text(property)), property);
                final Expr objectExpr = expression(object);
                yield new Expr.Member(objectExpr, propertyExpr, false, hasOptionalChain(n) || continuesChain(object, objectExpr));
            }
            case "subscript_expression" -> {
                final TSNode object = field(n, "object");
                final Expr objectExpr = expression(object);
                yield new Expr.Member(objectExpr, expression(field(n, "index")), true,
                        hasOptionalChain(n) || continuesChain(object, objectExpr));
            }
            case "call_expression" -> call(n);
            case "new_expression" -> {
                final TSNode arguments = field(n, "arguments");
                yield new Expr.New(expression(field(n, "constructor")), arguments != null ? arguments(arguments) : List.of());
            }
            case "array" -> array(n);
            case "object" -> object(n);
            case "arrow_function", "function_expression", "function", "generator_function" ->
                    function(n, textOf(field(n, "name")));
            case "class" -> classExpr(n, textOf(field(n, "name")));
            case "ternary_expression" -> new Expr.Conditional(expression(field(n, "condition")),
                    expression(field(n, "consequence")), expression(field(n, "alternative")));
            case "binary_expression" -> {
                final String operator = text(field(n, "operator"));
                final Expr left = expression(field(n, "left"));
                final Expr right = expression(field(n, "right"));
                yield LOGICAL_OPERATORS.contains(operator)
                        ? new Expr.Logical(operator, left, right)
                        : new Expr.Binary(operator, left, right);
            }
            case "unary_expression" -> new Expr.Unary(text(field(n, "operator")), expression(field(n, "argument")));
            case "update_expression" -> {
                final TSNode operator = field(n, "operator");
                final TSNode argument = field(n, "argument");
                yield new Expr.Update(text(operator), operator.getStartByte() < argument.getStartByte(), expression(argument));
            }
            case "assignment_expression" -> new Expr.Assignment("=", pattern(field(n, "left"), null),
                    expression(field(n, "right")));
            case "augmented_assignment_expression" -> new Expr.Assignment(text(field(n, "operator")),
                    new Pattern.Target(expression(field(n, "left"))), expression(field(n, "right")));
            case "sequence_expression" -> new Expr.Sequence(sequence(n, new ArrayList<>()));
            case "await_expression", "yield_expression" -> {
                final TSNode argument = firstNamed(n);
                yield new Expr.Await(argument != null ? expression(argument) : null);
            }
            case "spread_element" -> new Expr.Spread(expression(firstNamed(n)));
            case "jsx_element", "jsx_self_closing_element" -> jsx(n);
            case "jsx_expression" -> {
                final TSNode inner = firstNamed(n);
                yield inner != null ? expression(inner) : new Expr.Opaque("jsx_expression", List.of());
            }
            default -> {
                final List<Expr> children = new ArrayList<>();
                for (TSNode child : namedChildren(n)) {
                    children.add(expression(child));
                }
                yield new Expr.Opaque(n.getType(), children);
            }
        };
    }

    private Expr opaque(TSNode n) {
        return at(new Expr.Opaque(n.getType(), List.of()), n);
    }

    private Expr call(TSNode n) {
        final TSNode callee = field(n, "function");
        final TSNode arguments = field(n, "arguments");
        final Expr calleeExpr = "import".equals(callee.getType())
                ? at(new Expr.Opaque("import", List.of()), callee)
                : expression(callee);
        if (arguments != null && "template_string".equals(arguments.getType())) {
            // tagged template
            return new Expr.Opaque("tagged_template", List.of(calleeExpr, expression(arguments)));
        }
        final List<TypeNode> typeArguments = typeArguments(field(n, "type_arguments"));
        return new Expr.Call(calleeExpr, arguments != null ? arguments(arguments) : List.of(), typeArguments,
                hasOptionalChain(n) || continuesChain(callee, calleeExpr));
    }

    private List<Expr> arguments(TSNode n) {
        final List<Expr> out = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            out.add(expression(child));
        }
        return out;
    }

    /** A link continues an optional chain when its unparenthesized object is itself optional. */
    private static boolean continuesChain(TSNode objectNode, Expr object) {
        if ("parenthesized_expression".equals(objectNode.getType())) {
            return false;
        }
        if (object instanceof Expr.Member member) {
            return member.optional();
        }
        return object instanceof Expr.Call call && call.optional();
    }

    private static boolean hasOptionalChain(TSNode n) {
        for (int i = 0; i < n.getChildCount(); i++) {
            final TSNode child = n.getChild(i);
            if ("optional_chain".equals(child.getType()) || "?.".equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    private List<Expr> sequence(TSNode n, List<Expr> out) {
        for (TSNode child : namedChildren(n)) {
            if ("sequence_expression".equals(child.getType())) {
                sequence(child, out);
            } else {
                out.add(expression(child));
            }
        }
        return out;
    }

    private Expr array(TSNode n) {
        final List<Expr> elements = new ArrayList<>();
        boolean expectElement = true;
        for (int i = 0; i < n.getChildCount(); i++) {
            final TSNode child = n.getChild(i);
            final String type = child.getType();
            if (",".equals(type)) {
                if (expectElement) {
                    elements.add(new Expr.Hole());
                }
                expectElement = true;
            } else if (child.isNamed() && !"comment".equals(type)) {
                elements.add(expression(child));
                expectElement = false;
            }
        }
        return new Expr.ArrayLit(elements);
    }

    private Expr object(TSNode n) {
        final List<Expr.Prop> properties = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            switch (child.getType()) {
                case "pair" -> {
                    final TSNode key = field(child, "key");
                    final boolean computed = "computed_property_name".equals(key.getType());
                    properties.add(new Expr.Property(propertyKey(key), expression(field(child, "value")), computed, false));
                }
                case "shorthand_property_identifier" -> properties.add(new Expr.Property(
                        at(new Expr.Ident(text(child)), child), at(new Expr.Ident(text(child)), child), false, true));
                case "spread_element" -> properties.add(new Expr.SpreadProp(expression(firstNamed(child))));
                case "method_definition" -> {
                    final TSNode key = field(child, "name");
                    final boolean computed = key != null && "computed_property_name".equals(key.getType());
                    properties.add(new Expr.Method(propertyKey(key), computed, function(child, textOf(key))));
                }
                default -> {
                }
            }
        }
        return new Expr.ObjectLit(properties);
    }

    /** Key of a property, method or class member; computed keys yield their inner expression. */
    private Expr propertyKey(TSNode key) {
        if (key == null) {
            return new Expr.Opaque("missing", List.of());
        }
        return switch (key.getType()) {
            case "computed_property_name" -> expression(firstNamed(key));
            case "property_identifier", "identifier" -> at(new Expr.Ident(text(key)), key);
            default -> expression(key);
        };
    }

    private Expr template(TSNode n) {
        final List<String> quasis = new ArrayList<>();
        final List<Expr> expressions = new ArrayList<>();
        int cursor = n.getStartByte() + 1;
        for (int i = 0; i < n.getChildCount(); i++) {
            final TSNode child = n.getChild(i);
            if (!"template_substitution".equals(child.getType())) {
                continue;
            }
            quasis.add(cook(slice(cursor, child.getStartByte())));
            final TSNode inner = firstNamed(child);
            expressions.add(inner != null ? expression(inner) : opaque(child));
            cursor = child.getEndByte();
        }
        quasis.add(cook(slice(cursor, Math.max(cursor, n.getEndByte() - 1))));
        return new Expr.Template(quasis, expressions);
    }

    private Expr jsx(TSNode n) {
        final TSNode opening = "jsx_element".equals(n.getType()) ? field(n, "open_tag") : n;
        final TSNode openTag = opening != null ? opening : firstNamed(n);
        final TSNode nameNode = openTag != null ? field(openTag, "name") : null;
        final String name = nameNode != null ? text(nameNode) : "";

        final List<Expr.JsxAttribute> attributes = new ArrayList<>();
        if (openTag != null) {
            for (TSNode child : namedChildren(openTag)) {
                if (nameNode != null && same(child, nameNode)) {
                    continue;
                }
                if ("jsx_attribute".equals(child.getType())) {
                    attributes.add(jsxAttribute(child));
                } else if ("jsx_expression".equals(child.getType())) {
                    final TSNode spread = firstNamed(child);
                    attributes.add(new Expr.JsxAttribute(null, spread != null ? expression(spread) : null));
                }
            }
        }

        final List<Expr> children = new ArrayList<>();
        if ("jsx_element".equals(n.getType())) {
            for (TSNode child : namedChildren(n)) {
                switch (child.getType()) {
                    case "jsx_element", "jsx_self_closing_element" -> children.add(expression(child));
                    case "jsx_expression" -> {
                        final TSNode inner = firstNamed(child);
                        if (inner != null) {
                            children.add(expression(inner));
                        }
                    }
                    default -> {
                    }
                }
            }
        }
        return new Expr.Jsx(name, attributes, children);
    }

    private Expr.JsxAttribute jsxAttribute(TSNode n) {
        final List<TSNode> parts = namedChildren(n);
        final String name = parts.isEmpty() ? "" : text(parts.get(0));
        if (parts.size() < 2) {
            return new Expr.JsxAttribute(name, null);
        }
        final TSNode value = parts.get(1);
        if ("jsx_expression".equals(value.getType())) {
            final TSNode inner = firstNamed(value);
            return new Expr.JsxAttribute(name, inner != null ? expression(inner) : null);
        }
        return new Expr.JsxAttribute(name, expression(value));
    }

    static Expr number(String raw) {
        final String text = raw.replace("_", "");
        if (text.endsWith("n")) {
            return new Expr.BigInt(text.substring(0, text.length() - 1));
        }
        final String lower = text.toLowerCase(Locale.ROOT);
        try {
            if (lower.startsWith("0x")) {
                return new Expr.Num(new BigInteger(text.substring(2), 16).doubleValue());
            }
            if (lower.startsWith("0o")) {
                return new Expr.Num(new BigInteger(text.substring(2), 8).doubleValue());
            }
            if (lower.startsWith("0b")) {
                return new Expr.Num(new BigInteger(text.substring(2), 2).doubleValue());
            }
            return new Expr.Num(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return new Expr.Opaque("number", List.of());
        }
    }

    // ---------------------------------------------------------------------
    // text helpers

    private String stringValue(TSNode n) {
        if (n == null) {
            return null;
        }
        final String raw = text(n);
        if (raw.length() < 2) {
            return raw;
        }
        return cook(raw.substring(1, raw.length() - 1));
    }

    /** Module export names may be identifiers or string literals. */
    private String moduleExportName(TSNode n) {
        if (n == null) {
            return null;
        }
        return "string".equals(n.getType()) ? stringValue(n) : text(n);
    }

    private String staticKeyText(TSNode n) {
        if (n == null) {
            return null;
        }
        return switch (n.getType()) {
            case "string" -> stringValue(n);
            case "number" -> number(text(n)) instanceof Expr.Num num ? num.text() : text(n);
            default -> text(n);
        };
    }

    /** Resolves escape sequences the way a JavaScript string literal does. */
    static String cook(String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        final StringBuilder out = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (c != '\\' || i + 1 >= raw.length()) {
                out.append(c);
                continue;
            }
            final char next = raw.charAt(++i);
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'v' -> out.append('\u000B');
                case '0' -> out.append('\0');
                case '\n' -> {
                }
                case '\r' -> {
                    if (i + 1 < raw.length() && raw.charAt(i + 1) == '\n') {
                        i++;
                    }
                }
                case 'x' -> {
                    if (isHex(raw, i + 1, i + 3)) {
                        out.append((char) Integer.parseInt(raw.substring(i + 1, i + 3), 16));
                        i += 2;
                    } else {
                        out.append(next);
                    }
                }
                case 'u' -> {
                    if (i + 1 < raw.length() && raw.charAt(i + 1) == '{') {
                        final int close = raw.indexOf('}', i + 2);
                        if (close > 0 && isHex(raw, i + 2, close)) {
                            out.appendCodePoint(Integer.parseInt(raw.substring(i + 2, close), 16));
                            i = close;
                        } else {
                            out.append(next);
                        }
                    } else if (isHex(raw, i + 1, i + 5)) {
                        out.append((char) Integer.parseInt(raw.substring(i + 1, i + 5), 16));
                        i += 4;
                    } else {
                        out.append(next);
                    }
                }
                default -> out.append(next);
            }
        }
        return out.toString();
    }

    private static boolean isHex(String s, int from, int to) {
        if (from >= to || to > s.length()) {
            return false;
        }
        for (int i = from; i < to; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private String text(TSNode n) {
        return slice(n.getStartByte(), n.getEndByte());
    }

    private String textOf(TSNode n) {
        return n != null ? text(n) : null;
    }

    private String slice(int start, int end) {
        final int from = Math.max(0, Math.min(start, source.length));
        final int to = Math.max(from, Math.min(end, source.length));
        return new String(source, from, to - from, StandardCharsets.UTF_8);
    }

    private static TSNode field(TSNode n, String name) {
        final TSNode child = n.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    // The binding's getNamedChild(i) does not index past the first named child; filter getChild(i) instead.
    private static List<TSNode> namedChildren(TSNode n) {
        final List<TSNode> out = new ArrayList<>(n.getChildCount());
        for (int i = 0; i < n.getChildCount(); i++) {
            final TSNode child = n.getChild(i);
            if (isNamedCode(child)) {
                out.add(child);
            }
        }
        return out;
    }

    private static TSNode firstNamed(TSNode n) {
        for (int i = 0; i < n.getChildCount(); i++) {
            final TSNode child = n.getChild(i);
            if (isNamedCode(child)) {
                return child;
            }
        }
        return null;
    }

    private static boolean isNamedCode(TSNode child) {
        return child.isNamed() && !"comment".equals(child.getType());
    }

    private static boolean hasToken(TSNode n, String token) {
        for (int i = 0; i < n.getChildCount(); i++) {
            final TSNode child = n.getChild(i);
            if (!child.isNamed() && token.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    private static boolean same(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte() && a.getEndByte() == b.getEndByte() && a.getType().equals(b.getType());
    }

    private <T> T at(T node, TSNode syntax) {
        if (syntax != null) {
            locations.putIfAbsent(node, locationOf(syntax));
        }
        return node;
    }
}
