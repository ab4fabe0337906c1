package ai.importfix.cfg;

import static ai.importfix.cfg.PythonTreeSitterNodeTypes.*;

import ai.importfix.analyzer.ParseException;
import ai.importfix.analyzer.SourceParser;
import ai.importfix.analyzer.SyntaxNode;
import ai.importfix.ast.Expression;
import ai.importfix.ast.Parameter;
import ai.importfix.ast.ParameterKind;
import ai.importfix.value.PyConstant;
import ai.importfix.value.PySequence;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Builds the statement tree of a module from its syntax tree. One handler per node kind; subtrees that are not
 * understood become {@link CfgNode.NoOp} statements or {@link Expression.Unknown} placeholders instead of failing the
 * whole build.
 */
public final class CfgBuilder {
    private static final Logger logger = LogManager.getLogger(CfgBuilder.class);

    private final SourceParser parser;

    public CfgBuilder(SourceParser parser) {
        this.parser = parser;
    }

    /** Parses and builds a module. */
    public CfgNode build(String source) throws ParseException {
        return buildModule(parser.parse(source));
    }

    public CfgNode buildModule(SyntaxNode module) {
        return block(module.namedChildren());
    }

    private CfgNode block(List<SyntaxNode> statements) {
        var nodes = new ArrayList<CfgNode>();
        for (var statement : statements) {
            var node = statement(statement);
            if (!(node instanceof CfgNode.NoOp)) {
                nodes.add(node);
            }
        }
        if (nodes.isEmpty()) {
            return CfgNode.NoOp.INSTANCE;
        }
        return nodes.size() == 1 ? nodes.get(0) : new CfgNode.Group(nodes);
    }

    private CfgNode body(SyntaxNode owner, String field) {
        return owner.childByField(field).map(b -> block(blockStatements(b))).orElse(CfgNode.NoOp.INSTANCE);
    }

    // A block node holds statements; a simple statement on the same line as the colon may appear without one.
    private static List<SyntaxNode> blockStatements(SyntaxNode node) {
        return node.is(BLOCK) ? node.namedChildren() : List.of(node);
    }

    CfgNode statement(SyntaxNode node) {
        try {
            return switch (node.kind()) {
                case EXPRESSION_STATEMENT -> expressionStatement(node);
                case ASSIGNMENT -> assignment(node);
                case AUGMENTED_ASSIGNMENT -> augmentedAssignment(node);
                case RETURN_STATEMENT -> new CfgNode.Return(
                        node.namedChildren().isEmpty() ? null : tupleOrSingle(node.namedChildren()));
                case PASS_STATEMENT,
                        BREAK_STATEMENT,
                        CONTINUE_STATEMENT,
                        GLOBAL_STATEMENT,
                        NONLOCAL_STATEMENT,
                        FUTURE_IMPORT_STATEMENT,
                        TYPE_ALIAS_STATEMENT,
                        COMMENT -> CfgNode.NoOp.INSTANCE;
                case RAISE_STATEMENT, ASSERT_STATEMENT, DELETE_STATEMENT, PRINT_STATEMENT, EXEC_STATEMENT ->
                    operands(node);
                case IMPORT_STATEMENT -> importStatement(node);
                case IMPORT_FROM_STATEMENT -> fromImport(node);
                case IF_STATEMENT -> ifStatement(node);
                case FOR_STATEMENT -> new CfgNode.For(
                        target(required(node, "left")),
                        expression(required(node, "right")),
                        body(node, "body"),
                        elseBody(node));
                case WHILE_STATEMENT -> new CfgNode.While(
                        expression(required(node, "condition")), body(node, "body"), elseBody(node));
                case TRY_STATEMENT -> tryStatement(node);
                case WITH_STATEMENT -> withStatement(node);
                case MATCH_STATEMENT -> matchStatement(node);
                case FUNCTION_DEFINITION -> functionDefinition(node, List.of());
                case CLASS_DEFINITION -> classDefinition(node, List.of());
                case DECORATED_DEFINITION -> decoratedDefinition(node);
                case BLOCK -> block(node.namedChildren());
                case ERROR -> {
                    logger.debug("Skipping unparseable code at line {}", node.startLine() + 1);
                    yield CfgNode.NoOp.INSTANCE;
                }
                default -> {
                    logger.debug("Unhandled statement kind {} at line {}", node.kind(), node.startLine() + 1);
                    yield new CfgNode.ExpressionStmt(expression(node));
                }
            };
        } catch (ParseDegradedException e) {
            logger.warn("Degrading statement: {}", e.getMessage());
            return CfgNode.NoOp.INSTANCE;
        }
    }

    private CfgNode expressionStatement(SyntaxNode node) {
        var children = node.namedChildren();
        if (children.size() == 1 && children.get(0).is(ASSIGNMENT)) {
            return assignment(children.get(0));
        }
        if (children.size() == 1 && children.get(0).is(AUGMENTED_ASSIGNMENT)) {
            return augmentedAssignment(children.get(0));
        }
        if (children.isEmpty()) {
            return CfgNode.NoOp.INSTANCE;
        }
        return new CfgNode.ExpressionStmt(tupleOrSingle(children));
    }

    // a = b = value is nested through the right field
    private CfgNode assignment(SyntaxNode node) {
        var targets = new ArrayList<Expression>();
        SyntaxNode current = node;
        Expression typeHint = null;
        while (true) {
            targets.add(target(required(current, "left")));
            var hint = current.childByField("type");
            if (hint.isPresent() && typeHint == null) {
                typeHint = expression(hint.get());
            }
            var right = current.childByField("right");
            if (right.isEmpty()) {
                return new CfgNode.Assign(targets, "=", null, typeHint);
            }
            if (!right.get().is(ASSIGNMENT)) {
                return new CfgNode.Assign(targets, "=", expression(right.get()), typeHint);
            }
            current = right.get();
        }
    }

    private CfgNode augmentedAssignment(SyntaxNode node) {
        var op = required(node, "operator").text();
        return new CfgNode.Assign(
                List.of(target(required(node, "left"))), op, expression(required(node, "right")), null);
    }

    private CfgNode operands(SyntaxNode node) {
        var statements = new ArrayList<CfgNode>();
        for (var child : node.namedChildren()) {
            statements.add(new CfgNode.ExpressionStmt(expression(child)));
        }
        if (statements.isEmpty()) {
            return CfgNode.NoOp.INSTANCE;
        }
        return statements.size() == 1 ? statements.get(0) : new CfgNode.Group(statements);
    }

    private CfgNode importStatement(SyntaxNode node) {
        var imports = new ArrayList<CfgNode>();
        for (var child : node.namedChildren()) {
            if (child.is(DOTTED_NAME)) {
                imports.add(new CfgNode.Import(dottedName(child), null));
            } else if (child.is(ALIASED_IMPORT)) {
                imports.add(new CfgNode.Import(
                        dottedName(required(child, "name")), required(child, "alias").text()));
            }
        }
        return imports.size() == 1 ? imports.get(0) : new CfgNode.Group(imports);
    }

    private CfgNode fromImport(SyntaxNode node) {
        var moduleNode = required(node, "module_name");
        var modulePath = moduleNode.is(RELATIVE_IMPORT) ? relativeImport(moduleNode) : dottedName(moduleNode);
        if (node.hasChildOfKind(WILDCARD_IMPORT)) {
            return new CfgNode.FromImport(modulePath, Map.of(), true);
        }
        var names = new LinkedHashMap<String, @Nullable String>();
        for (var child : node.childrenByField("name")) {
            if (child.is(ALIASED_IMPORT)) {
                names.put(dottedName(required(child, "name")), required(child, "alias").text());
            } else {
                names.put(dottedName(child), null);
            }
        }
        return new CfgNode.FromImport(modulePath, names, false);
    }

    private static String relativeImport(SyntaxNode node) {
        var sb = new StringBuilder();
        for (var child : node.children()) {
            if (child.is(IMPORT_PREFIX)) {
                sb.append(child.text().replace(" ", ""));
            } else if (child.is(DOTTED_NAME)) {
                sb.append(dottedName(child));
            }
        }
        return sb.toString();
    }

    private static String dottedName(SyntaxNode node) {
        if (!node.is(DOTTED_NAME)) {
            return node.text();
        }
        var parts = node.namedChildren().stream().map(SyntaxNode::text).toList();
        return String.join(".", parts);
    }

    private CfgNode ifStatement(SyntaxNode node) {
        var branches = new ArrayList<CfgNode.IfBranch>();
        branches.add(new CfgNode.IfBranch(expression(required(node, "condition")), body(node, "consequence")));
        for (var alternative : node.childrenByField("alternative")) {
            if (alternative.is(ELIF_CLAUSE)) {
                branches.add(new CfgNode.IfBranch(
                        expression(required(alternative, "condition")), body(alternative, "consequence")));
            } else if (alternative.is(ELSE_CLAUSE)) {
                branches.add(new CfgNode.IfBranch(new Expression.Literal(true), body(alternative, "body")));
            }
        }
        return new CfgNode.If(branches);
    }

    private CfgNode elseBody(SyntaxNode node) {
        return node.childByField("alternative")
                .filter(a -> a.is(ELSE_CLAUSE))
                .map(a -> body(a, "body"))
                .orElse(CfgNode.NoOp.INSTANCE);
    }

    private CfgNode tryStatement(SyntaxNode node) {
        var handlers = new ArrayList<CfgNode.ExceptClause>();
        CfgNode elseBody = CfgNode.NoOp.INSTANCE;
        CfgNode finallyBody = CfgNode.NoOp.INSTANCE;
        for (var child : node.namedChildren()) {
            if (child.is(EXCEPT_CLAUSE) || child.is(EXCEPT_GROUP_CLAUSE)) {
                handlers.add(exceptClause(child));
            } else if (child.is(ELSE_CLAUSE)) {
                elseBody = body(child, "body");
            } else if (child.is(FINALLY_CLAUSE)) {
                finallyBody = child.firstChildOfKind(BLOCK)
                        .map(b -> block(b.namedChildren()))
                        .orElse(CfgNode.NoOp.INSTANCE);
            }
        }
        return new CfgNode.Try(body(node, "body"), handlers, elseBody, finallyBody);
    }

    // except [type [as name]]: block
    private CfgNode.ExceptClause exceptClause(SyntaxNode node) {
        Expression type = null;
        String name = null;
        CfgNode handlerBody = CfgNode.NoOp.INSTANCE;
        for (var child : node.namedChildren()) {
            if (child.is(BLOCK)) {
                handlerBody = block(child.namedChildren());
            } else if (child.is(AS_PATTERN)) {
                var alias = asPatternTarget(child);
                type = expression(firstNamed(child));
                name = alias == null ? null : alias.text();
            } else if (type == null) {
                type = expression(child);
            } else if (name == null) {
                name = child.text();
            }
        }
        return new CfgNode.ExceptClause(type, name, handlerBody);
    }

    private static @Nullable SyntaxNode asPatternTarget(SyntaxNode asPattern) {
        var alias = asPattern.childByField("alias");
        if (alias.isEmpty()) {
            var named = asPattern.namedChildren();
            return named.size() > 1 ? named.get(named.size() - 1) : null;
        }
        var target = alias.get();
        // as_pattern_target wraps the actual target expression
        return target.isLeaf() || target.namedChildren().isEmpty() ? target : target.namedChildren().get(0);
    }

    // with a as x, b as y: body  ==>  With(a, x, With(b, y, body))
    private CfgNode withStatement(SyntaxNode node) {
        var items = new ArrayList<SyntaxNode>();
        node.firstChildOfKind(WITH_CLAUSE).ifPresent(clause -> collectWithItems(clause, items));
        CfgNode result = body(node, "body");
        for (int i = items.size() - 1; i >= 0; i--) {
            var value = required(items.get(i), "value");
            if (value.is(AS_PATTERN)) {
                var alias = asPatternTarget(value);
                result = new CfgNode.With(
                        expression(firstNamed(value)), alias == null ? null : target(alias), result);
            } else {
                result = new CfgNode.With(expression(value), null, result);
            }
        }
        return result;
    }

    private static void collectWithItems(SyntaxNode node, List<SyntaxNode> out) {
        for (var child : node.namedChildren()) {
            if (child.is(WITH_ITEM)) {
                out.add(child);
            } else {
                collectWithItems(child, out);
            }
        }
    }

    // Case patterns are not matched; every case body is treated as possibly taken.
    private CfgNode matchStatement(SyntaxNode node) {
        var statements = new ArrayList<CfgNode>();
        node.childByField("subject").ifPresent(s -> statements.add(new CfgNode.ExpressionStmt(expression(s))));
        var branches = new ArrayList<CfgNode.IfBranch>();
        node.childByField("body").ifPresent(cases -> {
            for (var clause : cases.namedChildren()) {
                if (clause.is(CASE_CLAUSE)) {
                    branches.add(new CfgNode.IfBranch(new Expression.Unknown("case"), body(clause, "consequence")));
                }
            }
        });
        if (!branches.isEmpty()) {
            statements.add(new CfgNode.If(branches));
        }
        return statements.isEmpty() ? CfgNode.NoOp.INSTANCE : new CfgNode.Group(statements);
    }

    private CfgNode decoratedDefinition(SyntaxNode node) {
        var decorators = new ArrayList<Expression>();
        for (var child : node.namedChildren()) {
            if (child.is(DECORATOR) && !child.namedChildren().isEmpty()) {
                decorators.add(expression(child.namedChildren().get(0)));
            }
        }
        var definition = required(node, "definition");
        if (definition.is(CLASS_DEFINITION)) {
            return classDefinition(definition, decorators);
        }
        return functionDefinition(definition, decorators);
    }

    private CfgNode functionDefinition(SyntaxNode node, List<Expression> decorators) {
        var name = required(node, "name").text();
        var params = node.childByField("parameters").map(this::parameters).orElse(List.of());
        var returnHint = node.childByField("return_type").map(this::expression).orElse(null);
        return new CfgNode.FunctionDef(name, params, body(node, "body"), decorators, returnHint);
    }

    private CfgNode classDefinition(SyntaxNode node, List<Expression> decorators) {
        var name = required(node, "name").text();
        var bases = new ArrayList<Expression>();
        var keywords = new LinkedHashMap<String, Expression>();
        node.childByField("superclasses").ifPresent(arguments -> {
            for (var arg : arguments.namedChildren()) {
                if (arg.is(KEYWORD_ARGUMENT)) {
                    keywords.put(required(arg, "name").text(), expression(required(arg, "value")));
                } else {
                    bases.add(expression(arg));
                }
            }
        });
        return new CfgNode.ClassDef(name, bases, keywords, body(node, "body"), decorators);
    }

    List<Parameter> parameters(SyntaxNode node) {
        var params = new ArrayList<Parameter>();
        for (var p : node.namedChildren()) {
            switch (p.kind()) {
                case IDENTIFIER -> params.add(Parameter.single(p.text()));
                case TYPED_PARAMETER -> {
                    var inner = firstNamed(p);
                    var hint = p.childByField("type").map(this::expression).orElse(null);
                    params.add(new Parameter(parameterName(inner), parameterKind(inner), null, hint));
                }
                case DEFAULT_PARAMETER -> params.add(new Parameter(
                        required(p, "name").text(),
                        ParameterKind.SINGLE,
                        expression(required(p, "value")),
                        null));
                case TYPED_DEFAULT_PARAMETER -> params.add(new Parameter(
                        required(p, "name").text(),
                        ParameterKind.SINGLE,
                        expression(required(p, "value")),
                        p.childByField("type").map(this::expression).orElse(null)));
                case LIST_SPLAT_PATTERN, DICTIONARY_SPLAT_PATTERN ->
                    params.add(new Parameter(parameterName(p), parameterKind(p), null, null));
                case KEYWORD_SEPARATOR, POSITIONAL_SEPARATOR, COMMENT -> {
                    // markers only
                }
                default -> logger.debug("Ignoring parameter of kind {} at line {}", p.kind(), p.startLine() + 1);
            }
        }
        return params;
    }

    private static String parameterName(SyntaxNode node) {
        if (node.is(LIST_SPLAT_PATTERN) || node.is(DICTIONARY_SPLAT_PATTERN)) {
            return node.namedChildren().isEmpty() ? node.text() : node.namedChildren().get(0).text();
        }
        return node.text();
    }

    private static ParameterKind parameterKind(SyntaxNode node) {
        if (node.is(LIST_SPLAT_PATTERN)) {
            return ParameterKind.VAR_POSITIONAL;
        }
        if (node.is(DICTIONARY_SPLAT_PATTERN)) {
            return ParameterKind.VAR_KEYWORD;
        }
        return ParameterKind.SINGLE;
    }

    // Assignment targets share the expression forms; unpacking patterns become tuple or list displays.
    Expression target(SyntaxNode node) {
        return switch (node.kind()) {
            case PATTERN_LIST, TUPLE_PATTERN, EXPRESSION_LIST -> sequence(PySequence.Kind.TUPLE, node);
            case LIST_PATTERN -> sequence(PySequence.Kind.LIST, node);
            case LIST_SPLAT_PATTERN -> new Expression.Starred("*", target(firstNamed(node)));
            default -> expression(node);
        };
    }

    Expression expression(SyntaxNode node) {
        try {
            return expressionUnchecked(node);
        } catch (ParseDegradedException e) {
            logger.warn("Degrading expression {}: {}", node, e.getMessage());
            return new Expression.Unknown(node.text());
        }
    }

    private Expression expressionUnchecked(SyntaxNode node) {
        return switch (node.kind()) {
            case IDENTIFIER -> new Expression.Variable(node.text());
            case ATTRIBUTE -> new Expression.Attribute(
                    expression(required(node, "object")), required(node, "attribute").text());
            case SUBSCRIPT -> subscript(node);
            case SLICE -> new Expression.Unknown(
                    "slice", node.namedChildren().stream().map(this::expression).toList());
            case CALL -> call(node);
            case INTEGER -> integer(node);
            case FLOAT -> floatLiteral(node);
            case STRING -> StringLiterals.string(node, this::expression);
            case CONCATENATED_STRING -> StringLiterals.concatenated(node, this::expression);
            case TRUE -> new Expression.Literal(true);
            case FALSE -> new Expression.Literal(false);
            case NONE -> new Expression.Literal(PyConstant.NONE);
            case ELLIPSIS -> new Expression.Literal(PyConstant.ELLIPSIS);
            case BINARY_OPERATOR, BOOLEAN_OPERATOR -> new Expression.BinaryOp(
                    expression(required(node, "left")),
                    required(node, "operator").text(),
                    expression(required(node, "right")));
            case UNARY_OPERATOR -> new Expression.UnaryOp(
                    required(node, "operator").text(), expression(required(node, "argument")));
            case NOT_OPERATOR -> new Expression.UnaryOp("not", expression(required(node, "argument")));
            case COMPARISON_OPERATOR -> comparison(node);
            case CONDITIONAL_EXPRESSION -> {
                var parts = node.namedChildren();
                if (parts.size() != 3) {
                    throw new ParseDegradedException(node, "malformed conditional expression");
                }
                yield new Expression.Conditional(
                        expression(parts.get(0)), expression(parts.get(1)), expression(parts.get(2)));
            }
            case PARENTHESIZED_EXPRESSION, TYPE -> {
                var inner = node.namedChildren();
                yield inner.isEmpty() ? new Expression.Unknown(node.text()) : expression(inner.get(0));
            }
            case TUPLE, EXPRESSION_LIST, PATTERN_LIST, TUPLE_PATTERN -> sequence(PySequence.Kind.TUPLE, node);
            case LIST, LIST_PATTERN -> sequence(PySequence.Kind.LIST, node);
            case SET -> sequence(PySequence.Kind.SET, node);
            case DICTIONARY -> dictionary(node);
            case LIST_COMPREHENSION -> comprehension(Expression.ComprehensionKind.LIST, node);
            case SET_COMPREHENSION -> comprehension(Expression.ComprehensionKind.SET, node);
            case DICTIONARY_COMPREHENSION -> comprehension(Expression.ComprehensionKind.DICT, node);
            case GENERATOR_EXPRESSION -> comprehension(Expression.ComprehensionKind.GENERATOR, node);
            case LAMBDA -> new Expression.Lambda(
                    node.childByField("parameters").map(this::parameters).orElse(List.of()),
                    expression(required(node, "body")));
            case NAMED_EXPRESSION -> new Expression.NamedExpr(
                    required(node, "name").text(), expression(required(node, "value")));
            case LIST_SPLAT, LIST_SPLAT_PATTERN -> new Expression.Starred("*", expression(firstNamed(node)));
            case DICTIONARY_SPLAT, DICTIONARY_SPLAT_PATTERN ->
                new Expression.Starred("**", expression(firstNamed(node)));
            case AWAIT -> new Expression.UnaryOp("await", expression(firstNamed(node)));
            case YIELD -> {
                var op = node.hasChildOfKind("from") ? "yield from" : "yield";
                var inner = node.namedChildren();
                yield new Expression.UnaryOp(
                        op,
                        inner.isEmpty() ? new Expression.Literal(PyConstant.NONE) : tupleOrSingle(inner));
            }
            case KEYWORD_ARGUMENT -> expression(required(node, "value"));
            case ERROR -> new Expression.Unknown(node.text());
            default -> {
                logger.debug("Unhandled expression kind {} at line {}", node.kind(), node.startLine() + 1);
                yield new Expression.Unknown(
                        node.text(), node.namedChildren().stream().map(this::expression).toList());
            }
        };
    }

    private Expression subscript(SyntaxNode node) {
        var base = expression(required(node, "value"));
        var indices = node.childrenByField("subscript");
        if (indices.isEmpty()) {
            throw new ParseDegradedException(node, "subscript without index");
        }
        var index = indices.size() == 1
                ? expression(indices.get(0))
                : new Expression.CollectionLiteral(
                        PySequence.Kind.TUPLE, indices.stream().map(this::expression).toList());
        return new Expression.Subscript(base, index);
    }

    private Expression call(SyntaxNode node) {
        var callee = expression(required(node, "function"));
        var arguments = required(node, "arguments");
        if (arguments.is(GENERATOR_EXPRESSION)) {
            return new Expression.Call(callee, List.of(expression(arguments)), Map.of());
        }
        var args = new ArrayList<Expression>();
        var kwargs = new LinkedHashMap<String, Expression>();
        for (var arg : arguments.namedChildren()) {
            if (arg.is(KEYWORD_ARGUMENT)) {
                kwargs.put(required(arg, "name").text(), expression(required(arg, "value")));
            } else if (!arg.is(COMMENT)) {
                args.add(expression(arg));
            }
        }
        return new Expression.Call(callee, args, kwargs);
    }

    // a < b < c  ==>  (a < b) and (b < c)
    private Expression comparison(SyntaxNode node) {
        var operands = new ArrayList<Expression>();
        var operators = new ArrayList<String>();
        var pendingOp = new StringBuilder();
        for (var child : node.children()) {
            if (child.named()) {
                if (!pendingOp.isEmpty()) {
                    operators.add(pendingOp.toString());
                    pendingOp.setLength(0);
                }
                operands.add(expression(child));
            } else {
                if (!pendingOp.isEmpty()) {
                    pendingOp.append(' ');
                }
                pendingOp.append(child.text().trim().replaceAll("\\s+", " "));
            }
        }
        if (operands.size() < 2 || operators.size() != operands.size() - 1) {
            throw new ParseDegradedException(node, "malformed comparison");
        }
        Expression result = null;
        for (int i = 0; i < operators.size(); i++) {
            var pair = new Expression.Compare(operands.get(i), operators.get(i), operands.get(i + 1));
            result = result == null ? pair : new Expression.BinaryOp(result, "and", pair);
        }
        return result;
    }

    private Expression sequence(PySequence.Kind kind, SyntaxNode node) {
        var elements = new ArrayList<Expression>();
        for (var child : node.namedChildren()) {
            if (!child.is(COMMENT)) {
                elements.add(target(child));
            }
        }
        return new Expression.CollectionLiteral(kind, elements);
    }

    private Expression dictionary(SyntaxNode node) {
        var entries = new ArrayList<Expression.DictEntry>();
        for (var child : node.namedChildren()) {
            if (child.is(PAIR)) {
                entries.add(new Expression.DictEntry(
                        expression(required(child, "key")), expression(required(child, "value"))));
            } else if (child.is(DICTIONARY_SPLAT)) {
                entries.add(new Expression.DictEntry(null, expression(firstNamed(child))));
            }
        }
        return new Expression.DictLiteral(entries);
    }

    private Expression comprehension(Expression.ComprehensionKind kind, SyntaxNode node) {
        var body = required(node, "body");
        Expression element;
        Expression value = null;
        if (kind == Expression.ComprehensionKind.DICT && body.is(PAIR)) {
            element = expression(required(body, "key"));
            value = expression(required(body, "value"));
        } else {
            element = expression(body);
        }
        var clauses = new ArrayList<Expression.ForClause>();
        Expression pendingTarget = null;
        Expression pendingIterable = null;
        var pendingConditions = new ArrayList<Expression>();
        for (var child : node.namedChildren()) {
            if (child.is(FOR_IN_CLAUSE)) {
                if (pendingTarget != null) {
                    clauses.add(new Expression.ForClause(pendingTarget, pendingIterable, pendingConditions));
                    pendingConditions = new ArrayList<>();
                }
                pendingTarget = target(required(child, "left"));
                var iterables = child.childrenByField("right");
                pendingIterable = iterables.size() == 1
                        ? expression(iterables.get(0))
                        : new Expression.CollectionLiteral(
                                PySequence.Kind.TUPLE, iterables.stream().map(this::expression).toList());
            } else if (child.is(IF_CLAUSE) && pendingTarget != null) {
                pendingConditions.add(expression(firstNamed(child)));
            }
        }
        if (pendingTarget == null) {
            throw new ParseDegradedException(node, "comprehension without for clause");
        }
        clauses.add(new Expression.ForClause(pendingTarget, pendingIterable, pendingConditions));
        return new Expression.Comprehension(kind, element, value, clauses);
    }

    private static Expression integer(SyntaxNode node) {
        var text = node.text().replace("_", "").toLowerCase(Locale.ROOT);
        if (text.endsWith("j")) {
            return new Expression.Unknown(node.text());
        }
        if (text.endsWith("l")) {
            text = text.substring(0, text.length() - 1);
        }
        try {
            if (text.startsWith("0x")) {
                return new Expression.Literal(Long.parseLong(text.substring(2), 16));
            }
            if (text.startsWith("0o")) {
                return new Expression.Literal(Long.parseLong(text.substring(2), 8));
            }
            if (text.startsWith("0b")) {
                return new Expression.Literal(Long.parseLong(text.substring(2), 2));
            }
            return new Expression.Literal(Long.parseLong(text));
        } catch (NumberFormatException e) {
            // beyond 64 bits
            return new Expression.Unknown(node.text());
        }
    }

    private static Expression floatLiteral(SyntaxNode node) {
        var text = node.text().replace("_", "");
        if (text.endsWith("j") || text.endsWith("J")) {
            return new Expression.Unknown(node.text());
        }
        try {
            return new Expression.Literal(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return new Expression.Unknown(node.text());
        }
    }

    private Expression tupleOrSingle(List<SyntaxNode> nodes) {
        if (nodes.size() == 1) {
            return expression(nodes.get(0));
        }
        return new Expression.CollectionLiteral(
                PySequence.Kind.TUPLE, nodes.stream().map(this::expression).toList());
    }

    private static SyntaxNode firstNamed(SyntaxNode node) {
        var named = node.namedChildren();
        if (named.isEmpty()) {
            throw new ParseDegradedException(node, "missing operand");
        }
        return named.get(0);
    }

    private static SyntaxNode required(SyntaxNode node, String field) {
        Optional<SyntaxNode> child = node.childByField(field);
        return child.orElseThrow(() -> new ParseDegradedException(node, "missing field '" + field + "'"));
    }
}
