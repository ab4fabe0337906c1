package ai.importfix.ast;

import ai.importfix.cfg.CfgNode;
import ai.importfix.frame.Frame;
import ai.importfix.frame.FrameType;
import ai.importfix.lang.PyFunction;
import ai.importfix.scan.UsageContext;
import ai.importfix.value.Arguments;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.FuzzyValue;
import ai.importfix.value.Literals;
import ai.importfix.value.Operators;
import ai.importfix.value.PyDict;
import ai.importfix.value.PySequence;
import ai.importfix.value.UnknownValue;
import ai.importfix.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Typed expression tree built from the syntax tree. Every variant can be evaluated in a {@link Frame} and reports the
 * free names it uses, with how each is used.
 */
public sealed interface Expression {

    Value evaluate(Frame frame);

    /** Direct sub-expressions, in source order. */
    List<Expression> children();

    /** Names this expression reads without binding them itself, including names read inside lambda bodies. */
    default Map<String, UsageContext> freeSymbols() {
        return FreeSymbols.collect(this, true);
    }

    record Literal(Object value) implements Expression {
        public Literal {
            if (!Literals.isLiteral(value)) {
                throw new IllegalArgumentException("Not a literal: " + value.getClass().getName());
            }
        }

        @Override
        public Value evaluate(Frame frame) {
            return ConcreteValue.of(value);
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }
    }

    record Variable(String name) implements Expression {
        @Override
        public Value evaluate(Frame frame) {
            return frame.lookup(name).orElseGet(() -> new UnknownValue(name));
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }
    }

    record Attribute(Expression base, String name) implements Expression {
        @Override
        public Value evaluate(Frame frame) {
            return base.evaluate(frame).getAttribute(name);
        }

        @Override
        public List<Expression> children() {
            return List.of(base);
        }
    }

    record Subscript(Expression base, Expression index) implements Expression {
        @Override
        public Value evaluate(Frame frame) {
            var container = base.evaluate(frame);
            return container.getItem(index.evaluate(frame));
        }

        @Override
        public List<Expression> children() {
            return List.of(base, index);
        }
    }

    /** A call. Splatted arguments appear in {@code args} as {@link Starred} with op {@code *} or {@code **}. */
    record Call(Expression callee, List<Expression> args, Map<String, Expression> kwargs) implements Expression {
        public Call {
            args = List.copyOf(args);
            kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        }

        @Override
        public Value evaluate(Frame frame) {
            var target = callee.evaluate(frame);
            var positional = new ArrayList<Value>();
            var keywords = new LinkedHashMap<String, Value>();
            boolean openEnded = false;
            for (var arg : args) {
                if (arg instanceof Starred starred && starred.op().equals("*")) {
                    var spread = starred.inner().evaluate(frame);
                    if (spread instanceof ConcreteValue c && c.underlying() instanceof PySequence seq
                            && seq.kind() != PySequence.Kind.SET) {
                        positional.addAll(seq.elements());
                    } else {
                        openEnded = true;
                    }
                } else if (arg instanceof Starred starred && starred.op().equals("**")) {
                    var spread = starred.inner().evaluate(frame);
                    if (spread instanceof ConcreteValue c && c.underlying() instanceof PyDict dict
                            && dict.isFullyKnown()) {
                        dict.literalEntries().forEach((k, v) -> {
                            if (k instanceof String s) {
                                keywords.put(s, v);
                            }
                        });
                    } else {
                        openEnded = true;
                    }
                } else {
                    positional.add(arg.evaluate(frame));
                }
            }
            kwargs.forEach((name, expr) -> keywords.put(name, expr.evaluate(frame)));
            return target.call(new Arguments(positional, keywords, openEnded), frame);
        }

        @Override
        public List<Expression> children() {
            var out = new ArrayList<Expression>();
            out.add(callee);
            out.addAll(args);
            out.addAll(kwargs.values());
            return out;
        }
    }

    /** Arithmetic and bitwise operators, plus the short-circuiting {@code and} and {@code or}. */
    record BinaryOp(Expression left, String op, Expression right) implements Expression {
        @Override
        public Value evaluate(Frame frame) {
            var l = left.evaluate(frame);
            if (op.equals("and") || op.equals("or")) {
                var truth = l.boolValue();
                boolean shortCircuits = op.equals("and") ? truth.isFalse() : truth.isTrue();
                if (shortCircuits) {
                    return l;
                }
                var r = right.evaluate(frame);
                return truth.isMaybe() ? FuzzyValue.of(List.of(l, r)) : r;
            }
            return Operators.binary(op, l, right.evaluate(frame));
        }

        @Override
        public List<Expression> children() {
            return List.of(left, right);
        }
    }

    /** {@code not}, {@code -}, {@code +}, {@code ~}, and the opaque {@code await}/{@code yield} forms. */
    record UnaryOp(String op, Expression operand) implements Expression {
        @Override
        public Value evaluate(Frame frame) {
            var v = operand.evaluate(frame);
            if (op.equals("await") || op.startsWith("yield")) {
                return new UnknownValue(op + " " + v.describe());
            }
            return Operators.unary(op, v);
        }

        @Override
        public List<Expression> children() {
            return List.of(operand);
        }
    }

    record Compare(Expression left, String op, Expression right) implements Expression {
        @Override
        public Value evaluate(Frame frame) {
            return Operators.compare(op, left.evaluate(frame), right.evaluate(frame));
        }

        @Override
        public List<Expression> children() {
            return List.of(left, right);
        }
    }

    /** {@code trueExpr if condition else falseExpr}. */
    record Conditional(Expression trueExpr, Expression condition, Expression falseExpr) implements Expression {
        @Override
        public Value evaluate(Frame frame) {
            return switch (condition.evaluate(frame).boolValue()) {
                case TRUE -> trueExpr.evaluate(frame);
                case FALSE -> falseExpr.evaluate(frame);
                case MAYBE -> FuzzyValue.of(List.of(trueExpr.evaluate(frame), falseExpr.evaluate(frame)));
            };
        }

        @Override
        public List<Expression> children() {
            return List.of(trueExpr, condition, falseExpr);
        }
    }

    /** List, tuple or set display. Elements may be {@link Starred}. */
    record CollectionLiteral(PySequence.Kind kind, List<Expression> elements) implements Expression {
        public CollectionLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public Value evaluate(Frame frame) {
            var values = new ArrayList<Value>();
            boolean complete = true;
            for (var element : elements) {
                if (element instanceof Starred starred) {
                    var spread = starred.inner().evaluate(frame);
                    if (spread instanceof ConcreteValue c && c.underlying() instanceof PySequence seq) {
                        values.addAll(seq.elements());
                    } else {
                        complete = false;
                    }
                } else {
                    values.add(element.evaluate(frame));
                }
            }
            if (!complete) {
                return new UnknownValue(kind.name().toLowerCase(Locale.ROOT));
            }
            return ConcreteValue.of(new PySequence(kind, values));
        }

        @Override
        public List<Expression> children() {
            return elements;
        }
    }

    /** One dict display entry; a null key stands for {@code **value}. */
    record DictEntry(@Nullable Expression key, Expression value) {}

    record DictLiteral(List<DictEntry> entries) implements Expression {
        public DictLiteral {
            entries = List.copyOf(entries);
        }

        @Override
        public Value evaluate(Frame frame) {
            var dict = new PyDict();
            for (var entry : entries) {
                var key = entry.key();
                if (key == null) {
                    var merged = entry.value().evaluate(frame);
                    if (merged instanceof ConcreteValue c && c.underlying() instanceof PyDict other
                            && other.isFullyKnown()) {
                        other.literalEntries().forEach((k, v) -> dict.put(ConcreteValue.of(k), v));
                    } else {
                        dict.markOpenEnded();
                    }
                } else {
                    var k = key.evaluate(frame);
                    dict.put(k, entry.value().evaluate(frame));
                }
            }
            return ConcreteValue.of(dict);
        }

        @Override
        public List<Expression> children() {
            var out = new ArrayList<Expression>();
            for (var entry : entries) {
                if (entry.key() != null) {
                    out.add(entry.key());
                }
                out.add(entry.value());
            }
            return out;
        }
    }

    enum ComprehensionKind {
        LIST,
        SET,
        DICT,
        GENERATOR
    }

    /** One {@code for target in iterable if condition...} clause. */
    record ForClause(Expression target, Expression iterable, List<Expression> conditions) {
        public ForClause {
            conditions = List.copyOf(conditions);
        }
    }

    /**
     * A comprehension. Clauses nest left to right; {@code value} is set only for dict comprehensions, where
     * {@code element} is the key.
     */
    record Comprehension(
            ComprehensionKind kind, Expression element, @Nullable Expression value, List<ForClause> clauses)
            implements Expression {
        public Comprehension {
            if (clauses.isEmpty()) {
                throw new IllegalArgumentException("A comprehension needs at least one for clause");
            }
            clauses = List.copyOf(clauses);
        }

        @Override
        public Value evaluate(Frame frame) {
            var first = clauses.get(0).iterable().evaluate(frame);
            var scope = frame.makeChild(FrameType.COMPREHENSION, this, frame);
            for (int i = 0; i < clauses.size(); i++) {
                var clause = clauses.get(i);
                var iterable = i == 0 ? first : clause.iterable().evaluate(scope);
                Targets.bind(clause.target(), iterable.iterate(), scope);
                clause.conditions().forEach(c -> c.evaluate(scope));
            }
            element.evaluate(scope);
            if (value != null) {
                value.evaluate(scope);
            }
            return new UnknownValue(kind.name().toLowerCase(Locale.ROOT) + " comprehension");
        }

        @Override
        public List<Expression> children() {
            var out = new ArrayList<Expression>();
            for (var clause : clauses) {
                out.add(clause.target());
                out.add(clause.iterable());
                out.addAll(clause.conditions());
            }
            out.add(element);
            if (value != null) {
                out.add(value);
            }
            return out;
        }
    }

    /** {@code *inner} or {@code **inner}; the enclosing call or display decides what it means. */
    record Starred(String op, Expression inner) implements Expression {
        @Override
        public Value evaluate(Frame frame) {
            return inner.evaluate(frame);
        }

        @Override
        public List<Expression> children() {
            return List.of(inner);
        }
    }

    record Lambda(List<Parameter> params, Expression body) implements Expression {
        public Lambda {
            params = List.copyOf(params);
        }

        @Override
        public Value evaluate(Frame frame) {
            var defaults = new LinkedHashMap<String, Value>();
            for (var p : params) {
                if (p.defaultValue() != null) {
                    defaults.put(p.name(), p.defaultValue().evaluate(frame));
                }
            }
            var fn = new PyFunction("<lambda>", params, defaults, new CfgNode.Return(body), frame, List.of());
            return ConcreteValue.of(fn);
        }

        @Override
        public List<Expression> children() {
            var out = new ArrayList<Expression>();
            for (var p : params) {
                if (p.defaultValue() != null) {
                    out.add(p.defaultValue());
                }
            }
            out.add(body);
            return out;
        }
    }

    /** {@code name := value}; binds {@code name} in the enclosing scope. */
    record NamedExpr(String name, Expression value) implements Expression {
        @Override
        public Value evaluate(Frame frame) {
            var v = value.evaluate(frame);
            frame.assign(name, v);
            return v;
        }

        @Override
        public List<Expression> children() {
            return List.of(value);
        }
    }

    /** An f-string; only its interpolated expressions matter. */
    record FormattedString(List<Expression> interpolations) implements Expression {
        public FormattedString {
            interpolations = List.copyOf(interpolations);
        }

        @Override
        public Value evaluate(Frame frame) {
            interpolations.forEach(e -> e.evaluate(frame));
            return new UnknownValue("str");
        }

        @Override
        public List<Expression> children() {
            return interpolations;
        }
    }

    /**
     * Placeholder for syntax that could not be modeled. {@code inner} keeps whatever sub-expressions could still be
     * recovered so their names are not lost.
     */
    record Unknown(String sourceText, List<Expression> inner) implements Expression {
        public Unknown {
            Objects.requireNonNull(sourceText);
            inner = List.copyOf(inner);
        }

        public Unknown(String sourceText) {
            this(sourceText, List.of());
        }

        @Override
        public Value evaluate(Frame frame) {
            inner.forEach(e -> e.evaluate(frame));
            return new UnknownValue(sourceText);
        }

        @Override
        public List<Expression> children() {
            return inner;
        }
    }
}
