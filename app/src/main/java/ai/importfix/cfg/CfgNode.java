package ai.importfix.cfg;

import ai.importfix.ast.Expression;
import ai.importfix.ast.Parameter;
import ai.importfix.ast.Targets;
import ai.importfix.frame.Frame;
import ai.importfix.frame.FrameType;
import ai.importfix.lang.PyClass;
import ai.importfix.lang.PyFunction;
import ai.importfix.lang.PyInstance;
import ai.importfix.lang.PyModule;
import ai.importfix.value.Arguments;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.FuzzyBoolean;
import ai.importfix.value.Operators;
import ai.importfix.value.UnknownValue;
import ai.importfix.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A statement of the executable statement tree. Blocks are {@link Group}s of statements in source order; the tree is
 * owned top down and contains no back links.
 *
 * <p>{@link #process} runs the statement abstractly in a frame. Branches whose condition is undecided are all run, and
 * names they bind differently end up bound to a fuzzy merge of the alternatives.
 */
public sealed interface CfgNode {

    void process(Frame frame);

    record ExpressionStmt(Expression expression) implements CfgNode {
        @Override
        public void process(Frame frame) {
            expression.evaluate(frame);
        }
    }

    /**
     * Assignment to one or more targets. {@code op} is {@code =} or an augmented operator such as {@code +=}. A
     * missing value is an annotation without assignment, which binds nothing.
     */
    record Assign(List<Expression> targets, String op, @Nullable Expression value, @Nullable Expression typeHint)
            implements CfgNode {
        public Assign {
            targets = List.copyOf(targets);
        }

        @Override
        public void process(Frame frame) {
            if (value == null) {
                return;
            }
            if (op.equals("=")) {
                var v = value.evaluate(frame);
                targets.forEach(target -> Targets.bind(target, v, frame));
                return;
            }
            var target = targets.get(0);
            var combined = Operators.binary(op.substring(0, op.length() - 1), target.evaluate(frame),
                    value.evaluate(frame));
            Targets.bind(target, combined, frame);
        }
    }

    record Return(@Nullable Expression value) implements CfgNode {
        @Override
        public void process(Frame frame) {
            frame.addReturn(value == null ? ConcreteValue.none() : value.evaluate(frame));
        }
    }

    /** {@code import a.b.c} binds {@code a}; {@code import a.b.c as x} binds {@code x} to {@code a.b.c}. */
    record Import(String modulePath, @Nullable String alias) implements CfgNode {
        @Override
        public void process(Frame frame) {
            var registry = frame.registry();
            if (alias != null) {
                frame.assign(alias, registry.importModule(modulePath, frame.directory()));
                return;
            }
            var parts = modulePath.split("\\.");
            Value parent = registry.importModule(parts[0], frame.directory());
            frame.assign(parts[0], parent);
            var path = new StringBuilder(parts[0]);
            for (int i = 1; i < parts.length; i++) {
                path.append('.').append(parts[i]);
                var child = registry.importModule(path.toString(), frame.directory());
                parent.setAttribute(parts[i], child);
                parent = child;
            }
        }
    }

    /**
     * {@code from module import name [as alias], ...} or {@code from module import *}. Names map to their alias, or to
     * null when imported under their own name.
     */
    record FromImport(String modulePath, Map<String, @Nullable String> names, boolean wildcard) implements CfgNode {
        public FromImport {
            names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
        }

        @Override
        public void process(Frame frame) {
            var registry = frame.registry();
            var module = registry.importModule(modulePath, frame.directory());
            if (wildcard) {
                if (module.underlying() instanceof PyModule m && m.isResolved()) {
                    for (var name : m.publicNames()) {
                        frame.assign(name, module.getAttribute(name));
                    }
                }
                return;
            }
            names.forEach((name, alias) -> frame.assign(alias != null ? alias : name, importName(frame, module, name)));
        }

        private Value importName(Frame frame, ConcreteValue module, String name) {
            var m = (PyModule) module.underlying();
            if (m.isResolved() && !m.isNative() && m.hasAttribute(name)) {
                return module.getAttribute(name);
            }
            var submodulePath = modulePath.endsWith(".") ? modulePath + name : modulePath + "." + name;
            var registry = frame.registry();
            var key = registry.resolver().resolve(submodulePath, frame.directory());
            if (key.isLoadable() && !(m.isNative() && key.isNative())) {
                var submodule = registry.importModule(submodulePath, frame.directory());
                module.setAttribute(name, submodule);
                return submodule;
            }
            if (m.isResolved()) {
                return module.getAttribute(name);
            }
            return new UnknownValue(modulePath + "." + name);
        }
    }

    record IfBranch(Expression condition, CfgNode body) {}

    /** {@code if}/{@code elif}/{@code else} chain; an {@code else} is a branch whose condition is literal True. */
    record If(List<IfBranch> branches) implements CfgNode {
        public If {
            branches = List.copyOf(branches);
        }

        @Override
        public void process(Frame frame) {
            var entry = frame.snapshotLocals();
            var outcomes = new ArrayList<Map<String, Value>>();
            boolean exhaustive = false;
            for (var branch : branches) {
                frame.restoreLocals(entry);
                var truth = branch.condition().evaluate(frame).boolValue();
                if (truth == FuzzyBoolean.FALSE) {
                    continue;
                }
                branch.body().process(frame);
                outcomes.add(frame.snapshotLocals());
                if (truth == FuzzyBoolean.TRUE) {
                    exhaustive = true;
                    break;
                }
            }
            if (!exhaustive) {
                outcomes.add(entry);
            }
            Branches.merge(frame, outcomes);
        }
    }

    /** The body is run once; unless the condition is known true, the state after it merges with the entry state. */
    record While(Expression condition, CfgNode body, CfgNode elseBody) implements CfgNode {
        @Override
        public void process(Frame frame) {
            var truth = condition.evaluate(frame).boolValue();
            if (truth != FuzzyBoolean.FALSE) {
                var entry = frame.snapshotLocals();
                body.process(frame);
                if (truth != FuzzyBoolean.TRUE) {
                    Branches.merge(frame, List.of(entry, frame.snapshotLocals()));
                }
            }
            elseBody.process(frame);
        }
    }

    record For(Expression target, Expression iterable, CfgNode body, CfgNode elseBody) implements CfgNode {
        @Override
        public void process(Frame frame) {
            var element = iterable.evaluate(frame).iterate();
            var entry = frame.snapshotLocals();
            Targets.bind(target, element, frame);
            body.process(frame);
            Branches.merge(frame, List.of(entry, frame.snapshotLocals()));
            elseBody.process(frame);
        }
    }

    /** One {@code except [type [as name]]} handler. */
    record ExceptClause(@Nullable Expression type, @Nullable String name, CfgNode body) {}

    /** Handlers start from the state after the body and else block; their outcomes merge before the finally block. */
    record Try(CfgNode body, List<ExceptClause> handlers, CfgNode elseBody, CfgNode finallyBody) implements CfgNode {
        public Try {
            handlers = List.copyOf(handlers);
        }

        @Override
        public void process(Frame frame) {
            body.process(frame);
            elseBody.process(frame);
            var afterBody = frame.snapshotLocals();
            var outcomes = new ArrayList<Map<String, Value>>();
            outcomes.add(afterBody);
            for (var handler : handlers) {
                frame.restoreLocals(afterBody);
                var type = handler.type();
                var exceptionType = type == null ? null : type.evaluate(frame);
                if (handler.name() != null) {
                    var description = exceptionType == null ? "exception" : exceptionType.describe();
                    frame.assign(handler.name(), new UnknownValue(description + " instance"));
                }
                handler.body().process(frame);
                outcomes.add(frame.snapshotLocals());
            }
            Branches.merge(frame, outcomes);
            finallyBody.process(frame);
        }
    }

    /** One with-item. Several items nest as several {@code With} nodes. */
    record With(Expression context, @Nullable Expression target, CfgNode body) implements CfgNode {
        @Override
        public void process(Frame frame) {
            var manager = context.evaluate(frame);
            if (target != null) {
                Targets.bind(target, entered(manager, frame), frame);
            }
            body.process(frame);
        }

        private static Value entered(Value manager, Frame frame) {
            if (manager instanceof ConcreteValue c && c.underlying() instanceof PyInstance instance
                    && instance.pyClass().lookup("__enter__") != null) {
                return manager.getAttribute("__enter__").call(Arguments.NONE, frame);
            }
            return manager;
        }
    }

    /**
     * A {@code def}. Defaults and decorators are evaluated when the definition runs; decorators are not applied, but
     * their simple names are recorded on the function.
     */
    record FunctionDef(
            String name,
            List<Parameter> params,
            CfgNode body,
            List<Expression> decorators,
            @Nullable Expression returnHint)
            implements CfgNode {
        public FunctionDef {
            params = List.copyOf(params);
            decorators = List.copyOf(decorators);
        }

        @Override
        public void process(Frame frame) {
            var decoratorNames = new ArrayList<String>();
            for (var decorator : decorators) {
                decorator.evaluate(frame);
                decoratorNames.add(simpleName(decorator));
            }
            var defaults = new LinkedHashMap<String, Value>();
            for (var p : params) {
                if (p.defaultValue() != null) {
                    defaults.put(p.name(), p.defaultValue().evaluate(frame));
                }
            }
            // @x.setter and @x.deleter keep the property bound to x
            if ((decoratorNames.contains("setter") || decoratorNames.contains("deleter")) && frame.isDefined(name)) {
                return;
            }
            frame.assign(name, ConcreteValue.of(new PyFunction(name, params, defaults, body, frame, decoratorNames)));
        }
    }

    /** A {@code class}. The body runs immediately in a class frame whose bindings become the class members. */
    record ClassDef(
            String name,
            List<Expression> bases,
            Map<String, Expression> keywords,
            CfgNode body,
            List<Expression> decorators)
            implements CfgNode {
        public ClassDef {
            bases = List.copyOf(bases);
            keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
            decorators = List.copyOf(decorators);
        }

        @Override
        public void process(Frame frame) {
            decorators.forEach(d -> d.evaluate(frame));
            var baseValues = bases.stream().map(b -> b.evaluate(frame)).toList();
            keywords.values().forEach(k -> k.evaluate(frame));
            var classFrame = frame.makeChild(FrameType.CLASS, this, frame);
            body.process(classFrame);
            frame.assign(name, ConcreteValue.of(new PyClass(name, baseValues, classFrame.locals())));
        }
    }

    /** A block. Statements after a top-level {@code return} are unreachable and not run. */
    record Group(List<CfgNode> children) implements CfgNode {
        public Group {
            children = List.copyOf(children);
        }

        @Override
        public void process(Frame frame) {
            for (var child : children) {
                child.process(frame);
                if (child instanceof Return) {
                    break;
                }
            }
        }
    }

    record NoOp() implements CfgNode {
        public static final NoOp INSTANCE = new NoOp();

        @Override
        public void process(Frame frame) {}
    }

    private static String simpleName(Expression decorator) {
        if (decorator instanceof Expression.Variable v) {
            return v.name();
        }
        if (decorator instanceof Expression.Attribute a) {
            return a.name();
        }
        if (decorator instanceof Expression.Call c) {
            return simpleName(c.callee());
        }
        return "";
    }
}
