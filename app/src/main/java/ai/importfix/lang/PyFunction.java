package ai.importfix.lang;

import ai.importfix.ast.Parameter;
import ai.importfix.cfg.CfgNode;
import ai.importfix.frame.Frame;
import ai.importfix.frame.FrameType;
import ai.importfix.value.Arguments;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.PyDict;
import ai.importfix.value.PyObject;
import ai.importfix.value.PySequence;
import ai.importfix.value.UnknownValue;
import ai.importfix.value.Value;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * A function defined in analyzed source. Calling it runs its body in a fresh frame whose enclosing bindings are a
 * snapshot of the defining frame, taken at call time.
 */
public final class PyFunction implements PyObject {
    private static final Logger logger = LogManager.getLogger(PyFunction.class);

    private final String name;
    private final List<Parameter> params;
    private final Map<String, Value> defaults;
    private final CfgNode body;
    private final Frame definingFrame;
    private final List<String> decorators;

    /**
     * @param defaults default values by parameter name, evaluated when the definition ran
     * @param decorators simple names of the decorators applied to the definition
     */
    public PyFunction(
            String name,
            List<Parameter> params,
            Map<String, Value> defaults,
            CfgNode body,
            Frame definingFrame,
            List<String> decorators) {
        this.name = name;
        this.params = List.copyOf(params);
        this.defaults = new LinkedHashMap<>(defaults);
        this.body = body;
        this.definingFrame = definingFrame;
        this.decorators = List.copyOf(decorators);
    }

    public String name() {
        return name;
    }

    public List<Parameter> params() {
        return params;
    }

    public Frame definingFrame() {
        return definingFrame;
    }

    public boolean isStaticMethod() {
        return decorators.contains("staticmethod");
    }

    public boolean isClassMethod() {
        return decorators.contains("classmethod");
    }

    public boolean isProperty() {
        return decorators.contains("property") || decorators.contains("cached_property");
    }

    @Override
    public String typeName() {
        return "function";
    }

    @Override
    public String describe() {
        return "function " + name;
    }

    @Override
    public boolean hasAttribute(String attribute) {
        return attribute.equals("__name__");
    }

    @Override
    public @Nullable Value getAttribute(String attribute, Value self) {
        return attribute.equals("__name__") ? ConcreteValue.of(name) : null;
    }

    @Override
    public Value call(Arguments args, Frame caller, Value self) {
        if (caller.depth() >= caller.registry().config().maxCallDepth()) {
            logger.debug("Not following call to {}: depth limit {} reached", name, caller.depth());
            return new UnknownValue(name + "()");
        }
        if (caller.isExecuting(this)) {
            logger.debug("Not following recursive call to {}", name);
            return new UnknownValue(name + "()");
        }
        var frame = definingFrame.makeChild(FrameType.FUNCTION, this, caller);
        bindArguments(args, frame);
        body.process(frame);
        return frame.returnValue();
    }

    private void bindArguments(Arguments args, Frame frame) {
        var positional = args.positional();
        var named = new HashSet<String>();
        int next = 0;
        for (var p : params) {
            switch (p.kind()) {
                case SINGLE -> {
                    named.add(p.name());
                    Value v;
                    if (next < positional.size()) {
                        v = positional.get(next++);
                    } else if (args.keywords().containsKey(p.name())) {
                        v = args.keywords().get(p.name());
                    } else if (defaults.containsKey(p.name()) && !args.openEnded()) {
                        v = defaults.get(p.name());
                    } else {
                        v = new UnknownValue(name + "." + p.name());
                    }
                    frame.assign(p.name(), v);
                }
                case VAR_POSITIONAL -> {
                    var rest = next < positional.size()
                            ? positional.subList(next, positional.size())
                            : List.<Value>of();
                    next = positional.size();
                    frame.assign(
                            p.name(),
                            args.openEnded()
                                    ? new UnknownValue(p.name())
                                    : ConcreteValue.of(new PySequence(PySequence.Kind.TUPLE, rest)));
                }
                case VAR_KEYWORD -> {
                    var extra = new PyDict();
                    args.keywords().forEach((k, v) -> {
                        if (!named.contains(k)) {
                            extra.put(ConcreteValue.of(k), v);
                        }
                    });
                    if (args.openEnded()) {
                        extra.markOpenEnded();
                    }
                    frame.assign(p.name(), ConcreteValue.of(extra));
                }
            }
        }
    }
}
