package ai.importfix.lang;

import ai.importfix.frame.Frame;
import ai.importfix.value.Arguments;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.FuzzyBoolean;
import ai.importfix.value.PyObject;
import ai.importfix.value.UnknownValue;
import ai.importfix.value.Value;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** An instance of a {@link PyClass}. Instance attributes shadow class members. */
public final class PyInstance implements PyObject {
    private final Value classValue;
    private final PyClass cls;
    private final Map<String, Value> attributes = new LinkedHashMap<>();
    // special methods currently running without a caller frame; guards against self-referential properties
    private final Set<String> running = new HashSet<>();
    private @Nullable Value self;

    public PyInstance(Value classValue, PyClass cls) {
        this.classValue = classValue;
        this.cls = cls;
    }

    /** Records the value wrapping this instance so special methods receive it as {@code self}. */
    void attach(Value wrapper) {
        this.self = wrapper;
    }

    public PyClass pyClass() {
        return cls;
    }

    @Override
    public String typeName() {
        return "instance";
    }

    @Override
    public String describe() {
        return cls.name() + " instance";
    }

    @Override
    public boolean hasAttribute(String name) {
        return name.equals("__class__") || attributes.containsKey(name) || cls.hasAttribute(name);
    }

    @Override
    public @Nullable Value getAttribute(String name, Value self) {
        if (name.equals("__class__")) {
            return classValue;
        }
        var own = attributes.get(name);
        if (own != null) {
            return own;
        }
        var member = cls.lookup(name);
        if (member instanceof ConcreteValue c && c.underlying() instanceof PyFunction fn) {
            if (fn.isStaticMethod()) {
                return member;
            }
            if (fn.isClassMethod()) {
                return ConcreteValue.of(new BoundMethod(fn, classValue));
            }
            if (fn.isProperty()) {
                return invokeDetached(name, fn, Arguments.of(self));
            }
            return ConcreteValue.of(new BoundMethod(fn, self));
        }
        if (member != null) {
            return member;
        }
        return cls.hasOpaqueBase() ? new UnknownValue(cls.name() + "." + name) : null;
    }

    @Override
    public boolean setAttribute(String name, Value value) {
        attributes.put(name, value);
        return true;
    }

    @Override
    public FuzzyBoolean truthiness() {
        return cls.lookup("__bool__") != null || cls.lookup("__len__") != null
                ? FuzzyBoolean.MAYBE
                : FuzzyBoolean.TRUE;
    }

    @Override
    public Value call(Arguments args, Frame caller, Value self) {
        var member = cls.lookup("__call__");
        if (member instanceof ConcreteValue c && c.underlying() instanceof PyFunction fn) {
            return fn.call(args.prepend(self), caller, member);
        }
        return new UnknownValue(describe() + "()");
    }

    @Override
    public Value getItem(Value index) {
        var member = cls.lookup("__getitem__");
        if (member instanceof ConcreteValue c && c.underlying() instanceof PyFunction fn) {
            return invokeDetached("__getitem__", fn, Arguments.of(self != null ? self : ConcreteValue.of(this), index));
        }
        return new UnknownValue(describe() + "[]");
    }

    // Runs a method where no caller frame is at hand; the defining frame stands in as caller.
    private Value invokeDetached(String name, PyFunction fn, Arguments args) {
        if (!running.add(name)) {
            return new UnknownValue(cls.name() + "." + name);
        }
        try {
            return fn.call(args, fn.definingFrame(), ConcreteValue.of(fn));
        } finally {
            running.remove(name);
        }
    }
}
