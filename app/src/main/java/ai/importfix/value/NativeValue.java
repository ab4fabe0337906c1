package ai.importfix.value;

import ai.importfix.frame.Frame;
import org.jetbrains.annotations.Nullable;

/**
 * An object provided by the runtime rather than by analyzed source, such as a builtin function or a native module.
 * Its attributes cannot be enumerated, so they are probed lazily: every attribute read yields a native value named
 * after the access path and is remembered for later reads.
 */
public final class NativeValue implements Value {

    /** Models the result of calling a native function. */
    @FunctionalInterface
    public interface NativeFunction {
        Value call(Arguments args, Frame caller);
    }

    private final String name;
    private final @Nullable NativeFunction function;
    private final DynamicContainer dynamicAttributes = new DynamicContainer();

    public NativeValue(String name) {
        this(name, null);
    }

    public NativeValue(String name, @Nullable NativeFunction function) {
        this.name = name;
        this.function = function;
    }

    public String name() {
        return name;
    }

    @Override
    public boolean hasAttribute(String attribute) {
        return true;
    }

    @Override
    public Value getAttribute(String attribute) {
        var existing = dynamicAttributes.getAttribute(attribute);
        if (existing != null) {
            return existing;
        }
        var probed = new NativeValue(name + "." + attribute);
        dynamicAttributes.setAttribute(attribute, probed);
        return probed;
    }

    @Override
    public void setAttribute(String attribute, Value value) {
        dynamicAttributes.setAttribute(attribute, value);
    }

    @Override
    public FuzzyBoolean valueEquals(Value other) {
        if (other == this) {
            return FuzzyBoolean.TRUE;
        }
        if (other instanceof NativeValue n && n.name.equals(name)) {
            return FuzzyBoolean.TRUE;
        }
        return FuzzyBoolean.MAYBE;
    }

    @Override
    public FuzzyBoolean boolValue() {
        return FuzzyBoolean.TRUE;
    }

    @Override
    public Value call(Arguments args, Frame caller) {
        if (function != null) {
            return function.call(args, caller);
        }
        return new UnknownValue(name + "()");
    }

    @Override
    public Value getItem(Value index) {
        return new UnknownValue(name + "[]");
    }

    @Override
    public void setItem(Value index, Value value) {
        // opaque
    }

    @Override
    public Value iterate() {
        return new UnknownValue("iter(" + name + ")");
    }

    /** The qualified name standing in for the opaque runtime object. */
    @Override
    public Object value() {
        return name;
    }

    @Override
    public String describe() {
        return name;
    }

    @Override
    public String toString() {
        return "Native[" + name + "]";
    }
}
