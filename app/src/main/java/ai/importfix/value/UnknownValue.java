package ai.importfix.value;

import ai.importfix.frame.Frame;

/** A value nothing is known about. Attribute reads produce further unknowns, which are remembered. */
public final class UnknownValue implements Value {
    private final String name;
    private final DynamicContainer dynamicAttributes = new DynamicContainer();

    public UnknownValue(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public boolean hasAttribute(String attribute) {
        return dynamicAttributes.hasAttribute(attribute);
    }

    @Override
    public Value getAttribute(String attribute) {
        var existing = dynamicAttributes.getAttribute(attribute);
        if (existing != null) {
            return existing;
        }
        var created = new UnknownValue(name + "." + attribute);
        dynamicAttributes.setAttribute(attribute, created);
        return created;
    }

    @Override
    public void setAttribute(String attribute, Value value) {
        dynamicAttributes.setAttribute(attribute, value);
    }

    @Override
    public FuzzyBoolean valueEquals(Value other) {
        return other == this ? FuzzyBoolean.TRUE : FuzzyBoolean.MAYBE;
    }

    @Override
    public FuzzyBoolean boolValue() {
        return FuzzyBoolean.MAYBE;
    }

    @Override
    public Value call(Arguments args, Frame caller) {
        return new UnknownValue(name + "()");
    }

    @Override
    public Value getItem(Value index) {
        return new UnknownValue(name + "[]");
    }

    @Override
    public void setItem(Value index, Value value) {
        // nothing to record against
    }

    @Override
    public Value iterate() {
        return new UnknownValue("iter(" + name + ")");
    }

    @Override
    public Object value() {
        throw new AmbiguousValueException("Unknown value " + name + " has no concrete value");
    }

    @Override
    public String describe() {
        return name;
    }

    @Override
    public String toString() {
        return "Unknown[" + name + "]";
    }
}
