package ai.importfix.value;

import ai.importfix.frame.Frame;

/**
 * Exactly one known value: a literal or a modeled {@link PyObject}. Identity matters: two evaluations of the same
 * class statement produce distinct values.
 */
public final class ConcreteValue implements Value {
    private final Object underlying;
    private final DynamicContainer dynamicAttributes = new DynamicContainer();

    private ConcreteValue(Object underlying) {
        this.underlying = underlying;
    }

    public static ConcreteValue of(Object underlying) {
        if (!(underlying instanceof PyObject) && !Literals.isLiteral(underlying)) {
            throw new IllegalArgumentException("Not a modeled value: " + underlying.getClass().getName());
        }
        return new ConcreteValue(underlying);
    }

    public static ConcreteValue none() {
        return new ConcreteValue(PyConstant.NONE);
    }

    public static ConcreteValue ofBoolean(boolean b) {
        return new ConcreteValue(b);
    }

    public Object underlying() {
        return underlying;
    }

    public boolean isLiteral() {
        return Literals.isLiteral(underlying);
    }

    public boolean isNone() {
        return underlying == PyConstant.NONE;
    }

    @Override
    public boolean hasAttribute(String name) {
        if (underlying instanceof PyObject po && po.hasAttribute(name)) {
            return true;
        }
        return dynamicAttributes.hasAttribute(name);
    }

    @Override
    public Value getAttribute(String name) {
        if (underlying instanceof PyObject po) {
            var attribute = po.getAttribute(name, this);
            if (attribute != null) {
                return attribute;
            }
        }
        var dynamic = dynamicAttributes.getAttribute(name);
        if (dynamic != null) {
            return dynamic;
        }
        return new UnknownValue(typeName() + "." + name);
    }

    @Override
    public void setAttribute(String name, Value value) {
        if (underlying instanceof PyObject po && po.setAttribute(name, value)) {
            return;
        }
        dynamicAttributes.setAttribute(name, value);
    }

    @Override
    public FuzzyBoolean valueEquals(Value other) {
        if (other == this) {
            return FuzzyBoolean.TRUE;
        }
        if (other instanceof FuzzyValue fuzzy) {
            return FuzzyBoolean.unanimous(fuzzy.members().stream().map(this::valueEquals).toList());
        }
        if (!(other instanceof ConcreteValue concrete)) {
            return FuzzyBoolean.MAYBE;
        }
        var theirs = concrete.underlying;
        if (isLiteral() && concrete.isLiteral()) {
            return FuzzyBoolean.of(Literals.equal(underlying, theirs));
        }
        if (underlying == theirs) {
            return FuzzyBoolean.TRUE;
        }
        if (underlying instanceof PySequence || theirs instanceof PySequence || underlying instanceof PyDict
                || theirs instanceof PyDict || isInstance(underlying) || isInstance(theirs)) {
            // containers compare structurally and instances may define __eq__
            return FuzzyBoolean.MAYBE;
        }
        return FuzzyBoolean.FALSE;
    }

    private static boolean isInstance(Object o) {
        return o instanceof PyObject po && po.typeName().equals("instance");
    }

    @Override
    public FuzzyBoolean boolValue() {
        if (underlying instanceof PyObject po) {
            return po.truthiness();
        }
        return FuzzyBoolean.of(Literals.truthiness(underlying));
    }

    @Override
    public Value call(Arguments args, Frame caller) {
        if (underlying instanceof PyObject po) {
            return po.call(args, caller, this);
        }
        return new UnknownValue(describe() + "()");
    }

    @Override
    public Value getItem(Value index) {
        if (underlying instanceof PyObject po) {
            return po.getItem(index);
        }
        if (underlying instanceof String s && index instanceof ConcreteValue c && c.underlying instanceof Long i) {
            int at = (int) (i < 0 ? s.length() + i : i);
            if (at >= 0 && at < s.length()) {
                return ConcreteValue.of(String.valueOf(s.charAt(at)));
            }
        }
        return new UnknownValue(typeName() + "[]");
    }

    @Override
    public void setItem(Value index, Value value) {
        if (underlying instanceof PyObject po) {
            po.setItem(index, value);
        }
    }

    @Override
    public Value iterate() {
        if (underlying instanceof PyObject po) {
            return po.iterate();
        }
        return new UnknownValue("iter(" + typeName() + ")");
    }

    @Override
    public Object value() {
        return underlying;
    }

    public String typeName() {
        return underlying instanceof PyObject po ? po.typeName() : Literals.typeName(underlying);
    }

    @Override
    public String describe() {
        return underlying instanceof PyObject po ? po.describe() : Literals.repr(underlying);
    }

    @Override
    public String toString() {
        return "Concrete[" + describe() + "]";
    }
}
