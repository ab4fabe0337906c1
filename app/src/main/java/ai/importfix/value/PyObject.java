package ai.importfix.value;

import ai.importfix.frame.Frame;
import org.jetbrains.annotations.Nullable;

/**
 * A modeled language object wrapped by a {@link ConcreteValue}: modules, classes, instances, functions and containers.
 * The wrapping value supplies the dynamic attribute bag; implementations only answer for what they model.
 */
public interface PyObject {

    String typeName();

    String describe();

    boolean hasAttribute(String name);

    /**
     * @param self the value wrapping this object, for binding methods
     * @return the attribute, or null if this object does not define it
     */
    @Nullable
    Value getAttribute(String name, Value self);

    /** @return false if the object does not store attributes itself */
    default boolean setAttribute(String name, Value value) {
        return false;
    }

    default Value call(Arguments args, Frame caller, Value self) {
        return new UnknownValue(describe() + "()");
    }

    default FuzzyBoolean truthiness() {
        return FuzzyBoolean.TRUE;
    }

    default Value getItem(Value index) {
        return new UnknownValue(describe() + "[]");
    }

    default void setItem(Value index, Value value) {}

    default Value iterate() {
        return new UnknownValue("iter(" + describe() + ")");
    }
}
