package ai.importfix.value;

import ai.importfix.frame.Frame;
import java.util.List;

/**
 * The result of evaluating an expression: one concrete value, an opaque native value, an unknown, or a fuzzy set of
 * possibilities. Every variant answers every operation; operations that cannot be decided produce unknowns or
 * {@link FuzzyBoolean#MAYBE} rather than failing.
 */
public sealed interface Value permits ConcreteValue, NativeValue, UnknownValue, FuzzyValue {

    boolean hasAttribute(String name);

    Value getAttribute(String name);

    void setAttribute(String name, Value value);

    FuzzyBoolean valueEquals(Value other);

    FuzzyBoolean boolValue();

    /**
     * Calls this value.
     *
     * @param caller the frame the call happens in; used for recursion and depth limits and module lookups
     */
    Value call(Arguments args, Frame caller);

    Value getItem(Value index);

    void setItem(Value index, Value value);

    /** The value a single iteration step over this value produces. */
    Value iterate();

    /**
     * The single underlying value.
     *
     * @throws AmbiguousValueException if there is no single underlying value
     */
    Object value();

    /** The possibilities this value stands for; a non-fuzzy value stands for itself. */
    default List<Value> members() {
        return List.of(this);
    }

    /** Short description for diagnostics and unknown-value naming. */
    String describe();
}
