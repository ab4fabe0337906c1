package ai.importfix.lang;

import ai.importfix.frame.Frame;
import ai.importfix.value.Arguments;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.PyObject;
import ai.importfix.value.Value;
import org.jetbrains.annotations.Nullable;

/** A function looked up through an instance or class, with the receiver passed as the first argument. */
public final class BoundMethod implements PyObject {
    private final PyFunction function;
    private final Value receiver;

    public BoundMethod(PyFunction function, Value receiver) {
        this.function = function;
        this.receiver = receiver;
    }

    public PyFunction function() {
        return function;
    }

    public Value receiver() {
        return receiver;
    }

    @Override
    public String typeName() {
        return "method";
    }

    @Override
    public String describe() {
        return "bound method " + function.name();
    }

    @Override
    public boolean hasAttribute(String name) {
        return name.equals("__self__") || name.equals("__func__") || function.hasAttribute(name);
    }

    @Override
    public @Nullable Value getAttribute(String name, Value self) {
        return switch (name) {
            case "__self__" -> receiver;
            case "__func__" -> ConcreteValue.of(function);
            default -> function.getAttribute(name, self);
        };
    }

    @Override
    public Value call(Arguments args, Frame caller, Value self) {
        return function.call(args.prepend(receiver), caller, self);
    }
}
