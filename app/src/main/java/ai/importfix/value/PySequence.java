package ai.importfix.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/** A list, tuple or set literal whose elements are known values. */
public final class PySequence implements PyObject {

    public enum Kind {
        LIST("list", "[", "]"),
        TUPLE("tuple", "(", ")"),
        SET("set", "{", "}");

        private final String typeName;
        private final String open;
        private final String close;

        Kind(String typeName, String open, String close) {
            this.typeName = typeName;
            this.open = open;
            this.close = close;
        }
    }

    private final Kind kind;
    private final List<Value> elements;

    public PySequence(Kind kind, List<Value> elements) {
        this.kind = kind;
        this.elements = new ArrayList<>(elements);
    }

    public Kind kind() {
        return kind;
    }

    public List<Value> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public String typeName() {
        return kind.typeName;
    }

    @Override
    public String describe() {
        return elements.stream().map(Value::describe).collect(Collectors.joining(", ", kind.open, kind.close));
    }

    @Override
    public boolean hasAttribute(String name) {
        return false;
    }

    @Override
    public @Nullable Value getAttribute(String name, Value self) {
        return null;
    }

    @Override
    public FuzzyBoolean truthiness() {
        return FuzzyBoolean.of(!elements.isEmpty());
    }

    @Override
    public Value getItem(Value index) {
        if (kind != Kind.SET && index instanceof ConcreteValue c && c.underlying() instanceof Long i) {
            long at = i < 0 ? elements.size() + i : i;
            if (at >= 0 && at < elements.size()) {
                return elements.get((int) at);
            }
            return new UnknownValue(typeName() + "[" + i + "]");
        }
        return iterate();
    }

    @Override
    public void setItem(Value index, Value value) {
        if (kind == Kind.LIST && index instanceof ConcreteValue c && c.underlying() instanceof Long i) {
            long at = i < 0 ? elements.size() + i : i;
            if (at >= 0 && at < elements.size()) {
                elements.set((int) at, value);
            }
        }
    }

    @Override
    public Value iterate() {
        if (elements.isEmpty()) {
            return new UnknownValue("iter(" + typeName() + ")");
        }
        return FuzzyValue.of(elements);
    }

    /** True if some element equals {@code needle}, false if none can, maybe otherwise. */
    public FuzzyBoolean containsValue(Value needle) {
        var results = elements.stream().map(e -> e.valueEquals(needle)).toList();
        if (results.contains(FuzzyBoolean.TRUE)) {
            return FuzzyBoolean.TRUE;
        }
        return results.contains(FuzzyBoolean.MAYBE) ? FuzzyBoolean.MAYBE : FuzzyBoolean.FALSE;
    }
}
