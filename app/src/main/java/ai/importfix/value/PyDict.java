package ai.importfix.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/**
 * A dict literal. Entries with literal keys are addressable; values stored under non-literal keys are only known to
 * be somewhere in the dict.
 */
public final class PyDict implements PyObject {
    private final Map<Object, Value> literalEntries = new LinkedHashMap<>();
    private final List<Value> otherValues = new ArrayList<>();
    private boolean openEnded;

    public void put(Value key, Value value) {
        if (key instanceof ConcreteValue c && c.isLiteral()) {
            literalEntries.put(normalize(c.underlying()), value);
        } else {
            otherValues.add(value);
        }
    }

    /** Marks that unknown entries were merged in, e.g. through {@code **other}. */
    public void markOpenEnded() {
        openEnded = true;
    }

    /** True if every entry has a literal key and nothing unknown was merged in. */
    public boolean isFullyKnown() {
        return !openEnded && otherValues.isEmpty();
    }

    public Map<Object, Value> literalEntries() {
        return Collections.unmodifiableMap(literalEntries);
    }

    private static Object normalize(Object key) {
        if (key instanceof Boolean b) return b ? 1L : 0L;
        if (key instanceof Double d && d == Math.rint(d) && !d.isInfinite()) return d.longValue();
        return key;
    }

    @Override
    public String typeName() {
        return "dict";
    }

    @Override
    public String describe() {
        return literalEntries.entrySet().stream()
                .map(e -> Literals.repr(e.getKey()) + ": " + e.getValue().describe())
                .collect(Collectors.joining(", ", "{", openEnded || !otherValues.isEmpty() ? ", ...}" : "}"));
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
        if (!literalEntries.isEmpty() || !otherValues.isEmpty()) {
            return FuzzyBoolean.TRUE;
        }
        return openEnded ? FuzzyBoolean.MAYBE : FuzzyBoolean.FALSE;
    }

    @Override
    public Value getItem(Value index) {
        if (index instanceof ConcreteValue c && c.isLiteral()) {
            var found = literalEntries.get(normalize(c.underlying()));
            if (found != null) {
                return found;
            }
            if (otherValues.isEmpty() && !openEnded) {
                return new UnknownValue("dict[" + c.describe() + "]");
            }
        }
        var all = new ArrayList<Value>(literalEntries.values());
        all.addAll(otherValues);
        return all.isEmpty() ? new UnknownValue("dict[]") : FuzzyValue.of(all);
    }

    @Override
    public void setItem(Value index, Value value) {
        put(index, value);
    }

    @Override
    public Value iterate() {
        if (literalEntries.isEmpty()) {
            return new UnknownValue("iter(dict)");
        }
        var keys = literalEntries.keySet().stream().map(k -> (Value) ConcreteValue.of(k)).toList();
        return FuzzyValue.of(keys);
    }
}
