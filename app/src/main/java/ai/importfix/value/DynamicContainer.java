package ai.importfix.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** Attribute bag for values whose underlying object cannot (or should not) be mutated, such as literals. */
public final class DynamicContainer {
    private final Map<String, Value> attributes = new LinkedHashMap<>();

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public @Nullable Value getAttribute(String name) {
        return attributes.get(name);
    }

    public void setAttribute(String name, Value value) {
        attributes.put(name, value);
    }

    public Map<String, Value> attributes() {
        return Collections.unmodifiableMap(attributes);
    }
}
