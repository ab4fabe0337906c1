package ai.importfix.lang;

import ai.importfix.frame.Frame;
import ai.importfix.value.Arguments;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.PyObject;
import ai.importfix.value.UnknownValue;
import ai.importfix.value.Value;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A class defined in analyzed source. Attribute lookup follows the bases depth first, left to right. Bases that are not
 * classes from analyzed source (builtin or native types, unknowns) are opaque: any attribute may come from them.
 */
public final class PyClass implements PyObject {
    private final String name;
    private final List<Value> bases;
    private final Map<String, Value> members;

    public PyClass(String name, List<Value> bases, Map<String, Value> members) {
        this.name = name;
        this.bases = List.copyOf(bases);
        this.members = new LinkedHashMap<>(members);
    }

    public String name() {
        return name;
    }

    public List<Value> bases() {
        return bases;
    }

    public Map<String, Value> members() {
        return Collections.unmodifiableMap(members);
    }

    /** Finds a member on this class or a modeled base, without binding. */
    public @Nullable Value lookup(String attribute) {
        return lookup(attribute, new HashSet<>());
    }

    private @Nullable Value lookup(String attribute, Set<PyClass> visited) {
        if (!visited.add(this)) {
            return null;
        }
        var own = members.get(attribute);
        if (own != null) {
            return own;
        }
        for (var base : bases) {
            if (base instanceof ConcreteValue c && c.underlying() instanceof PyClass baseClass) {
                var inherited = baseClass.lookup(attribute, visited);
                if (inherited != null) {
                    return inherited;
                }
            }
        }
        return null;
    }

    /** True if some base, directly or inherited, is not a class from analyzed source. */
    public boolean hasOpaqueBase() {
        return hasOpaqueBase(new HashSet<>());
    }

    private boolean hasOpaqueBase(Set<PyClass> visited) {
        if (!visited.add(this)) {
            return false;
        }
        for (var base : bases) {
            if (!(base instanceof ConcreteValue c && c.underlying() instanceof PyClass baseClass)) {
                return true;
            }
            if (baseClass.hasOpaqueBase(visited)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String typeName() {
        return "type";
    }

    @Override
    public String describe() {
        return "class " + name;
    }

    @Override
    public boolean hasAttribute(String attribute) {
        return attribute.equals("__name__") || lookup(attribute) != null || hasOpaqueBase();
    }

    @Override
    public @Nullable Value getAttribute(String attribute, Value self) {
        if (attribute.equals("__name__")) {
            return ConcreteValue.of(name);
        }
        var found = lookup(attribute);
        if (found != null) {
            if (found instanceof ConcreteValue c && c.underlying() instanceof PyFunction fn && fn.isClassMethod()) {
                return ConcreteValue.of(new BoundMethod(fn, self));
            }
            return found;
        }
        if (hasOpaqueBase()) {
            return new UnknownValue(name + "." + attribute);
        }
        return null;
    }

    @Override
    public boolean setAttribute(String attribute, Value value) {
        members.put(attribute, value);
        return true;
    }

    /** Creates an instance and runs {@code __init__} on it if the class defines one. */
    @Override
    public Value call(Arguments args, Frame caller, Value self) {
        var created = new PyInstance(self, this);
        var instance = ConcreteValue.of(created);
        created.attach(instance);
        var init = lookup("__init__");
        if (init instanceof ConcreteValue c && c.underlying() instanceof PyFunction fn) {
            fn.call(args.prepend(instance), caller, init);
        }
        return instance;
    }

    @Override
    public Value getItem(Value index) {
        // Generic[T] style subscripts
        return new UnknownValue(name + "[]");
    }
}
