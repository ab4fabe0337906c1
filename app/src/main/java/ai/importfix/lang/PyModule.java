package ai.importfix.lang;

import ai.importfix.analyzer.ModuleKey;
import ai.importfix.cfg.CfgNode;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.NativeValue;
import ai.importfix.value.PyObject;
import ai.importfix.value.PySequence;
import ai.importfix.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A module namespace. Source modules load lazily: the body runs on first member access. While a module is loading its
 * partially populated members are visible, which is what a circular import observes.
 */
public final class PyModule implements PyObject {

    public enum State {
        UNLOADED,
        LOADING,
        LOADED
    }

    private enum Kind {
        SOURCE,
        NATIVE,
        UNRESOLVED
    }

    /** Populates a module's members, normally by running its body. */
    @FunctionalInterface
    public interface Loader {
        void load(PyModule module);
    }

    private final String name;
    private final ModuleKey key;
    private final Kind kind;
    private final Map<String, Value> members = new LinkedHashMap<>();
    private final @Nullable Loader loader;
    private State state;
    private @Nullable CfgNode graph;

    private PyModule(String name, ModuleKey key, Kind kind, @Nullable Loader loader, State state) {
        this.name = name;
        this.key = key;
        this.kind = kind;
        this.loader = loader;
        this.state = state;
    }

    /** A source module whose body runs on first member access. */
    public static PyModule lazy(String name, ModuleKey key, Loader loader) {
        return new PyModule(name, key, Kind.SOURCE, loader, State.UNLOADED);
    }

    /** A module implemented natively; its attributes are probed lazily. */
    public static PyModule nativeModule(String name, ModuleKey key) {
        return new PyModule(name, key, Kind.NATIVE, null, State.LOADED);
    }

    /** Stand-in for an import that could not be resolved. It has no attributes. */
    public static PyModule unresolved(String name, ModuleKey key) {
        return new PyModule(name, key, Kind.UNRESOLVED, null, State.LOADED);
    }

    /** A source module whose body the caller runs directly, such as the file being analyzed. */
    public static PyModule main(String name, ModuleKey key) {
        return new PyModule(name, key, Kind.SOURCE, null, State.LOADED);
    }

    public String name() {
        return name;
    }

    public ModuleKey key() {
        return key;
    }

    public State state() {
        return state;
    }

    public boolean isNative() {
        return kind == Kind.NATIVE;
    }

    public boolean isResolved() {
        return kind != Kind.UNRESOLVED;
    }

    /** The module's flow graph, once its source has been built. */
    public @Nullable CfgNode graph() {
        return graph;
    }

    public void setGraph(CfgNode graph) {
        this.graph = graph;
    }

    /** Live member map without triggering a load. Frames executing the module body write into it. */
    public Map<String, Value> rawMembers() {
        return members;
    }

    /** Members after loading the module if needed. */
    public Map<String, Value> members() {
        ensureLoaded();
        return Collections.unmodifiableMap(members);
    }

    public void ensureLoaded() {
        if (state != State.UNLOADED || loader == null) {
            return;
        }
        state = State.LOADING;
        try {
            loader.load(this);
        } finally {
            state = State.LOADED;
        }
    }

    /**
     * Names a wildcard import of this module binds: the strings of a literal {@code __all__} list or tuple, otherwise
     * every member not starting with an underscore.
     */
    public List<String> publicNames() {
        var all = members().get("__all__");
        if (all instanceof ConcreteValue c && c.underlying() instanceof PySequence seq) {
            var names = new ArrayList<String>();
            for (var element : seq.elements()) {
                if (element instanceof ConcreteValue e && e.underlying() instanceof String name) {
                    names.add(name);
                }
            }
            return names;
        }
        return members.keySet().stream().filter(n -> !n.startsWith("_")).toList();
    }

    @Override
    public String typeName() {
        return "module";
    }

    @Override
    public String describe() {
        return "module " + name;
    }

    @Override
    public boolean hasAttribute(String attribute) {
        return switch (kind) {
            case NATIVE -> true;
            case UNRESOLVED -> false;
            case SOURCE -> members().containsKey(attribute);
        };
    }

    @Override
    public @Nullable Value getAttribute(String attribute, Value self) {
        if (kind == Kind.NATIVE) {
            return members.computeIfAbsent(attribute, a -> new NativeValue(name + "." + a));
        }
        if (attribute.equals("__name__") && !members.containsKey(attribute)) {
            return ConcreteValue.of(name);
        }
        return kind == Kind.SOURCE ? members().get(attribute) : null;
    }

    @Override
    public boolean setAttribute(String attribute, Value value) {
        members.put(attribute, value);
        return true;
    }
}
