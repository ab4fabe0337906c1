package ai.importfix.frame;

import ai.importfix.lang.PyModule;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.FuzzyValue;
import ai.importfix.value.Value;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Bindings of one executing body plus the namespaces visible from it.
 *
 * <p>Lookup order is local, then global, then builtin. A child frame's globals are a snapshot of the parent's globals
 * and locals taken when the child is created, so a nested function sees the enclosing values as of the call, and
 * assignments inside it never write back to the enclosing frame.
 */
public final class Frame {
    private final Map<String, Value> locals;
    private final Map<String, Value> globals;
    private final Map<String, Value> builtins;
    private final List<Value> returns = new ArrayList<>();
    private final FrameType type;
    private final @Nullable Object namespace;
    private final @Nullable Frame back;
    private final @Nullable Frame lexicalParent;
    private final PyModule module;
    private final ModuleRegistry registry;
    private final Path directory;
    private final int depth;

    private Frame(
            Map<String, Value> locals,
            Map<String, Value> globals,
            Map<String, Value> builtins,
            FrameType type,
            @Nullable Object namespace,
            @Nullable Frame back,
            @Nullable Frame lexicalParent,
            PyModule module,
            ModuleRegistry registry,
            Path directory,
            int depth) {
        this.locals = locals;
        this.globals = globals;
        this.builtins = builtins;
        this.type = type;
        this.namespace = namespace;
        this.back = back;
        this.lexicalParent = lexicalParent;
        this.module = module;
        this.registry = registry;
        this.directory = directory;
        this.depth = depth;
    }

    /**
     * Frame executing a module body. Its locals are the module's member map, so module-level assignments become
     * module attributes.
     *
     * @param directory directory the module lives in; relative imports resolve against it
     */
    public static Frame forModule(PyModule module, ModuleRegistry registry, Path directory) {
        return new Frame(
                module.rawMembers(),
                new LinkedHashMap<>(),
                registry.builtins(),
                FrameType.MODULE,
                module,
                null,
                null,
                module,
                registry,
                directory,
                0);
    }

    /**
     * Creates the frame for a function call, class body or comprehension defined in this frame.
     *
     * @param namespace the object whose body runs in the new frame, for recursion detection
     * @param caller the frame performing the call; becomes the new frame's back link
     */
    public Frame makeChild(FrameType childType, @Nullable Object namespace, Frame caller) {
        return new Frame(
                new LinkedHashMap<>(),
                visibleToChildren(),
                builtins,
                childType,
                namespace,
                caller,
                this,
                module,
                registry,
                directory,
                caller.depth + 1);
    }

    /** Snapshot of what a body nested in this one can see. Class attributes are not visible to nested bodies. */
    private Map<String, Value> visibleToChildren() {
        if (type == FrameType.CLASS && lexicalParent != null) {
            return lexicalParent.visibleToChildren();
        }
        var snapshot = new LinkedHashMap<String, Value>(globals);
        snapshot.putAll(locals);
        return snapshot;
    }

    /**
     * Looks a name up in local, global and builtin order.
     *
     * @throws UndefinedNameException if no namespace binds the name
     */
    public Value getAssignment(String name) {
        return lookup(name).orElseThrow(() -> new UndefinedNameException(name));
    }

    public Optional<Value> lookup(String name) {
        var v = locals.get(name);
        if (v == null) {
            v = globals.get(name);
        }
        if (v == null) {
            v = builtins.get(name);
        }
        return Optional.ofNullable(v);
    }

    public boolean isDefined(String name) {
        return locals.containsKey(name) || globals.containsKey(name) || builtins.containsKey(name);
    }

    public void assign(String name, Value value) {
        locals.put(name, value);
    }

    public void addReturn(Value value) {
        returns.add(value);
    }

    /** None when nothing was returned, otherwise the merge of every returned value. */
    public Value returnValue() {
        if (returns.isEmpty()) {
            return ConcreteValue.none();
        }
        return FuzzyValue.of(returns, namespace, registry.config().maxFuzzyMembers());
    }

    /** True if {@code target} is running in this frame or any frame that (transitively) called it. */
    public boolean isExecuting(Object target) {
        for (Frame f = this; f != null; f = f.back) {
            if (f.namespace == target) {
                return true;
            }
        }
        return false;
    }

    /** Live view of the local bindings. */
    public Map<String, Value> locals() {
        return Collections.unmodifiableMap(locals);
    }

    public Map<String, Value> snapshotLocals() {
        return new LinkedHashMap<>(locals);
    }

    /** Replaces the local bindings in place, keeping the underlying map (which may be a module's members). */
    public void restoreLocals(Map<String, Value> state) {
        locals.clear();
        locals.putAll(state);
    }

    public FrameType type() {
        return type;
    }

    public @Nullable Frame back() {
        return back;
    }

    public PyModule module() {
        return module;
    }

    public ModuleRegistry registry() {
        return registry;
    }

    public Path directory() {
        return directory;
    }

    public int depth() {
        return depth;
    }

    @Override
    public String toString() {
        return "Frame[" + type + ", depth=" + depth + ", locals=" + locals.keySet() + "]";
    }
}
