package ai.importfix.frame;

import ai.importfix.analyzer.ModuleKey;
import ai.importfix.analyzer.ModuleResolver;
import ai.importfix.analyzer.ParseException;
import ai.importfix.cfg.CfgBuilder;
import ai.importfix.cfg.CfgNode;
import ai.importfix.lang.PyModule;
import ai.importfix.util.AnalysisConfig;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.Value;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/**
 * Module cache for one analysis session. Every import resolves through here, so each module is loaded at most once
 * per session and all importers observe the same module object.
 */
@NullMarked
public final class ModuleRegistry {
    private static final Logger logger = LogManager.getLogger(ModuleRegistry.class);

    private final ModuleResolver resolver;
    private final CfgBuilder builder;
    private final AnalysisConfig config;
    private final Map<ModuleKey, ConcreteValue> modules = new HashMap<>();
    private final Map<String, Value> builtins = Builtins.createNamespace();

    public ModuleRegistry(ModuleResolver resolver, CfgBuilder builder, AnalysisConfig config) {
        this.resolver = resolver;
        this.builder = builder;
        this.config = config;
    }

    /** Resolves and returns the module a (possibly relative) dotted name refers to from {@code fromDir}. */
    public ConcreteValue importModule(String dottedPath, Path fromDir) {
        var key = resolver.resolve(dottedPath, fromDir);
        var name = resolver.moduleNameFor(key).orElseGet(() -> stripLeadingDots(dottedPath));
        return moduleFor(key, name);
    }

    /** The module object for a key, created on first request. Source modules are not loaded until used. */
    public ConcreteValue moduleFor(ModuleKey key, String name) {
        var existing = modules.get(key);
        if (existing != null) {
            return existing;
        }
        var module = switch (key.sourceType()) {
            case BAD -> {
                logger.debug("Unresolvable module {}", name);
                yield PyModule.unresolved(name, key);
            }
            case BUILTIN, COMPILED -> PyModule.nativeModule(name, key);
            case NORMAL -> PyModule.lazy(name, key, this::load);
        };
        var value = ConcreteValue.of(module);
        modules.put(key, value);
        return value;
    }

    /** The module for {@code key} if this session created it. */
    public Optional<PyModule> module(ModuleKey key) {
        return Optional.ofNullable(modules.get(key)).map(v -> (PyModule) v.underlying());
    }

    /** Drops a cached module so the next import reloads it. */
    public void forget(ModuleKey key) {
        modules.remove(key);
    }

    /**
     * Runs a module body in a fresh module frame. The module's standard dunders are set first.
     *
     * @param directory directory relative imports resolve against
     */
    public Frame execute(PyModule module, CfgNode graph, Path directory) {
        var frame = Frame.forModule(module, this, directory);
        var members = module.rawMembers();
        members.putIfAbsent("__name__", ConcreteValue.of(module.name()));
        members.putIfAbsent("__doc__", ConcreteValue.none());
        int dot = module.name().lastIndexOf('.');
        members.putIfAbsent("__package__", ConcreteValue.of(dot < 0 ? "" : module.name().substring(0, dot)));
        if (module.key().isFileBacked()) {
            members.putIfAbsent("__file__", ConcreteValue.of(module.key().id()));
        }
        graph.process(frame);
        return frame;
    }

    private void load(PyModule module) {
        var key = module.key();
        String source;
        try {
            source = resolver.readSource(key);
        } catch (IOException e) {
            logger.warn("Could not read module {}: {}", key, e.getMessage());
            return;
        }
        CfgNode graph;
        try {
            graph = builder.build(source);
        } catch (ParseException e) {
            logger.warn("Could not parse module {}: {}", key, e.getMessage());
            return;
        }
        module.setGraph(graph);
        logger.trace("Loading module {}", module.name());
        execute(module, graph, key.path().getParent());
    }

    public Map<String, Value> builtins() {
        return builtins;
    }

    public AnalysisConfig config() {
        return config;
    }

    public CfgBuilder builder() {
        return builder;
    }

    public ModuleResolver resolver() {
        return resolver;
    }

    private static String stripLeadingDots(String dottedPath) {
        int i = 0;
        while (i < dottedPath.length() && dottedPath.charAt(i) == '.') {
            i++;
        }
        return dottedPath.substring(i);
    }
}
