package ai.importfix.index;

import ai.importfix.analyzer.ModuleKey;
import ai.importfix.cfg.CfgNode;
import ai.importfix.cfg.CfgWalker;
import ai.importfix.frame.ModuleRegistry;
import ai.importfix.lang.PyModule;
import ai.importfix.value.Value;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Loads a module through the session registry and collects the names worth indexing. */
final class ModuleSymbolExtractor {
    private static final Logger logger = LogManager.getLogger(ModuleSymbolExtractor.class);

    /** Fields every module has; indexing them would only add noise. */
    static final Set<String> DEFAULT_MODULE_FIELDS = Set.of(
            "__builtins__",
            "__cached__",
            "__doc__",
            "__file__",
            "__loader__",
            "__name__",
            "__package__",
            "__spec__");

    private final ModuleRegistry registry;

    ModuleSymbolExtractor(ModuleRegistry registry) {
        this.registry = registry;
    }

    ModuleRegistry registry() {
        return registry;
    }

    /**
     * Loads {@code key} fresh and returns its members.
     *
     * @return empty if the module could not be read or parsed
     */
    Optional<ModuleSymbols> extract(ModuleKey key) {
        var name = registry.resolver().moduleNameFor(key).orElseGet(key::basename);
        registry.forget(key);
        var module = (PyModule) registry.moduleFor(key, name).underlying();
        if (!module.isResolved()) {
            return Optional.empty();
        }
        if (module.isNative()) {
            return Optional.of(new ModuleSymbols(key, Map.of(), Set.of(), null));
        }
        try {
            module.ensureLoaded();
        } catch (RuntimeException e) {
            logger.warn("Error while evaluating module {}: {}", key, e.toString());
            return Optional.empty();
        }
        var graph = module.graph();
        if (graph == null) {
            return Optional.empty();
        }
        var members = new LinkedHashMap<String, Value>();
        module.rawMembers().forEach((member, value) -> {
            if (!DEFAULT_MODULE_FIELDS.contains(member)) {
                members.put(member, value);
            }
        });
        var directory = key.path().getParent();
        return Optional.of(new ModuleSymbols(key, members, importedNames(graph, directory), graph));
    }

    /** Names bound by imports outside any function or class body. */
    private Set<String> importedNames(CfgNode graph, Path directory) {
        var names = new HashSet<String>();
        CfgWalker.walk(graph, false, node -> {
            if (node instanceof CfgNode.Import imp) {
                var path = imp.modulePath();
                int dot = path.indexOf('.');
                names.add(imp.alias() != null ? imp.alias() : dot < 0 ? path : path.substring(0, dot));
            } else if (node instanceof CfgNode.FromImport from) {
                if (from.wildcard()) {
                    var imported = (PyModule) registry.importModule(from.modulePath(), directory).underlying();
                    if (imported.isResolved() && !imported.isNative()) {
                        names.addAll(imported.publicNames());
                    }
                } else {
                    from.names().forEach((member, alias) -> names.add(alias != null ? alias : member));
                }
            }
        });
        return names;
    }
}
