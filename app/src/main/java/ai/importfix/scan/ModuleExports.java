package ai.importfix.scan;

import ai.importfix.frame.ModuleRegistry;
import ai.importfix.lang.PyModule;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Answers whether a wildcard import provides a name. Source modules are loaded through the session registry, so a
 * module that itself wildcard-imports another already carries those names; a module being loaded further up the
 * import chain exposes what it has bound so far, which ends import cycles.
 */
final class ModuleExports {
    private static final Logger logger = LogManager.getLogger(ModuleExports.class);

    private final ModuleRegistry registry;

    ModuleExports(ModuleRegistry registry) {
        this.registry = registry;
    }

    /** False when the module cannot be resolved, so the name stays missing. */
    boolean provides(String modulePath, Path fromDir, String name) {
        var module = (PyModule) registry.importModule(modulePath, fromDir).underlying();
        if (!module.isResolved()) {
            logger.debug("Wildcard import of unresolvable module {}", modulePath);
            return false;
        }
        if (module.isNative()) {
            // native modules cannot be enumerated
            return true;
        }
        return module.publicNames().contains(name);
    }
}
