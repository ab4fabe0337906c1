package ai.importfix.index;

import ai.importfix.analyzer.ModuleKey;
import ai.importfix.cfg.CfgNode;
import ai.importfix.value.Value;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * What a scan of one module found.
 *
 * @param members indexable module-level bindings
 * @param importedNames members bound by the module's own module-level imports
 * @param graph the module's statement tree; null for native modules
 */
record ModuleSymbols(
        ModuleKey key, Map<String, Value> members, Set<String> importedNames, @Nullable CfgNode graph) {}
