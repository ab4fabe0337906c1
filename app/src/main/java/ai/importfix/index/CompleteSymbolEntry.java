package ai.importfix.index;

import ai.importfix.analyzer.ModuleKey;
import org.jetbrains.annotations.Nullable;

/**
 * A lookup result: the entry a name resolves to, plus the alias it was reached through, if any.
 *
 * @param symbolName the name that was looked up
 */
public record CompleteSymbolEntry(SymbolEntry entry, String symbolName, @Nullable SymbolAlias alias) {

    /** The name to import from the module; differs from {@link #symbolName} for aliases. */
    public String realName() {
        return alias != null ? alias.realName() : symbolName;
    }

    public boolean isAlias() {
        return alias != null;
    }

    public SymbolType symbolType() {
        return entry.symbolType();
    }

    public ModuleKey moduleKey() {
        return entry.moduleKey();
    }

    public boolean isModuleItself() {
        return entry.isModuleItself();
    }

    public boolean isImported() {
        return entry.isImported();
    }

    /** The alias's own count when reached through an alias, otherwise the entry's. */
    public int importCount() {
        return alias != null ? alias.importCount() : entry.importCount();
    }

    public boolean isFromNativeModule() {
        return entry.moduleKey().isNative();
    }
}
