package ai.importfix.index;

import ai.importfix.analyzer.ModuleKey;

/**
 * One place a name can be imported from. Mutable: a {@link LocationIndex} updates entries in place as files are
 * rescanned and imports are counted.
 */
public final class SymbolEntry {
    private SymbolType symbolType;
    private final ModuleKey moduleKey;
    private final boolean moduleItself;
    private boolean notYetFoundInModule;
    private boolean imported;
    private int importCount;

    SymbolEntry(
            SymbolType symbolType,
            ModuleKey moduleKey,
            boolean moduleItself,
            boolean notYetFoundInModule,
            boolean imported,
            int importCount) {
        this.symbolType = symbolType;
        this.moduleKey = moduleKey;
        this.moduleItself = moduleItself;
        this.notYetFoundInModule = notYetFoundInModule;
        this.imported = imported;
        this.importCount = importCount;
    }

    public SymbolType symbolType() {
        return symbolType;
    }

    public ModuleKey moduleKey() {
        return moduleKey;
    }

    /** True for the entry that stands for the module itself rather than one of its members. */
    public boolean isModuleItself() {
        return moduleItself;
    }

    /**
     * True while the entry exists only because other files import it and a scan of the module has not (or no longer)
     * found the name.
     */
    public boolean isNotYetFoundInModule() {
        return notYetFoundInModule;
    }

    /** True if the module binds the name through an import of its own. */
    public boolean isImported() {
        return imported;
    }

    /** How many tracked files import this name from this module. */
    public int importCount() {
        return importCount;
    }

    void setSymbolType(SymbolType symbolType) {
        this.symbolType = symbolType;
    }

    void setNotYetFoundInModule(boolean notYetFoundInModule) {
        this.notYetFoundInModule = notYetFoundInModule;
    }

    void setImported(boolean imported) {
        this.imported = imported;
    }

    void adjustImportCount(int delta) {
        importCount += delta;
    }

    Key key() {
        return new Key(moduleKey, moduleItself);
    }

    record Key(ModuleKey moduleKey, boolean moduleItself) {}

    @Override
    public String toString() {
        return "SymbolEntry[" + symbolType + " in " + moduleKey + (moduleItself ? " (module)" : "")
                + ", imports=" + importCount + "]";
    }
}
