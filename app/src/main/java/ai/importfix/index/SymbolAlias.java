package ai.importfix.index;

import ai.importfix.analyzer.ModuleKey;

/** A name some file binds with {@code as}, pointing back at the real name in its module. */
public final class SymbolAlias {
    private final String realName;
    private final ModuleKey moduleKey;
    private final boolean moduleItself;
    private int importCount;

    SymbolAlias(String realName, ModuleKey moduleKey, boolean moduleItself, int importCount) {
        this.realName = realName;
        this.moduleKey = moduleKey;
        this.moduleItself = moduleItself;
        this.importCount = importCount;
    }

    public String realName() {
        return realName;
    }

    public ModuleKey moduleKey() {
        return moduleKey;
    }

    public boolean isModuleItself() {
        return moduleItself;
    }

    public int importCount() {
        return importCount;
    }

    void adjustImportCount(int delta) {
        importCount += delta;
    }

    Key key() {
        return new Key(realName, moduleKey, moduleItself);
    }

    record Key(String realName, ModuleKey moduleKey, boolean moduleItself) {}
}
